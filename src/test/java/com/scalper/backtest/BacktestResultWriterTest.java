package com.scalper.backtest;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scalper.strategy.Direction;

class BacktestResultWriterTest {

	private final ObjectMapper objectMapper = new ObjectMapper();
	private final BacktestResultWriter writer = new BacktestResultWriter(objectMapper);

	@TempDir
	Path tempDir;

	@Test
	void writesTradesCurveAndMetricsAsJson() throws IOException {
		ClosedTrade trade = new ClosedTrade(1_000L, 2_000L, Direction.LONG, 2340.1, 2344.0, 2338.0, 2338.0, 2344.0,
				50L, 3, List.of("HTF trend bullish"), CloseReason.TAKE_PROFIT, 195.0, 1.86);
		List<EquityPoint> curve = List.of(new EquityPoint(1_000L, 9_998.0), new EquityPoint(2_000L, 10_193.0));
		BacktestResult result = new BacktestResult(List.of(trade), curve,
				PerformanceCalculator.calculate(List.of(trade), curve, 10_000.0, 10_193.0));

		Path written = writer.write(result, tempDir.resolve("results"));

		assertEquals(tempDir.resolve("results").resolve(BacktestResultWriter.RESULTS_FILE), written);
		JsonNode root = objectMapper.readTree(written.toFile());
		assertEquals("TAKE_PROFIT", root.path("trades").get(0).path("closeReason").asText());
		assertEquals("LONG", root.path("trades").get(0).path("direction").asText());
		assertEquals(2, root.path("equityCurve").size());
		assertEquals(1, root.path("metrics").path("totalTrades").asInt());
		assertEquals("Infinity", root.path("metrics").path("profitFactor").asText());
		assertTrue(Files.readString(written).contains(System.lineSeparator()));
	}

	@Test
	void wrapsWriteFailures() throws IOException {
		Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");

		assertThatThrownBy(() -> writer.write(new BacktestResult(List.of(), List.of(),
				BacktestMetrics.empty(10_000.0, 10_000.0)), blocker))
				.isInstanceOf(UncheckedIOException.class);
	}
}

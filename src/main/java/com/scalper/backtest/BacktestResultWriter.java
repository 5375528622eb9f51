package com.scalper.backtest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

public class BacktestResultWriter {

	public static final String RESULTS_FILE = "backtest_results.json";

	private static final Logger LOGGER = LoggerFactory.getLogger(BacktestResultWriter.class);

	private final ObjectMapper objectMapper;

	public BacktestResultWriter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public Path write(BacktestResult result, Path resultsDir) {
		Path target = resultsDir.resolve(RESULTS_FILE);
		try {
			Files.createDirectories(resultsDir);
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), result);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write backtest results to " + target, e);
		}
		LOGGER.info("EVENT=BACKTEST_RESULTS_SAVED path={} trades={}", target, result.trades().size());
		return target;
	}
}

package com.scalper.backtest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.scalper.config.BacktestProperties;
import com.scalper.config.IndicatorProperties;
import com.scalper.config.RiskProperties;
import com.scalper.config.StrategyProperties;
import com.scalper.market.Bar;
import com.scalper.market.BarFixtures;
import com.scalper.risk.RiskManager;
import com.scalper.strategy.ConfluenceSignalGenerator;
import com.scalper.strategy.Direction;
import com.scalper.strategy.Signal;
import com.scalper.strategy.SignalGenerator;
import com.scalper.strategy.indicators.BarEnricher;

class BacktestSimulatorTest {

	private static final int SIGNAL_INDEX = 60;
	private static final long FIFTEEN_MINUTES = Duration.ofMinutes(15).toMillis();

	private final BarEnricher enricher = new BarEnricher(IndicatorProperties.defaults());
	private final RiskManager riskManager = new RiskManager(RiskProperties.defaults());

	@Test
	void fillsOnNextOpenAndExitsAtTarget() {
		List<Bar> bars = flatBars(80);
		bars.set(65, Bar.of(bars.get(65).time(), 2340.0, 2345.0, 2339.5, 2344.5, 100L));

		BacktestResult result = simulator(properties(false), longAt(SIGNAL_INDEX, bars)).run(bars);

		assertEquals(1, result.trades().size());
		ClosedTrade trade = result.trades().get(0);
		assertEquals(bars.get(SIGNAL_INDEX + 1).time(), trade.entryTime());
		assertEquals(bars.get(65).time(), trade.exitTime());
		assertEquals(2340.1, trade.entryPrice(), 1e-9);
		assertEquals(50L, trade.units());
		assertEquals(CloseReason.TAKE_PROFIT, trade.closeReason());
		assertEquals(2344.0, trade.exitPrice(), 1e-9);
		assertEquals(195.0, trade.pnl(), 1e-6);

		assertEquals(29, result.equityCurve().size());
		assertEquals(10_000.0, result.equityCurve().get(SIGNAL_INDEX - 51).equity(), 1e-9);
		assertEquals(9_998.0, result.equityCurve().get(SIGNAL_INDEX - 50).equity(), 1e-9);
		assertEquals(10_193.0, result.metrics().finalEquity(), 1e-9);
		assertEquals(10_193.0, result.equityCurve().get(result.equityCurve().size() - 1).equity(), 1e-6);
	}

	@Test
	void stopWinsWhenNextBarSpansBothLevels() {
		List<Bar> bars = flatBars(80);
		bars.set(63, Bar.of(bars.get(63).time(), 2340.0, 2345.0, 2337.0, 2340.0, 100L));

		ClosedTrade trade = simulator(properties(false), longAt(SIGNAL_INDEX, bars)).run(bars).trades().get(0);

		assertEquals(CloseReason.STOP_LOSS, trade.closeReason());
		assertEquals(2338.0, trade.exitPrice(), 1e-9);
		assertEquals(-105.0, trade.pnl(), 1e-6);
	}

	@Test
	void openPositionIsClosedAtFinalClose() {
		List<Bar> bars = flatBars(80);

		BacktestResult result = simulator(properties(false), longAt(SIGNAL_INDEX, bars)).run(bars);

		ClosedTrade trade = result.trades().get(0);
		assertEquals(CloseReason.END_OF_DATA, trade.closeReason());
		assertEquals(bars.get(79).time(), trade.exitTime());
		assertEquals(-5.0, trade.pnl(), 1e-6);
		assertEquals(9_993.0, result.metrics().finalEquity(), 1e-9);
	}

	@Test
	void trailingStopLocksInProfit() {
		List<Bar> bars = flatBars(80);
		bars.set(62, Bar.of(bars.get(62).time(), 2340.0, 2343.3, 2339.9, 2343.0, 100L));
		bars.set(63, Bar.of(bars.get(63).time(), 2343.0, 2343.2, 2341.0, 2341.5, 100L));

		ClosedTrade trade = simulator(properties(true), longAt(SIGNAL_INDEX, bars)).run(bars).trades().get(0);

		assertEquals(CloseReason.STOP_LOSS, trade.closeReason());
		assertThat(trade.finalStop()).isGreaterThan(trade.initialStop());
		assertEquals(trade.finalStop(), trade.exitPrice(), 1e-9);
		assertThat(trade.pnl()).isPositive();
	}

	@Test
	void tooFewBarsIsAHardFailure() {
		List<Bar> bars = flatBars(59);

		assertThatThrownBy(() -> simulator(properties(false), (recent, htf) -> Optional.empty()).run(bars))
				.isInstanceOf(InsufficientHistoryException.class)
				.hasMessageContaining("required=60");
	}

	@Test
	void generatorNeverSeesLaterBars() {
		List<Bar> bars = BarFixtures.wave(120);
		List<long[]> calls = new ArrayList<>();
		SignalGenerator recording = (recent, htf) -> {
			long now = recent.get(recent.size() - 1).time();
			long lastBucket = htf.isEmpty() ? Long.MIN_VALUE : htf.get(htf.size() - 1).time();
			calls.add(new long[] { now, lastBucket });
			return Optional.empty();
		};

		simulator(properties(false), recording).run(bars);

		assertEquals(bars.size() - 1 - 50, calls.size());
		for (int i = 0; i < calls.size(); i++) {
			long now = calls.get(i)[0];
			assertEquals(bars.get(50 + i).time(), now);
			assertTrue(calls.get(i)[1] + FIFTEEN_MINUTES <= Math.floorDiv(now, FIFTEEN_MINUTES) * FIFTEEN_MINUTES);
		}
	}

	@Test
	void truncatingHistoryDoesNotChangeEarlierInputs() {
		List<Bar> bars = BarFixtures.wave(160);
		Map<Long, List<Bar>> full = new LinkedHashMap<>();
		Map<Long, List<Bar>> truncated = new LinkedHashMap<>();

		simulator(properties(false), capture(full)).run(bars);
		simulator(properties(false), capture(truncated)).run(bars.subList(0, 110));

		assertThat(truncated).isNotEmpty();
		truncated.forEach((time, inputs) -> assertEquals(full.get(time), inputs));
	}

	@Test
	void identicalInputGivesIdenticalResult() {
		BacktestProperties props = new BacktestProperties(false, BacktestProperties.DataSource.SYNTHETIC,
				10_000.0, 0.25, 2.0, 0, 24, 250, 10, Duration.ofMinutes(15), true, Path.of("logs"), false);
		SignalGenerator generator = new ConfluenceSignalGenerator(StrategyProperties.defaults());
		List<Bar> bars = BarFixtures.wave(1_200);

		BacktestResult first = new BacktestSimulator(props, enricher, generator, riskManager).run(bars);
		BacktestResult second = new BacktestSimulator(props, enricher, generator, riskManager).run(bars);

		assertEquals(first, second);
		assertEquals(1_200 - 1 - 250, first.equityCurve().size());
	}

	private BacktestSimulator simulator(BacktestProperties props, SignalGenerator generator) {
		return new BacktestSimulator(props, enricher, generator, riskManager);
	}

	private static BacktestProperties properties(boolean trailing) {
		return new BacktestProperties(false, BacktestProperties.DataSource.SYNTHETIC, 10_000.0, 0.2, 2.0, 0, 24,
				50, 10, Duration.ofMinutes(15), trailing, Path.of("logs"), false);
	}

	private static List<Bar> flatBars(int count) {
		List<Bar> bars = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			bars.add(Bar.of(BarFixtures.START + i * BarFixtures.FIVE_MINUTES, 2340.0, 2340.5, 2339.5, 2340.0, 100L));
		}
		return bars;
	}

	private static SignalGenerator longAt(int index, List<Bar> bars) {
		long signalTime = bars.get(index).time();
		return (recent, htf) -> {
			Bar last = recent.get(recent.size() - 1);
			if (last.time() != signalTime) {
				return Optional.empty();
			}
			return Optional.of(new Signal(Direction.LONG, 2340.0, 2338.0, 2344.0, 2.0, 3, 3, false, 1.0,
					List.of("test"), last.time()));
		};
	}

	private static SignalGenerator capture(Map<Long, List<Bar>> sink) {
		return (recent, htf) -> {
			Bar last = recent.get(recent.size() - 1);
			List<Bar> inputs = new ArrayList<>();
			inputs.add(last);
			if (!htf.isEmpty()) {
				inputs.add(htf.get(htf.size() - 1));
			}
			sink.put(last.time(), inputs);
			return Optional.empty();
		};
	}
}

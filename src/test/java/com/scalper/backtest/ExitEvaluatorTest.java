package com.scalper.backtest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.scalper.market.Bar;
import com.scalper.strategy.Direction;
import com.scalper.strategy.Signal;

class ExitEvaluatorTest {

	private final OpenPosition longPosition = new OpenPosition(0L, 2340.0, 10L,
			new Signal(Direction.LONG, 2340.0, 2338.2, 2343.6, 2.0, 3, 3, false, 1.2, List.of(), 0L));
	private final OpenPosition shortPosition = new OpenPosition(0L, 2340.0, 10L,
			new Signal(Direction.SHORT, 2340.0, 2341.8, 2336.4, 2.0, 3, 3, false, 1.2, List.of(), 0L));

	@Test
	void stopWinsWhenBothLevelsTradeInTheSameBar() {
		Optional<ExitEvaluator.Exit> exit = ExitEvaluator.check(longPosition, bar(2344.0, 2338.0));

		assertEquals(CloseReason.STOP_LOSS, exit.orElseThrow().reason());
		assertEquals(2338.2, exit.get().price(), 1e-9);

		Optional<ExitEvaluator.Exit> shortExit = ExitEvaluator.check(shortPosition, bar(2342.0, 2336.0));
		assertEquals(CloseReason.STOP_LOSS, shortExit.orElseThrow().reason());
		assertEquals(2341.8, shortExit.get().price(), 1e-9);
	}

	@Test
	void targetFillsAtTargetLevel() {
		Optional<ExitEvaluator.Exit> exit = ExitEvaluator.check(longPosition, bar(2343.6, 2339.0));

		assertEquals(CloseReason.TAKE_PROFIT, exit.orElseThrow().reason());
		assertEquals(2343.6, exit.get().price(), 1e-9);
		assertEquals(CloseReason.TAKE_PROFIT,
				ExitEvaluator.check(shortPosition, bar(2340.5, 2336.0)).orElseThrow().reason());
	}

	@Test
	void untouchedLevelsKeepPositionOpen() {
		assertTrue(ExitEvaluator.check(longPosition, bar(2343.5, 2338.3)).isEmpty());
		assertTrue(ExitEvaluator.check(shortPosition, bar(2341.7, 2336.5)).isEmpty());
	}

	@Test
	void rMultipleUsesInitialRisk() {
		ClosedTrade trade = longPosition.close(1L, 2343.6, CloseReason.TAKE_PROFIT);

		assertEquals(36.0, trade.pnl(), 1e-6);
		assertEquals(2.0, trade.rMultiple(), 1e-6);
	}

	private static Bar bar(double high, double low) {
		return Bar.of(1L, (high + low) / 2, high, low, (high + low) / 2, 10L);
	}
}

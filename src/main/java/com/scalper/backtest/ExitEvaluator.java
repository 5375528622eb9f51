package com.scalper.backtest;

import java.util.Optional;

import com.scalper.market.Bar;
import com.scalper.strategy.Direction;

public final class ExitEvaluator {

	private ExitEvaluator() {
	}

	// stop wins when both levels are touched
	public static Optional<Exit> check(OpenPosition position, Bar nextBar) {
		boolean isLong = position.direction() == Direction.LONG;
		double stop = position.stopLoss();
		double target = position.takeProfit();

		boolean stopHit = isLong ? nextBar.low() <= stop : nextBar.high() >= stop;
		if (stopHit) {
			return Optional.of(new Exit(stop, CloseReason.STOP_LOSS));
		}
		boolean targetHit = isLong ? nextBar.high() >= target : nextBar.low() <= target;
		if (targetHit) {
			return Optional.of(new Exit(target, CloseReason.TAKE_PROFIT));
		}
		return Optional.empty();
	}

	public record Exit(double price, CloseReason reason) {
	}
}

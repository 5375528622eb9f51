package com.scalper.strategy;

import java.util.List;
import java.util.Locale;

public record Signal(
		Direction direction,
		double entryPrice,
		double stopLoss,
		double takeProfit,
		double riskReward,
		int score,
		int requiredScore,
		boolean counterTrend,
		double atr,
		List<String> reasons,
		long time) {

	public Signal {
		if (direction == null) {
			throw new IllegalArgumentException("Signal direction is required");
		}
		if (Math.signum(entryPrice - stopLoss) != direction.sign()) {
			throw new IllegalArgumentException("Stop " + stopLoss + " is not on the losing side of entry "
					+ entryPrice + " for " + direction);
		}
		if (Math.signum(takeProfit - entryPrice) != direction.sign()) {
			throw new IllegalArgumentException("Target " + takeProfit + " is not on the winning side of entry "
					+ entryPrice + " for " + direction);
		}
		if (score < requiredScore) {
			throw new IllegalArgumentException("Score " + score + " below required " + requiredScore);
		}
		reasons = reasons == null ? List.of() : List.copyOf(reasons);
	}

	public double stopDistance() {
		return Math.abs(entryPrice - stopLoss);
	}

	public static double riskReward(double entryPrice, double stopLoss, double takeProfit) {
		double risk = Math.abs(entryPrice - stopLoss);
		return risk > 0 ? Math.abs(takeProfit - entryPrice) / risk : 0.0;
	}

	public String describe() {
		return String.format(Locale.ROOT, "[%s] @ %.2f | SL: %.2f | TP: %.2f | R:R %.2f | Score %d/%d%s | ATR %.2f | %s",
				direction,
				entryPrice,
				stopLoss,
				takeProfit,
				riskReward,
				score,
				requiredScore,
				counterTrend ? " counter-trend" : "",
				atr,
				String.join(", ", reasons));
	}
}

package com.scalper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "strategy")
public record StrategyProperties(
		@PositiveOrZero double minAtr,
		@Positive double maxAtr,
		@Positive int minConfluenceScore,
		@PositiveOrZero int counterTrendPenalty,
		@Positive double minRiskReward,
		@Positive double slAtrMultiple,
		@Positive double tpRewardMultiple,
		@PositiveOrZero double structuralBufferAtr,
		@Positive double minStopAtrMultiple,
		@PositiveOrZero double bandProximityAtr,
		@PositiveOrZero double swingProximityAtr,
		int divergenceLookback,
		int minBars,
		int minHigherTimeframeBars,
		int pricePrecision,
		double rsiOverbought,
		double rsiOversold,
		double rsiPullbackMidline,
		double stochOverbought,
		double stochOversold) {

	public StrategyProperties {
		if (divergenceLookback <= 1) divergenceLookback = 20;
		if (minBars <= 0) minBars = 100;
		if (minHigherTimeframeBars <= 0) minHigherTimeframeBars = 50;
		if (pricePrecision < 0) pricePrecision = 2;
		if (rsiOverbought <= 0) rsiOverbought = 65.0;
		if (rsiOversold <= 0) rsiOversold = 35.0;
		if (rsiPullbackMidline <= 0) rsiPullbackMidline = 50.0;
		if (stochOverbought <= 0) stochOverbought = 80.0;
		if (stochOversold <= 0) stochOversold = 20.0;
	}

	public static StrategyProperties defaults() {
		return new StrategyProperties(0.20, 5.00, 3, 1, 1.8, 1.5, 2.0, 0.2, 0.3, 0.3, 0.5,
				20, 100, 50, 2, 65.0, 35.0, 50.0, 80.0, 20.0);
	}

	public int requiredScore(boolean counterTrend) {
		return counterTrend ? minConfluenceScore + counterTrendPenalty : minConfluenceScore;
	}
}

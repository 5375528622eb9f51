package com.scalper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "risk")
public record RiskProperties(
		@Positive double maxRiskPct,
		@Positive double maxRiskUsd,
		@Positive int maxOpenPositions,
		@Positive double maxDailyDrawdownPct,
		@Positive double maxDailyLossUsd,
		@Positive int maxTradesPerDay,
		@PositiveOrZero long cooldownMinutes,
		@Positive double trailActivationAtrMultiple,
		@Positive double trailDistanceAtrMultiple,
		@PositiveOrZero double breakevenOffset,
		long minUnits) {

	public RiskProperties {
		if (minUnits <= 0) minUnits = 1;
	}

	public static RiskProperties defaults() {
		return new RiskProperties(1.0, 200.0, 2, 3.0, 500.0, 5, 15, 1.0, 0.8, 0.05, 1);
	}

	public double riskFraction() {
		return maxRiskPct / 100.0;
	}
}

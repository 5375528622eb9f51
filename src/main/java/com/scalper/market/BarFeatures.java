package com.scalper.market;

public record BarFeatures(
		Double emaFast,
		Double emaSlow,
		Double emaTrend,
		Double rsi,
		Double rsiSlope,
		Double macdLine,
		Double macdSignal,
		Double macdHistogram,
		Double stochK,
		Double stochD,
		Double atr,
		Double bbUpper,
		Double bbMiddle,
		Double bbLower,
		Double bbPercentB,
		boolean swingHighConfirmed,
		boolean swingLowConfirmed,
		Double lastSwingHigh,
		Double lastSwingLow,
		TrendDirection trend) {

	public static final BarFeatures EMPTY = new BarFeatures(null, null, null, null, null, null, null, null, null,
			null, null, null, null, null, null, false, false, null, null, null);

	// swing levels are not part of readiness
	public boolean isIndicatorReady() {
		return emaFast != null && emaSlow != null && emaTrend != null
				&& rsi != null && rsiSlope != null
				&& macdLine != null && macdSignal != null && macdHistogram != null
				&& stochK != null && stochD != null
				&& atr != null
				&& bbUpper != null && bbMiddle != null && bbLower != null && bbPercentB != null
				&& trend != null;
	}
}

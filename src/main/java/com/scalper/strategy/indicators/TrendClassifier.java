package com.scalper.strategy.indicators;

import com.scalper.market.TrendDirection;

public final class TrendClassifier {

	private TrendClassifier() {
	}

	// null while any average is still warming up
	public static TrendDirection classify(double close, Double emaFast, Double emaSlow, Double emaTrend) {
		if (emaFast == null || emaSlow == null || emaTrend == null) {
			return null;
		}
		if (emaFast > emaSlow && emaSlow > emaTrend && close > emaTrend) {
			return TrendDirection.BULLISH;
		}
		if (emaFast < emaSlow && emaSlow < emaTrend && close < emaTrend) {
			return TrendDirection.BEARISH;
		}
		return TrendDirection.NEUTRAL;
	}
}

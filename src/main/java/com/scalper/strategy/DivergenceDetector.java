package com.scalper.strategy;

import java.util.List;

import com.scalper.market.Bar;

public final class DivergenceDetector {

	private DivergenceDetector() {
	}

	public static Divergence classify(List<Bar> bars, int lookback) {
		if (bars == null || lookback < 2 || bars.size() < lookback) {
			return Divergence.NONE;
		}
		int start = bars.size() - lookback;
		int half = lookback / 2;
		Extremes first = scan(bars, start, start + half);
		Extremes second = scan(bars, start + half, bars.size());
		if (!first.hasRsi() || !second.hasRsi()) {
			return Divergence.NONE;
		}
		if (second.closeLow() < first.closeLow() && second.rsiLow() > first.rsiLow()) {
			return Divergence.BULLISH;
		}
		if (second.closeHigh() > first.closeHigh() && second.rsiHigh() < first.rsiHigh()) {
			return Divergence.BEARISH;
		}
		return Divergence.NONE;
	}

	private static Extremes scan(List<Bar> bars, int fromInclusive, int toExclusive) {
		double closeLow = Double.POSITIVE_INFINITY;
		double closeHigh = Double.NEGATIVE_INFINITY;
		double rsiLow = Double.POSITIVE_INFINITY;
		double rsiHigh = Double.NEGATIVE_INFINITY;
		for (int i = fromInclusive; i < toExclusive; i++) {
			Bar bar = bars.get(i);
			closeLow = Math.min(closeLow, bar.close());
			closeHigh = Math.max(closeHigh, bar.close());
			Double rsi = bar.features().rsi();
			if (rsi != null) {
				rsiLow = Math.min(rsiLow, rsi);
				rsiHigh = Math.max(rsiHigh, rsi);
			}
		}
		return new Extremes(closeLow, closeHigh, rsiLow, rsiHigh);
	}

	private record Extremes(double closeLow, double closeHigh, double rsiLow, double rsiHigh) {

		boolean hasRsi() {
			return Double.isFinite(rsiLow) && Double.isFinite(rsiHigh);
		}
	}
}

package com.scalper.strategy.indicators;

import java.util.ArrayList;
import java.util.List;

import com.scalper.market.Bar;

/**
 * Fractal swing pivots. A pivot at index {@code p} needs {@code window} bars on each side, so it
 * is only published on bar {@code p + window}; every level a bar carries was knowable at that
 * bar's close.
 */
public final class SwingDetector {

	private SwingDetector() {
	}

	public static List<SwingState> detect(List<Bar> bars, int window) {
		if (window <= 0) {
			throw new IllegalArgumentException("Swing window must be positive: " + window);
		}
		List<SwingState> states = new ArrayList<>(bars.size());
		Double lastHigh = null;
		Double lastLow = null;
		for (int confirmIndex = 0; confirmIndex < bars.size(); confirmIndex++) {
			int pivot = confirmIndex - window;
			boolean highConfirmed = false;
			boolean lowConfirmed = false;
			if (pivot - window >= 0) {
				Bar candidate = bars.get(pivot);
				double maxHigh = Double.NEGATIVE_INFINITY;
				double minLow = Double.POSITIVE_INFINITY;
				for (int j = pivot - window; j <= confirmIndex; j++) {
					maxHigh = Math.max(maxHigh, bars.get(j).high());
					minLow = Math.min(minLow, bars.get(j).low());
				}
				if (candidate.high() == maxHigh) {
					highConfirmed = true;
					lastHigh = candidate.high();
				}
				if (candidate.low() == minLow) {
					lowConfirmed = true;
					lastLow = candidate.low();
				}
			}
			states.add(new SwingState(highConfirmed, lowConfirmed, lastHigh, lastLow));
		}
		return states;
	}

	public record SwingState(
			boolean highConfirmed,
			boolean lowConfirmed,
			Double lastSwingHigh,
			Double lastSwingLow) {
	}
}

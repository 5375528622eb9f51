package com.scalper.market;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

public record Bar(
		long time,
		double open,
		double high,
		double low,
		double close,
		long volume,
		BarFeatures features) {

	public Bar {
		if (features == null) {
			features = BarFeatures.EMPTY;
		}
	}

	public static Bar of(long time, double open, double high, double low, double close, long volume) {
		return new Bar(time, open, high, low, close, volume, BarFeatures.EMPTY);
	}

	public Bar withFeatures(BarFeatures newFeatures) {
		return new Bar(time, open, high, low, close, volume, newFeatures);
	}

	public Double atr() {
		return features.atr();
	}

	public LocalDate utcDate() {
		return Instant.ofEpochMilli(time).atZone(ZoneOffset.UTC).toLocalDate();
	}

	public int utcHour() {
		return Instant.ofEpochMilli(time).atZone(ZoneOffset.UTC).getHour();
	}

	public static void requireStrictlyIncreasing(List<Bar> bars) {
		for (int i = 1; i < bars.size(); i++) {
			if (bars.get(i).time() <= bars.get(i - 1).time()) {
				throw new IllegalArgumentException("Bar timestamps must be strictly increasing: index=" + i
						+ " time=" + bars.get(i).time() + " previous=" + bars.get(i - 1).time());
			}
		}
	}
}

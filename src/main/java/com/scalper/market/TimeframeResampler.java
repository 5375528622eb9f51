package com.scalper.market;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class TimeframeResampler {

	private final long widthMs;

	private long bucket = Long.MIN_VALUE;
	private Bar current;

	public TimeframeResampler(Duration width) {
		if (width == null || width.isZero() || width.isNegative()) {
			throw new IllegalArgumentException("Bucket width must be positive: " + width);
		}
		this.widthMs = width.toMillis();
	}

	public long bucketStart(long time) {
		return Math.floorDiv(time, widthMs) * widthMs;
	}

	public Optional<Bar> update(Bar bar) {
		long currentBucket = bucketStart(bar.time());
		if (current == null) {
			current = Bar.of(currentBucket, bar.open(), bar.high(), bar.low(), bar.close(), bar.volume());
			bucket = currentBucket;
			return Optional.empty();
		}
		if (currentBucket != bucket) {
			Bar completed = current;
			current = Bar.of(currentBucket, bar.open(), bar.high(), bar.low(), bar.close(), bar.volume());
			bucket = currentBucket;
			return Optional.of(completed);
		}

		double high = Math.max(current.high(), bar.high());
		double low = Math.min(current.low(), bar.low());
		long volume = current.volume() + bar.volume();
		current = Bar.of(current.time(), current.open(), high, low, bar.close(), volume);
		return Optional.empty();
	}

	public Optional<Bar> flush() {
		Bar pending = current;
		current = null;
		bucket = Long.MIN_VALUE;
		return Optional.ofNullable(pending);
	}

	public static List<Bar> resample(List<Bar> bars, Duration width) {
		TimeframeResampler resampler = new TimeframeResampler(width);
		List<Bar> out = new ArrayList<>();
		for (Bar bar : bars) {
			resampler.update(bar).ifPresent(out::add);
		}
		resampler.flush().ifPresent(out::add);
		return out;
	}
}

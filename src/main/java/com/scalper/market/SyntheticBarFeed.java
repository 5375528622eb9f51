package com.scalper.market;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scalper.config.MarketDataProperties;

public class SyntheticBarFeed implements BarFeed {

	private static final Logger LOGGER = LoggerFactory.getLogger(SyntheticBarFeed.class);

	private static final double DRIFT_PER_BAR = 0.25;
	private static final double NOISE_RANGE = 3.0;
	private static final int MIN_LEG_BARS = 120;
	private static final int LEG_JITTER_BARS = 180;

	private final MarketDataProperties.SyntheticConfig config;

	public SyntheticBarFeed(MarketDataProperties properties) {
		this.config = properties.synthetic();
	}

	@Override
	public List<Bar> fetchBars(Duration timeframe, int count) {
		int bars = count > 0 ? count : config.bars();
		Random random = new Random(config.seed());
		long intervalMs = timeframe.toMillis();
		long startMs = config.startTime().toEpochMilli();

		List<Bar> series = new ArrayList<>(bars);
		double price = config.startPrice();
		int trendDir = 1;
		int barsInTrend = 0;
		int legLength = MIN_LEG_BARS + random.nextInt(LEG_JITTER_BARS);

		for (int i = 0; i < bars; i++) {
			barsInTrend++;
			if (barsInTrend >= legLength) {
				trendDir = -trendDir;
				barsInTrend = 0;
				legLength = MIN_LEG_BARS + random.nextInt(LEG_JITTER_BARS);
			}
			double change = trendDir * DRIFT_PER_BAR + (random.nextDouble() - 0.5) * NOISE_RANGE;
			double open = price;
			double close = Math.max(0.01, price + change);
			double wickUp = random.nextDouble() * (trendDir < 0 ? 1.0 : 0.5);
			double wickDown = random.nextDouble() * (trendDir > 0 ? 1.0 : 0.5);
			double high = Math.max(open, close) + wickUp;
			double low = Math.max(0.01, Math.min(open, close) - wickDown);
			long volume = 200L + random.nextInt(1000);

			series.add(Bar.of(startMs + i * intervalMs, round2(open), round2(high), round2(low), round2(close), volume));
			price = close;
		}
		LOGGER.info("EVENT=SYNTHETIC_SERIES bars={} seed={} timeframe={}", series.size(), config.seed(), timeframe);
		return series;
	}

	private static double round2(double value) {
		return Math.round(value * 100.0) / 100.0;
	}
}

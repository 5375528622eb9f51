package com.scalper.strategy.indicators;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.StochasticOscillatorKIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.DoubleNum;
import org.ta4j.core.num.Num;

import com.scalper.config.IndicatorProperties;
import com.scalper.market.Bar;
import com.scalper.market.BarFeatures;
import com.scalper.market.TrendDirection;

/**
 * Attaches indicator values, swing levels and trend classification to raw bars. Every value at
 * index {@code i} is derived from bars {@code 0..i} only.
 */
public class BarEnricher {

	private static final Logger LOGGER = LoggerFactory.getLogger(BarEnricher.class);

	private final IndicatorProperties properties;

	public BarEnricher(IndicatorProperties properties) {
		this.properties = properties;
	}

	public List<Bar> enrich(List<Bar> bars) {
		if (bars == null || bars.isEmpty()) {
			return List.of();
		}
		Bar.requireStrictlyIncreasing(bars);
		BarSeries series = createBarSeries(bars);

		ClosePriceIndicator close = new ClosePriceIndicator(series);
		EMAIndicator emaFast = new EMAIndicator(close, properties.emaFast());
		EMAIndicator emaSlow = new EMAIndicator(close, properties.emaSlow());
		EMAIndicator emaTrend = new EMAIndicator(close, properties.emaTrend());
		RSIIndicator rsi = new RSIIndicator(close, properties.rsiPeriod());
		MACDIndicator macd = new MACDIndicator(close, properties.macdFast(), properties.macdSlow());
		EMAIndicator macdSignal = new EMAIndicator(macd, properties.macdSignal());
		StochasticOscillatorKIndicator stochK = new StochasticOscillatorKIndicator(series, properties.stochK());
		SMAIndicator stochD = new SMAIndicator(stochK, properties.stochD());
		ATRIndicator atr = new ATRIndicator(series, properties.atrPeriod());
		BollingerBandsMiddleIndicator bbMiddle = new BollingerBandsMiddleIndicator(
				new SMAIndicator(close, properties.bbPeriod()));
		StandardDeviationIndicator stdDev = new StandardDeviationIndicator(close, properties.bbPeriod());
		BollingerBandsUpperIndicator bbUpper = new BollingerBandsUpperIndicator(bbMiddle, stdDev,
				series.numOf(properties.bbStd()));
		BollingerBandsLowerIndicator bbLower = new BollingerBandsLowerIndicator(bbMiddle, stdDev,
				series.numOf(properties.bbStd()));

		List<SwingDetector.SwingState> swings = SwingDetector.detect(bars, properties.swingWindow());

		int emaFastReady = properties.emaFast() - 1;
		int emaSlowReady = properties.emaSlow() - 1;
		int emaTrendReady = properties.emaTrend() - 1;
		int rsiReady = properties.rsiPeriod();
		int rsiSlopeReady = properties.rsiPeriod() + properties.rsiSlopeBars();
		int macdReady = properties.macdSlow() - 1;
		int macdSignalReady = properties.macdSlow() + properties.macdSignal() - 2;
		int stochKReady = properties.stochK() - 1;
		int stochDReady = properties.stochK() + properties.stochD() - 2;
		int atrReady = properties.atrPeriod();
		int bbReady = properties.bbPeriod() - 1;

		List<Bar> enriched = new ArrayList<>(bars.size());
		for (int i = 0; i < bars.size(); i++) {
			Bar bar = bars.get(i);
			Double fast = valueAt(emaFast, i, emaFastReady);
			Double slow = valueAt(emaSlow, i, emaSlowReady);
			Double trendEma = valueAt(emaTrend, i, emaTrendReady);
			Double rsiValue = valueAt(rsi, i, rsiReady);
			Double rsiSlope = null;
			if (i >= rsiSlopeReady) {
				Double prior = valueAt(rsi, i - properties.rsiSlopeBars(), rsiReady);
				rsiSlope = rsiValue != null && prior != null ? rsiValue - prior : null;
			}
			Double macdLine = valueAt(macd, i, macdReady);
			Double signalLine = valueAt(macdSignal, i, macdSignalReady);
			Double histogram = macdLine != null && signalLine != null ? macdLine - signalLine : null;
			Double upper = valueAt(bbUpper, i, bbReady);
			Double middle = valueAt(bbMiddle, i, bbReady);
			Double lower = valueAt(bbLower, i, bbReady);
			Double percentB = resolvePercentB(bar.close(), upper, lower);
			SwingDetector.SwingState swing = swings.get(i);
			TrendDirection trend = TrendClassifier.classify(bar.close(), fast, slow, trendEma);

			BarFeatures features = new BarFeatures(
					fast,
					slow,
					trendEma,
					rsiValue,
					rsiSlope,
					macdLine,
					signalLine,
					histogram,
					valueAt(stochK, i, stochKReady),
					valueAt(stochD, i, stochDReady),
					valueAt(atr, i, atrReady),
					upper,
					middle,
					lower,
					percentB,
					swing.highConfirmed(),
					swing.lowConfirmed(),
					swing.lastSwingHigh(),
					swing.lastSwingLow(),
					trend);
			enriched.add(bar.withFeatures(features));
		}
		LOGGER.debug("Enriched {} bars", enriched.size());
		return enriched;
	}

	private BarSeries createBarSeries(List<Bar> bars) {
		BarSeries series = new BaseBarSeriesBuilder()
				.withName("enrich")
				.withNumTypeOf(DoubleNum.class)
				.build();
		for (Bar bar : bars) {
			series.addBar(Instant.ofEpochMilli(bar.time()).atZone(ZoneOffset.UTC),
					bar.open(),
					bar.high(),
					bar.low(),
					bar.close(),
					bar.volume());
		}
		return series;
	}

	private static Double valueAt(Indicator<Num> indicator, int index, int readyIndex) {
		if (index < readyIndex || index < 0) {
			return null;
		}
		double value = indicator.getValue(index).doubleValue();
		return Double.isFinite(value) ? value : null;
	}

	private static Double resolvePercentB(double close, Double upper, Double lower) {
		if (upper == null || lower == null) {
			return null;
		}
		double width = upper - lower;
		return width > 0 ? (close - lower) / width : 0.5;
	}
}

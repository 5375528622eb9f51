package com.scalper.strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scalper.config.StrategyProperties;
import com.scalper.market.Bar;
import com.scalper.market.BarFeatures;
import com.scalper.market.TrendDirection;

public class ConfluenceSignalGenerator implements SignalGenerator {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConfluenceSignalGenerator.class);
	private static final double RR_TOLERANCE = 1e-9;

	private final StrategyProperties properties;

	public ConfluenceSignalGenerator(StrategyProperties properties) {
		this.properties = properties;
	}

	@Override
	public Optional<Signal> evaluate(List<Bar> recentBars, List<Bar> higherTimeframeBars) {
		if (recentBars == null || higherTimeframeBars == null
				|| recentBars.size() < properties.minBars()
				|| higherTimeframeBars.size() < properties.minHigherTimeframeBars()) {
			return reject(null, "INSUFFICIENT_BARS");
		}
		Bar bar = recentBars.get(recentBars.size() - 1);
		Bar prev = recentBars.get(recentBars.size() - 2);
		Bar htfBar = higherTimeframeBars.get(higherTimeframeBars.size() - 1);

		Double atr = bar.atr();
		if (atr == null) {
			return reject(bar, "ATR_NOT_READY");
		}
		if (atr < properties.minAtr() || atr > properties.maxAtr()) {
			return reject(bar, "ATR_OUT_OF_RANGE");
		}
		if (!bar.features().isIndicatorReady() || !prev.features().isIndicatorReady()
				|| htfBar.features().trend() == null) {
			return reject(bar, "INDICATORS_NOT_READY");
		}

		Divergence divergence = DivergenceDetector.classify(recentBars, properties.divergenceLookback());
		TrendDirection htfTrend = htfBar.features().trend();
		ConfluenceScore longScore = score(Direction.LONG, bar, prev, htfTrend, divergence);
		ConfluenceScore shortScore = score(Direction.SHORT, bar, prev, htfTrend, divergence);

		Optional<ConfluenceScore> chosen = choose(longScore, shortScore);
		if (chosen.isEmpty()) {
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug("EVENT=SIGNAL_REJECT time={} reason=NO_QUALIFYING_DIRECTION scoreLong={} scoreShort={} "
						+ "htfTrend={} divergence={}", bar.time(), longScore.score(), shortScore.score(), htfTrend,
						divergence);
			}
			return Optional.empty();
		}
		return buildSignal(chosen.get(), bar, atr);
	}

	Optional<ConfluenceScore> choose(ConfluenceScore longScore, ConfluenceScore shortScore) {
		boolean longOk = longScore.qualifies();
		boolean shortOk = shortScore.qualifies();
		if (longOk && !shortOk) {
			return Optional.of(longScore);
		}
		if (shortOk && !longOk) {
			return Optional.of(shortScore);
		}
		if (!longOk) {
			return Optional.empty();
		}
		if (longScore.score() != shortScore.score()) {
			return Optional.of(longScore.score() > shortScore.score() ? longScore : shortScore);
		}
		if (longScore.counterTrend() != shortScore.counterTrend()) {
			return Optional.of(longScore.counterTrend() ? shortScore : longScore);
		}
		return Optional.of(longScore);
	}

	ConfluenceScore score(Direction direction, Bar bar, Bar prev, TrendDirection htfTrend, Divergence divergence) {
		boolean aligned = direction.isAlignedWith(htfTrend);
		boolean counterTrend = direction.opposes(htfTrend);
		boolean divergenceConfirms = direction.isConfirmedBy(divergence);
		int required = properties.requiredScore(counterTrend);
		if (counterTrend && !divergenceConfirms) {
			return ConfluenceScore.rejected(direction, required);
		}

		boolean isLong = direction == Direction.LONG;
		BarFeatures f = bar.features();
		BarFeatures p = prev.features();
		int score = 0;
		List<String> reasons = new ArrayList<>();

		// [1] trend alignment
		if (aligned) {
			score++;
			reasons.add("HTF trend " + (isLong ? "bullish" : "bearish"));
		} else if (divergenceConfirms) {
			score++;
			reasons.add((counterTrend ? "Counter-trend " : "") + divergenceLabel(divergence) + " divergence");
		}

		// [2] RSI zone / divergence / pullback
		double rsi = f.rsi();
		if (isLong && rsi < properties.rsiOversold()) {
			score++;
			reasons.add(String.format(Locale.ROOT, "RSI oversold (%.1f)", rsi));
		} else if (!isLong && rsi > properties.rsiOverbought()) {
			score++;
			reasons.add(String.format(Locale.ROOT, "RSI overbought (%.1f)", rsi));
		} else if (divergenceConfirms) {
			score++;
			reasons.add("RSI " + divergenceLabel(divergence) + " divergence");
		} else if (aligned && isRsiPullback(isLong, rsi, f.rsiSlope())) {
			score++;
			reasons.add(String.format(Locale.ROOT, "RSI pullback turning %s (%.1f)", isLong ? "up" : "down", rsi));
		}

		// [3] MACD crossover
		boolean macdBuy = p.macdLine() <= p.macdSignal() && f.macdLine() > f.macdSignal() && f.macdHistogram() > 0;
		boolean macdSell = p.macdLine() >= p.macdSignal() && f.macdLine() < f.macdSignal() && f.macdHistogram() < 0;
		if (isLong && macdBuy) {
			score++;
			reasons.add("MACD bullish crossover");
		} else if (!isLong && macdSell) {
			score++;
			reasons.add("MACD bearish crossover");
		}

		// [4] stochastic crossover, excluding crosses already inside the extreme zone
		double k = f.stochK();
		boolean stochBuy = p.stochK() <= p.stochD() && k > f.stochD() && k < properties.stochOverbought();
		boolean stochSell = p.stochK() >= p.stochD() && k < f.stochD() && k > properties.stochOversold();
		if (isLong && stochBuy) {
			score++;
			reasons.add(String.format(Locale.ROOT, "Stoch cross up (%.1f)", k));
		} else if (!isLong && stochSell) {
			score++;
			reasons.add(String.format(Locale.ROOT, "Stoch cross down (%.1f)", k));
		}

		// [5] band touch at structure
		double close = bar.close();
		double atr = f.atr();
		if (isLong && close <= f.bbLower() + properties.bandProximityAtr() * atr
				&& isNear(close, f.lastSwingLow(), atr)) {
			score++;
			reasons.add("Price at BB lower band + support");
		} else if (!isLong && close >= f.bbUpper() - properties.bandProximityAtr() * atr
				&& isNear(close, f.lastSwingHigh(), atr)) {
			score++;
			reasons.add("Price at BB upper band + resistance");
		}

		return new ConfluenceScore(direction, score, required, counterTrend, reasons);
	}

	Optional<Signal> buildSignal(ConfluenceScore chosen, Bar bar, double atr) {
		Direction direction = chosen.direction();
		int sign = direction.sign();
		double entry = bar.close();
		double atrStop = entry - sign * atr * properties.slAtrMultiple();
		Double swing = direction == Direction.LONG ? bar.features().lastSwingLow() : bar.features().lastSwingHigh();
		double structuralStop = swing == null ? atrStop : swing - sign * properties.structuralBufferAtr() * atr;
		double floorStop = entry - sign * properties.minStopAtrMultiple() * atr;

		double stop;
		if (direction == Direction.LONG) {
			stop = Math.min(Math.max(atrStop, structuralStop), floorStop);
		} else {
			stop = Math.max(Math.min(atrStop, structuralStop), floorStop);
		}
		double target = entry + sign * Math.abs(entry - stop) * properties.tpRewardMultiple();

		double roundedEntry = round(entry);
		double roundedStop = round(stop);
		double roundedTarget = round(target);
		if (Math.signum(roundedEntry - roundedStop) != sign || Math.signum(roundedTarget - roundedEntry) != sign) {
			return reject(bar, "INVALID_LEVELS");
		}
		double riskReward = Signal.riskReward(roundedEntry, roundedStop, roundedTarget);
		if (riskReward + RR_TOLERANCE < properties.minRiskReward()) {
			return reject(bar, "RISK_REWARD_TOO_LOW");
		}

		Signal signal = new Signal(
				direction,
				roundedEntry,
				roundedStop,
				roundedTarget,
				round(riskReward),
				chosen.score(),
				chosen.requiredScore(),
				chosen.counterTrend(),
				round(atr),
				chosen.reasons(),
				bar.time());
		LOGGER.info("EVENT=SIGNAL time={} {}", bar.time(), signal.describe());
		return Optional.of(signal);
	}

	private boolean isRsiPullback(boolean isLong, double rsi, double rsiSlope) {
		if (isLong) {
			return rsi <= properties.rsiPullbackMidline() && rsiSlope > 0;
		}
		return rsi >= properties.rsiPullbackMidline() && rsiSlope < 0;
	}

	private boolean isNear(double close, Double level, double atr) {
		return level != null && Math.abs(close - level) < properties.swingProximityAtr() * atr;
	}

	private double round(double value) {
		return BigDecimal.valueOf(value).setScale(properties.pricePrecision(), RoundingMode.HALF_UP).doubleValue();
	}

	private static String divergenceLabel(Divergence divergence) {
		return divergence == Divergence.BULLISH ? "bullish" : "bearish";
	}

	private static Optional<Signal> reject(Bar bar, String reason) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("EVENT=SIGNAL_REJECT time={} reason={}", bar == null ? "NA" : bar.time(), reason);
		}
		return Optional.empty();
	}
}

package com.scalper.backtest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary statistics for a simulated run.
 *
 * <p>Sharpe and Sortino use the last equity of each UTC day, population standard deviation and
 * √252 annualisation. The Sortino downside deviation is the root mean square of the negative daily
 * returns. A trade with P/L of exactly zero counts as a loss for the win rate.
 */
public final class PerformanceCalculator {

	private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;
	private static final double DAYS_PER_YEAR = 365.25;
	private static final double TRADING_DAYS_PER_YEAR = 252.0;

	private PerformanceCalculator() {
	}

	public static BacktestMetrics calculate(List<ClosedTrade> trades, List<EquityPoint> equityCurve,
			double initialEquity, double finalEquity) {
		if (trades.isEmpty()) {
			return BacktestMetrics.empty(initialEquity, r2(finalEquity));
		}

		double grossWin = 0.0;
		double grossLoss = 0.0;
		double totalPnl = 0.0;
		double totalR = 0.0;
		int wins = 0;
		for (ClosedTrade trade : trades) {
			totalPnl += trade.pnl();
			totalR += trade.rMultiple();
			if (trade.isWin()) {
				wins++;
				grossWin += trade.pnl();
			} else {
				grossLoss += trade.pnl();
			}
		}
		grossLoss = Math.abs(grossLoss);

		double totalReturn = (finalEquity - initialEquity) / initialEquity * 100.0;
		List<Double> dailyReturns = dailyReturns(equityCurve);
		double mean = mean(dailyReturns);
		double std = populationStd(dailyReturns, mean);
		double downStd = downsideDeviation(dailyReturns);

		double sharpe = std > 0 ? mean / std * Math.sqrt(TRADING_DAYS_PER_YEAR) : 0.0;
		double sortino = downStd > 0 ? mean / downStd * Math.sqrt(TRADING_DAYS_PER_YEAR) : 0.0;
		double profitFactor = grossLoss > 0 ? r2(grossWin / grossLoss) : Double.POSITIVE_INFINITY;

		return new BacktestMetrics(
				r2(totalReturn),
				r2(annualisedReturn(equityCurve, initialEquity, finalEquity)),
				r2(maxDrawdownPct(equityCurve, initialEquity)),
				r2(sharpe),
				r2(sortino),
				r2((double) wins / trades.size() * 100.0),
				profitFactor,
				trades.size(),
				r2(totalR / trades.size()),
				r2(totalPnl / trades.size()),
				initialEquity,
				r2(finalEquity));
	}

	static double annualisedReturn(List<EquityPoint> equityCurve, double initialEquity, double finalEquity) {
		double days = equityCurve.isEmpty()
				? DAYS_PER_YEAR
				: (equityCurve.get(equityCurve.size() - 1).time() - equityCurve.get(0).time()) / MILLIS_PER_DAY;
		double years = Math.max(days / DAYS_PER_YEAR, 1.0 / DAYS_PER_YEAR);
		return (Math.pow(finalEquity / initialEquity, 1.0 / years) - 1.0) * 100.0;
	}

	static double maxDrawdownPct(List<EquityPoint> equityCurve, double initialEquity) {
		double peak = initialEquity;
		double maxDrawdown = 0.0;
		for (EquityPoint point : equityCurve) {
			if (point.equity() > peak) {
				peak = point.equity();
			}
			double drawdown = (point.equity() - peak) / peak * 100.0;
			if (drawdown < maxDrawdown) {
				maxDrawdown = drawdown;
			}
		}
		return maxDrawdown;
	}

	static List<Double> dailyReturns(List<EquityPoint> equityCurve) {
		Map<LocalDate, Double> closeByDay = new LinkedHashMap<>();
		for (EquityPoint point : equityCurve) {
			LocalDate day = Instant.ofEpochMilli(point.time()).atZone(ZoneOffset.UTC).toLocalDate();
			closeByDay.put(day, point.equity());
		}
		List<Double> closes = new ArrayList<>(closeByDay.values());
		List<Double> returns = new ArrayList<>(Math.max(0, closes.size() - 1));
		for (int i = 1; i < closes.size(); i++) {
			returns.add((closes.get(i) - closes.get(i - 1)) / closes.get(i - 1));
		}
		return returns;
	}

	private static double mean(List<Double> values) {
		if (values.isEmpty()) {
			return 0.0;
		}
		double sum = 0.0;
		for (double value : values) {
			sum += value;
		}
		return sum / values.size();
	}

	private static double populationStd(List<Double> values, double mean) {
		if (values.isEmpty()) {
			return 0.0;
		}
		double sumSq = 0.0;
		for (double value : values) {
			sumSq += (value - mean) * (value - mean);
		}
		return Math.sqrt(sumSq / values.size());
	}

	private static double downsideDeviation(List<Double> values) {
		double sumSq = 0.0;
		int count = 0;
		for (double value : values) {
			if (value < 0) {
				sumSq += value * value;
				count++;
			}
		}
		return count == 0 ? 0.0 : Math.sqrt(sumSq / count);
	}

	static double r2(double value) {
		if (!Double.isFinite(value)) {
			return value;
		}
		return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
	}
}

package com.scalper.backtest;

public record BacktestMetrics(
		double totalReturnPct,
		double annualisedReturnPct,
		double maxDrawdownPct,
		double sharpeRatio,
		double sortinoRatio,
		double winRatePct,
		double profitFactor,
		int totalTrades,
		double avgRMultiple,
		double expectancy,
		double initialEquity,
		double finalEquity) {

	public static BacktestMetrics empty(double initialEquity, double finalEquity) {
		return new BacktestMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, initialEquity, finalEquity);
	}
}

package com.scalper.backtest;

import java.util.List;

public record BacktestResult(
		List<ClosedTrade> trades,
		List<EquityPoint> equityCurve,
		BacktestMetrics metrics) {

	public BacktestResult {
		trades = List.copyOf(trades);
		equityCurve = List.copyOf(equityCurve);
	}
}

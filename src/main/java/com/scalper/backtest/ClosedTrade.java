package com.scalper.backtest;

import java.util.List;

import com.scalper.strategy.Direction;

public record ClosedTrade(
		long entryTime,
		long exitTime,
		Direction direction,
		double entryPrice,
		double exitPrice,
		double initialStop,
		double finalStop,
		double takeProfit,
		long units,
		int score,
		List<String> reasons,
		CloseReason closeReason,
		double pnl,
		double rMultiple) {

	public ClosedTrade {
		reasons = reasons == null ? List.of() : List.copyOf(reasons);
	}

	public boolean isWin() {
		return pnl > 0;
	}
}

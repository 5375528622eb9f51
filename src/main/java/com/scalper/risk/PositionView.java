package com.scalper.risk;

import com.scalper.strategy.Direction;

public record PositionView(
		Direction direction,
		double entryPrice,
		double stopLoss,
		double units) {

	public double stopDistance() {
		return Math.abs(entryPrice - stopLoss);
	}
}

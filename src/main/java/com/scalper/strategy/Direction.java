package com.scalper.strategy;

import com.scalper.market.TrendDirection;

public enum Direction {
	LONG,
	SHORT;

	public int sign() {
		return this == LONG ? 1 : -1;
	}

	public boolean isAlignedWith(TrendDirection trend) {
		return (this == LONG && trend == TrendDirection.BULLISH)
				|| (this == SHORT && trend == TrendDirection.BEARISH);
	}

	public boolean opposes(TrendDirection trend) {
		return (this == LONG && trend == TrendDirection.BEARISH)
				|| (this == SHORT && trend == TrendDirection.BULLISH);
	}

	public boolean isConfirmedBy(Divergence divergence) {
		return (this == LONG && divergence == Divergence.BULLISH)
				|| (this == SHORT && divergence == Divergence.BEARISH);
	}
}

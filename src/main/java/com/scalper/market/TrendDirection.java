package com.scalper.market;

public enum TrendDirection {
	BULLISH,
	BEARISH,
	NEUTRAL
}

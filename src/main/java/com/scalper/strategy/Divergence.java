package com.scalper.strategy;

public enum Divergence {
	BULLISH,
	BEARISH,
	NONE
}

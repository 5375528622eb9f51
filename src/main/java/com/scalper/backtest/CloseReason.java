package com.scalper.backtest;

public enum CloseReason {
	STOP_LOSS,
	TAKE_PROFIT,
	END_OF_DATA
}

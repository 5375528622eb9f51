package com.scalper.risk;

public enum RiskCheck {
	MAX_OPEN_POSITIONS,
	DAILY_DRAWDOWN,
	DAILY_LOSS_USD,
	MAX_TRADES_PER_DAY,
	COOLDOWN
}

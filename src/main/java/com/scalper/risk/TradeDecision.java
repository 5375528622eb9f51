package com.scalper.risk;

public record TradeDecision(boolean allowed, RiskCheck failedCheck, String reason) {

	private static final TradeDecision ALLOWED = new TradeDecision(true, null, "");

	public static TradeDecision allow() {
		return ALLOWED;
	}

	public static TradeDecision block(RiskCheck check, String reason) {
		return new TradeDecision(false, check, reason);
	}
}

package com.scalper.risk;

import java.time.LocalDate;

public class RiskSessionState {

	private double equity;
	private double peakEquity;
	private LocalDate sessionDate;
	private double sessionStartEquity;
	private double dailyPnl;
	private int tradeCount;
	private Long lastTradeOpenedAt;

	public RiskSessionState(double startingEquity) {
		this(startingEquity, null);
	}

	public RiskSessionState(double startingEquity, LocalDate sessionDate) {
		requireValidEquity(startingEquity);
		this.equity = startingEquity;
		this.peakEquity = startingEquity;
		this.sessionStartEquity = startingEquity;
		this.sessionDate = sessionDate;
	}

	void recordEquity(double value) {
		requireValidEquity(value);
		equity = value;
		if (value > peakEquity) {
			peakEquity = value;
		}
	}

	void recordTradeOpened(long at) {
		lastTradeOpenedAt = at;
		tradeCount++;
	}

	void recordTradeClosed(double pnl) {
		dailyPnl += pnl;
	}

	boolean applyDailyReset(LocalDate day) {
		if (sessionDate == null) {
			sessionDate = day;
			sessionStartEquity = equity;
			return false;
		}
		if (!day.isAfter(sessionDate)) {
			return false;
		}
		sessionDate = day;
		sessionStartEquity = equity;
		dailyPnl = 0.0;
		tradeCount = 0;
		return true;
	}

	public double equity() {
		return equity;
	}

	public double peakEquity() {
		return peakEquity;
	}

	public LocalDate sessionDate() {
		return sessionDate;
	}

	public double sessionStartEquity() {
		return sessionStartEquity;
	}

	public double dailyPnl() {
		return dailyPnl;
	}

	public int tradeCount() {
		return tradeCount;
	}

	public Long lastTradeOpenedAt() {
		return lastTradeOpenedAt;
	}

	private static void requireValidEquity(double value) {
		if (!Double.isFinite(value) || value < 0) {
			throw new IllegalArgumentException("Equity must be finite and non-negative: " + value);
		}
	}
}

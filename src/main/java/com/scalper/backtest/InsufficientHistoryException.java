package com.scalper.backtest;

public class InsufficientHistoryException extends RuntimeException {

	private final int requiredBars;
	private final int availableBars;

	public InsufficientHistoryException(int requiredBars, int availableBars) {
		super("Not enough bars for a backtest: required=" + requiredBars + " available=" + availableBars);
		this.requiredBars = requiredBars;
		this.availableBars = availableBars;
	}

	public int getRequiredBars() {
		return requiredBars;
	}

	public int getAvailableBars() {
		return availableBars;
	}
}

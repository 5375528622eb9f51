package com.scalper.backtest;

import java.util.List;

import com.scalper.risk.PositionView;
import com.scalper.strategy.Direction;
import com.scalper.strategy.Signal;

public class OpenPosition {

	private final long entryTime;
	private final Direction direction;
	private final double entryPrice;
	private final long units;
	private final double initialStop;
	private final double takeProfit;
	private final int score;
	private final double atr;
	private final List<String> reasons;
	private double stopLoss;

	public OpenPosition(long entryTime, double entryPrice, long units, Signal signal) {
		this.entryTime = entryTime;
		this.direction = signal.direction();
		this.entryPrice = entryPrice;
		this.units = units;
		this.initialStop = signal.stopLoss();
		this.stopLoss = signal.stopLoss();
		this.takeProfit = signal.takeProfit();
		this.score = signal.score();
		this.atr = signal.atr();
		this.reasons = signal.reasons();
	}

	public double pnlAt(double exitPrice) {
		return direction.sign() * (exitPrice - entryPrice) * units;
	}

	// divisor falls back to 1 when the initial risk is zero
	public double rMultiple(double pnl) {
		double initialRisk = Math.abs(entryPrice - initialStop) * units;
		return pnl / (initialRisk == 0.0 ? 1.0 : initialRisk);
	}

	public ClosedTrade close(long exitTime, double exitPrice, CloseReason reason) {
		double pnl = pnlAt(exitPrice);
		return new ClosedTrade(entryTime, exitTime, direction, entryPrice, exitPrice, initialStop, stopLoss,
				takeProfit, units, score, reasons, reason, pnl, rMultiple(pnl));
	}

	public PositionView asView() {
		return new PositionView(direction, entryPrice, stopLoss, units);
	}

	void moveStop(double newStop) {
		this.stopLoss = newStop;
	}

	public long entryTime() {
		return entryTime;
	}

	public Direction direction() {
		return direction;
	}

	public double entryPrice() {
		return entryPrice;
	}

	public long units() {
		return units;
	}

	public double initialStop() {
		return initialStop;
	}

	public double stopLoss() {
		return stopLoss;
	}

	public double takeProfit() {
		return takeProfit;
	}

	public int score() {
		return score;
	}

	public double atr() {
		return atr;
	}

	public List<String> reasons() {
		return reasons;
	}
}

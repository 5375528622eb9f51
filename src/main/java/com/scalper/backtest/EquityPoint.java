package com.scalper.backtest;

public record EquityPoint(long time, double equity) {
}

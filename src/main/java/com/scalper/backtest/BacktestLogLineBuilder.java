package com.scalper.backtest;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class BacktestLogLineBuilder {

	private BacktestLogLineBuilder() {
	}

	public static String buildTradeOpenLine(long signalTime, OpenPosition position, double equity) {
		StringBuilder builder = new StringBuilder(256);
		builder.append("EVENT=TRADE_OPEN")
				.append(" signalTime=").append(signalTime)
				.append(" entryTime=").append(position.entryTime())
				.append(" side=").append(position.direction())
				.append(" entry=").append(num(position.entryPrice()))
				.append(" sl=").append(num(position.stopLoss()))
				.append(" tp=").append(num(position.takeProfit()))
				.append(" units=").append(position.units())
				.append(" score=").append(position.score())
				.append(" atr=").append(num(position.atr()))
				.append(" equity=").append(num(equity))
				.append(" reasons=").append(na(String.join("|", position.reasons())));
		return builder.toString();
	}

	public static String buildTradeCloseLine(ClosedTrade trade, double equity) {
		StringBuilder builder = new StringBuilder(256);
		builder.append("EVENT=TRADE_CLOSE")
				.append(" entryTime=").append(trade.entryTime())
				.append(" exitTime=").append(trade.exitTime())
				.append(" side=").append(trade.direction())
				.append(" entry=").append(num(trade.entryPrice()))
				.append(" exit=").append(num(trade.exitPrice()))
				.append(" units=").append(trade.units())
				.append(" reason=").append(trade.closeReason())
				.append(" pnl=").append(num(trade.pnl()))
				.append(" r=").append(num(trade.rMultiple()))
				.append(" equity=").append(num(equity));
		return builder.toString();
	}

	public static String buildSummaryLine(BacktestMetrics metrics) {
		StringBuilder builder = new StringBuilder(320);
		builder.append("EVENT=BACKTEST_SUMMARY")
				.append(" trades=").append(metrics.totalTrades())
				.append(" initialEquity=").append(num(metrics.initialEquity()))
				.append(" finalEquity=").append(num(metrics.finalEquity()))
				.append(" returnPct=").append(num(metrics.totalReturnPct()))
				.append(" annReturnPct=").append(num(metrics.annualisedReturnPct()))
				.append(" maxDdPct=").append(num(metrics.maxDrawdownPct()))
				.append(" sharpe=").append(num(metrics.sharpeRatio()))
				.append(" sortino=").append(num(metrics.sortinoRatio()))
				.append(" winRatePct=").append(num(metrics.winRatePct()))
				.append(" profitFactor=").append(num(metrics.profitFactor()))
				.append(" avgR=").append(num(metrics.avgRMultiple()))
				.append(" expectancy=").append(num(metrics.expectancy()));
		return builder.toString();
	}

	private static String na(String value) {
		return value == null || value.isBlank() ? "NA" : value;
	}

	private static String num(double value) {
		if (Double.isNaN(value)) {
			return "NA";
		}
		if (Double.isInfinite(value)) {
			return value > 0 ? "INF" : "-INF";
		}
		return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
	}
}

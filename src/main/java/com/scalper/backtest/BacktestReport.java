package com.scalper.backtest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public final class BacktestReport {

	private static final int BOX_WIDTH = 48;
	private static final int PLOT_ROWS = 12;
	private static final int PLOT_COLUMNS = 60;

	private BacktestReport() {
	}

	public static List<String> summaryLines(BacktestMetrics metrics) {
		String rule = "=".repeat(BOX_WIDTH);
		List<String> lines = new ArrayList<>();
		lines.add("+" + rule + "+");
		lines.add(row("  BACKTEST RESULTS SUMMARY"));
		lines.add("+" + rule + "+");
		lines.add(row(field("Initial Equity:", "$" + money(metrics.initialEquity()))));
		lines.add(row(field("Final Equity:", "$" + money(metrics.finalEquity()))));
		lines.add(row(field("Total Return:", money(metrics.totalReturnPct()) + "%")));
		lines.add(row(field("Annual Return:", money(metrics.annualisedReturnPct()) + "%")));
		lines.add("+" + rule + "+");
		lines.add(row(field("Total Trades:", String.valueOf(metrics.totalTrades()))));
		lines.add(row(field("Win Rate:", money(metrics.winRatePct()) + "%")));
		lines.add(row(field("Profit Factor:", money(metrics.profitFactor()))));
		lines.add(row(field("Avg R Achieved:", money(metrics.avgRMultiple()))));
		lines.add(row(field("Expectancy/trade:", "$" + money(metrics.expectancy()))));
		lines.add("+" + rule + "+");
		lines.add(row(field("Max Drawdown:", money(metrics.maxDrawdownPct()) + "%")));
		lines.add(row(field("Sharpe Ratio:", money(metrics.sharpeRatio()))));
		lines.add(row(field("Sortino Ratio:", money(metrics.sortinoRatio()))));
		lines.add("+" + rule + "+");
		return lines;
	}

	public static List<String> equityCurveLines(List<EquityPoint> equityCurve, int totalTrades) {
		if (equityCurve.isEmpty()) {
			return List.of();
		}
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (EquityPoint point : equityCurve) {
			min = Math.min(min, point.equity());
			max = Math.max(max, point.equity());
		}
		double range = max - min == 0.0 ? 1.0 : max - min;
		int step = Math.max(1, equityCurve.size() / PLOT_COLUMNS);

		char[][] grid = new char[PLOT_ROWS][PLOT_COLUMNS];
		for (char[] gridRow : grid) {
			Arrays.fill(gridRow, ' ');
		}
		for (int column = 0; column < PLOT_COLUMNS; column++) {
			int index = Math.min(column * step, equityCurve.size() - 1);
			double value = equityCurve.get(index).equity();
			int gridRow = PLOT_ROWS - 1 - (int) Math.round((value - min) / range * (PLOT_ROWS - 1));
			grid[gridRow][column] = '#';
		}

		List<String> lines = new ArrayList<>(PLOT_ROWS + 4);
		lines.add("Equity Curve:");
		lines.add(String.format(Locale.ROOT, "$%9.0f +", max));
		for (char[] gridRow : grid) {
			lines.add("           | " + new String(gridRow));
		}
		lines.add(String.format(Locale.ROOT, "$%9.0f +%s", min, "-".repeat(PLOT_COLUMNS)));
		lines.add("           0" + " ".repeat(PLOT_COLUMNS - 6) + totalTrades + " trades");
		return lines;
	}

	private static String row(String content) {
		String padded = content.length() >= BOX_WIDTH ? content.substring(0, BOX_WIDTH)
				: content + " ".repeat(BOX_WIDTH - content.length());
		return "|" + padded + "|";
	}

	private static String field(String label, String value) {
		return String.format(Locale.ROOT, "  %-19s %s", label, value);
	}

	private static String money(double value) {
		if (Double.isInfinite(value)) {
			return value > 0 ? "Infinity" : "-Infinity";
		}
		return String.format(Locale.ROOT, "%.2f", value);
	}
}

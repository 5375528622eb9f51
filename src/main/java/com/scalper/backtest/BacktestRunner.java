package com.scalper.backtest;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import com.scalper.config.BacktestProperties;
import com.scalper.config.MarketDataProperties;
import com.scalper.market.Bar;
import com.scalper.market.BarFeed;

@Component
public class BacktestRunner implements CommandLineRunner {

	private static final Logger LOGGER = LoggerFactory.getLogger(BacktestRunner.class);

	private final BacktestProperties backtestProperties;
	private final MarketDataProperties marketDataProperties;
	private final BarFeed barFeed;
	private final BacktestSimulator simulator;
	private final BacktestResultWriter resultWriter;

	public BacktestRunner(BacktestProperties backtestProperties,
			MarketDataProperties marketDataProperties,
			BarFeed barFeed,
			BacktestSimulator simulator,
			BacktestResultWriter resultWriter) {
		this.backtestProperties = backtestProperties;
		this.marketDataProperties = marketDataProperties;
		this.barFeed = barFeed;
		this.simulator = simulator;
		this.resultWriter = resultWriter;
	}

	@Override
	public void run(String... args) {
		if (!backtestProperties.enabled()) {
			LOGGER.info("Backtest disabled (backtest.enabled=false)");
			return;
		}

		LOGGER.info("=".repeat(60));
		LOGGER.info("STARTING BACKTEST symbol={} source={} initialEquity={}", marketDataProperties.symbol(),
				backtestProperties.dataSource(), backtestProperties.initialEquity());
		LOGGER.info("=".repeat(60));

		List<Bar> bars = barFeed.fetchBars(marketDataProperties.baseTimeframe(), 0);
		BacktestResult result;
		try {
			result = simulator.run(bars);
		} catch (InsufficientHistoryException e) {
			LOGGER.error("EVENT=BACKTEST_ABORTED reason=INSUFFICIENT_HISTORY required={} available={}",
					e.getRequiredBars(), e.getAvailableBars());
			throw e;
		}

		BacktestReport.summaryLines(result.metrics()).forEach(LOGGER::info);
		if (backtestProperties.asciiPlot()) {
			BacktestReport.equityCurveLines(result.equityCurve(), result.metrics().totalTrades())
					.forEach(LOGGER::info);
		}
		Path written = resultWriter.write(result, backtestProperties.resultsDir());
		LOGGER.info("Backtest complete. trades={} results={}", result.trades().size(), written);
	}
}

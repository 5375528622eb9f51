package com.scalper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scalper.backtest.BacktestResultWriter;
import com.scalper.backtest.BacktestSimulator;
import com.scalper.market.BarFeed;
import com.scalper.market.CsvBarFeed;
import com.scalper.market.SyntheticBarFeed;
import com.scalper.risk.RiskManager;
import com.scalper.strategy.ConfluenceSignalGenerator;
import com.scalper.strategy.SignalGenerator;
import com.scalper.strategy.indicators.BarEnricher;

@Configuration
public class ScalperConfiguration {

	@Bean
	public BarEnricher barEnricher(IndicatorProperties indicatorProperties) {
		return new BarEnricher(indicatorProperties);
	}

	@Bean
	public SignalGenerator signalGenerator(StrategyProperties strategyProperties) {
		return new ConfluenceSignalGenerator(strategyProperties);
	}

	@Bean
	public RiskManager riskManager(RiskProperties riskProperties) {
		return new RiskManager(riskProperties);
	}

	@Bean
	public BarFeed barFeed(BacktestProperties backtestProperties, MarketDataProperties marketDataProperties) {
		if (backtestProperties.dataSource() == BacktestProperties.DataSource.SYNTHETIC) {
			return new SyntheticBarFeed(marketDataProperties);
		}
		return new CsvBarFeed(marketDataProperties);
	}

	@Bean
	public BacktestSimulator backtestSimulator(BacktestProperties backtestProperties,
			BarEnricher barEnricher,
			SignalGenerator signalGenerator,
			RiskManager riskManager) {
		return new BacktestSimulator(backtestProperties, barEnricher, signalGenerator, riskManager);
	}

	@Bean
	public BacktestResultWriter backtestResultWriter(ObjectMapper objectMapper) {
		return new BacktestResultWriter(objectMapper);
	}
}

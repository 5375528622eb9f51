package com.scalper.backtest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scalper.config.BacktestProperties;
import com.scalper.market.Bar;
import com.scalper.market.TimeframeResampler;
import com.scalper.risk.RiskManager;
import com.scalper.risk.RiskSessionState;
import com.scalper.risk.TradeDecision;
import com.scalper.strategy.Direction;
import com.scalper.strategy.Signal;
import com.scalper.strategy.SignalGenerator;
import com.scalper.strategy.indicators.BarEnricher;

/**
 * Walk-forward replay of historical bars through the signal generator and risk manager.
 *
 * <p>At bar {@code i} the generator sees base bars {@code [0, i]} and only the higher-timeframe
 * buckets that closed before bar {@code i}'s bucket opened. Fills happen at the open of bar
 * {@code i + 1}; exits are tested against the range of the bar after the current one, with the stop
 * taking precedence when both levels are touched. Every run builds fresh state, so identical input
 * produces identical output.
 */
public class BacktestSimulator {

	private static final Logger LOGGER = LoggerFactory.getLogger(BacktestSimulator.class);

	private final BacktestProperties properties;
	private final BarEnricher enricher;
	private final SignalGenerator signalGenerator;
	private final RiskManager riskManager;

	public BacktestSimulator(BacktestProperties properties, BarEnricher enricher, SignalGenerator signalGenerator,
			RiskManager riskManager) {
		this.properties = properties;
		this.enricher = enricher;
		this.signalGenerator = signalGenerator;
		this.riskManager = riskManager;
	}

	public BacktestResult run(List<Bar> historicalBars) {
		int required = properties.minimumBars();
		if (historicalBars == null || historicalBars.size() < required) {
			throw new InsufficientHistoryException(required, historicalBars == null ? 0 : historicalBars.size());
		}
		Bar.requireStrictlyIncreasing(historicalBars);

		List<Bar> bars = enricher.enrich(historicalBars);
		TimeframeResampler resampler = new TimeframeResampler(properties.higherTimeframe());
		List<Bar> higherTimeframe = enricher.enrich(TimeframeResampler.resample(historicalBars,
				properties.higherTimeframe()));

		int warmup = properties.warmupBars();
		double equity = properties.initialEquity();
		RiskSessionState session = new RiskSessionState(equity, bars.get(warmup).utcDate());
		List<ClosedTrade> trades = new ArrayList<>();
		List<EquityPoint> equityCurve = new ArrayList<>(bars.size() - warmup);
		OpenPosition position = null;
		int completedBuckets = 0;

		LOGGER.info("EVENT=BACKTEST_START bars={} warmup={} htfBars={} htf={} initialEquity={}",
				bars.size(), warmup, higherTimeframe.size(), properties.higherTimeframe(), equity);

		for (int i = warmup; i < bars.size() - 1; i++) {
			Bar bar = bars.get(i);
			Bar nextBar = bars.get(i + 1);
			long currentBucket = resampler.bucketStart(bar.time());
			while (completedBuckets < higherTimeframe.size()
					&& higherTimeframe.get(completedBuckets).time() < currentBucket) {
				completedBuckets++;
			}

			if (position != null) {
				if (properties.trailingEnabled() && bar.atr() != null) {
					position.moveStop(riskManager.trailStop(position.asView(), bar.close(), bar.atr()));
				}
				Optional<ExitEvaluator.Exit> exit = ExitEvaluator.check(position, nextBar);
				if (exit.isPresent()) {
					ClosedTrade trade = position.close(nextBar.time(), exit.get().price(), exit.get().reason());
					equity += trade.pnl();
					recordClose(session, trade, equity);
					trades.add(trade);
					position = null;
				}
			}

			if (position == null && properties.inSession(bar.utcHour())) {
				TradeDecision decision = riskManager.canOpenTrade(session, 0, bar.time());
				if (decision.allowed()) {
					Optional<Signal> signal = signalGenerator.evaluate(bars.subList(0, i + 1),
							higherTimeframe.subList(0, completedBuckets));
					if (signal.isPresent()) {
						OpenPosition opened = open(signal.get(), session, nextBar);
						if (opened != null) {
							position = opened;
							equity -= properties.commission();
							riskManager.recordEquity(session, Math.max(equity, 0.0));
							riskManager.recordTradeOpened(session, bar.time());
							LOGGER.info(BacktestLogLineBuilder.buildTradeOpenLine(bar.time(), position, equity));
						}
					}
				}
			}

			equityCurve.add(new EquityPoint(bar.time(), equity));
		}

		if (position != null) {
			Bar last = bars.get(bars.size() - 1);
			ClosedTrade trade = position.close(last.time(), last.close(), CloseReason.END_OF_DATA);
			equity += trade.pnl();
			recordClose(session, trade, equity);
			trades.add(trade);
		}

		BacktestMetrics metrics = PerformanceCalculator.calculate(trades, equityCurve, properties.initialEquity(),
				equity);
		LOGGER.info(BacktestLogLineBuilder.buildSummaryLine(metrics));
		return new BacktestResult(trades, equityCurve, metrics);
	}

	// null when sizing yields no units or the fill gaps beyond stop or target
	private OpenPosition open(Signal signal, RiskSessionState session, Bar fillBar) {
		long units = riskManager.sizePosition(session, signal);
		if (units <= 0) {
			LOGGER.debug("EVENT=TRADE_SKIP time={} reason=ZERO_UNITS", signal.time());
			return null;
		}
		int sign = signal.direction().sign();
		double fillPrice = fillBar.open() + sign * properties.spread() / 2.0;
		boolean stopOnLosingSide = signal.direction() == Direction.LONG
				? signal.stopLoss() < fillPrice
				: signal.stopLoss() > fillPrice;
		boolean targetOnWinningSide = signal.direction() == Direction.LONG
				? signal.takeProfit() > fillPrice
				: signal.takeProfit() < fillPrice;
		if (!stopOnLosingSide || !targetOnWinningSide) {
			LOGGER.debug("EVENT=TRADE_SKIP time={} reason=GAP_THROUGH_LEVELS fill={} sl={} tp={}", signal.time(),
					fillPrice, signal.stopLoss(), signal.takeProfit());
			return null;
		}
		return new OpenPosition(fillBar.time(), fillPrice, units, signal);
	}

	private void recordClose(RiskSessionState session, ClosedTrade trade, double equity) {
		if (equity < 0) {
			LOGGER.warn("EVENT=EQUITY_DEPLETED equity={} exitTime={}", equity, trade.exitTime());
		}
		riskManager.recordEquity(session, Math.max(equity, 0.0));
		riskManager.recordTradeClosed(session, trade.pnl());
		LOGGER.info(BacktestLogLineBuilder.buildTradeCloseLine(trade, equity));
	}
}

package com.scalper.risk;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scalper.config.RiskProperties;
import com.scalper.strategy.Direction;
import com.scalper.strategy.Signal;

public class RiskManager {

	private static final Logger LOGGER = LoggerFactory.getLogger(RiskManager.class);
	private static final double PRICE_TOLERANCE = 1e-9;

	private final RiskProperties properties;

	public RiskManager(RiskProperties properties) {
		this.properties = properties;
	}

	public void recordEquity(RiskSessionState session, double value) {
		session.recordEquity(value);
	}

	public void recordTradeOpened(RiskSessionState session, long at) {
		session.recordTradeOpened(at);
	}

	public void recordTradeClosed(RiskSessionState session, double pnl) {
		session.recordTradeClosed(pnl);
	}

	public TradeDecision canOpenTrade(RiskSessionState session, int openPositionCount, long at) {
		LocalDate day = Instant.ofEpochMilli(at).atZone(ZoneOffset.UTC).toLocalDate();
		if (session.applyDailyReset(day)) {
			LOGGER.info("EVENT=SESSION_RESET date={} sessionStartEquity={}", day,
					String.format(Locale.ROOT, "%.2f", session.sessionStartEquity()));
		}

		if (openPositionCount >= properties.maxOpenPositions()) {
			return block(RiskCheck.MAX_OPEN_POSITIONS,
					"Max open positions (" + openPositionCount + "/" + properties.maxOpenPositions() + ")");
		}

		if (session.sessionStartEquity() > 0) {
			double dailyPnlPct = session.dailyPnl() / session.sessionStartEquity() * 100.0;
			if (dailyPnlPct <= -properties.maxDailyDrawdownPct()) {
				return block(RiskCheck.DAILY_DRAWDOWN,
						String.format(Locale.ROOT, "Daily drawdown limit hit (%.1f%%)", dailyPnlPct));
			}
		}

		if (session.dailyPnl() <= -properties.maxDailyLossUsd()) {
			return block(RiskCheck.DAILY_LOSS_USD,
					String.format(Locale.ROOT, "Daily USD loss limit hit ($%.2f)", session.dailyPnl()));
		}

		if (session.tradeCount() >= properties.maxTradesPerDay()) {
			return block(RiskCheck.MAX_TRADES_PER_DAY, "Max trades/day reached (" + session.tradeCount() + ")");
		}

		Long lastOpened = session.lastTradeOpenedAt();
		if (lastOpened != null) {
			long cooldownMs = Duration.ofMinutes(properties.cooldownMinutes()).toMillis();
			long elapsedMs = at - lastOpened;
			if (elapsedMs < cooldownMs) {
				long remainingSec = (cooldownMs - elapsedMs + 999) / 1000;
				return block(RiskCheck.COOLDOWN, "Cooling period: " + remainingSec + "s remaining");
			}
		}

		return TradeDecision.allow();
	}

	public long sizePosition(RiskSessionState session, Signal signal) {
		double equity = session.equity();
		if (!Double.isFinite(equity) || equity < 0) {
			throw new IllegalStateException("Cannot size a position against equity " + equity);
		}
		double stopDistance = signal.entryPrice() - signal.stopLoss();
		stopDistance = signal.direction() == Direction.LONG ? stopDistance : -stopDistance;
		if (stopDistance <= 0) {
			return 0L;
		}
		double riskAmount = Math.min(equity * properties.riskFraction(), properties.maxRiskUsd());
		long units = (long) Math.floor(riskAmount / stopDistance);
		return Math.max(units, properties.minUnits());
	}

	// one-way ratchet, never returns a stop worse than currentStop
	public double trailStop(Direction direction, double entryPrice, double currentPrice, double atr,
			double currentStop) {
		int sign = direction.sign();
		double profit = sign * (currentPrice - entryPrice);
		if (profit + PRICE_TOLERANCE < atr * properties.trailActivationAtrMultiple()) {
			return currentStop;
		}
		double breakeven = entryPrice + sign * properties.breakevenOffset();
		double trailLevel = currentPrice - sign * atr * properties.trailDistanceAtrMultiple();
		if (direction == Direction.LONG) {
			return Math.max(currentStop, Math.max(breakeven, trailLevel));
		}
		return Math.min(currentStop, Math.min(breakeven, trailLevel));
	}

	public double trailStop(PositionView position, double currentPrice, double atr) {
		return trailStop(position.direction(), position.entryPrice(), currentPrice, atr, position.stopLoss());
	}

	private static TradeDecision block(RiskCheck check, String reason) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("EVENT=RISK_BLOCK check={} reason={}", check, reason);
		}
		return TradeDecision.block(check, reason);
	}
}

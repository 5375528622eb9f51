package com.scalper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "indicator")
public record IndicatorProperties(
		int emaFast,
		int emaSlow,
		int emaTrend,
		int rsiPeriod,
		int rsiSlopeBars,
		int macdFast,
		int macdSlow,
		int macdSignal,
		int stochK,
		int stochD,
		int atrPeriod,
		int bbPeriod,
		double bbStd,
		int swingWindow) {

	public IndicatorProperties {
		if (emaFast <= 0) emaFast = 21;
		if (emaSlow <= 0) emaSlow = 50;
		if (emaTrend <= 0) emaTrend = 200;
		if (rsiPeriod <= 0) rsiPeriod = 14;
		if (rsiSlopeBars <= 0) rsiSlopeBars = 3;
		if (macdFast <= 0) macdFast = 12;
		if (macdSlow <= 0) macdSlow = 26;
		if (macdSignal <= 0) macdSignal = 9;
		if (stochK <= 0) stochK = 14;
		if (stochD <= 0) stochD = 3;
		if (atrPeriod <= 0) atrPeriod = 14;
		if (bbPeriod <= 0) bbPeriod = 20;
		if (bbStd <= 0) bbStd = 2.0;
		if (swingWindow <= 0) swingWindow = 5;
	}

	public static IndicatorProperties defaults() {
		return new IndicatorProperties(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
	}
}

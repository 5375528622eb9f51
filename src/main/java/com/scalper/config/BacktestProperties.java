package com.scalper.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "backtest")
public record BacktestProperties(
		boolean enabled,
		DataSource dataSource,
		@Positive double initialEquity,
		@PositiveOrZero double spread,
		@PositiveOrZero double commission,
		@Min(0) @Max(24) int sessionStartUtc,
		@Min(0) @Max(24) int sessionEndUtc,
		int warmupBars,
		int minBufferBars,
		Duration higherTimeframe,
		boolean trailingEnabled,
		Path resultsDir,
		boolean asciiPlot) {

	public BacktestProperties {
		if (dataSource == null) dataSource = DataSource.CSV;
		if (warmupBars <= 0) warmupBars = 250;
		if (minBufferBars <= 0) minBufferBars = 10;
		if (higherTimeframe == null || higherTimeframe.isZero() || higherTimeframe.isNegative()) {
			higherTimeframe = Duration.ofMinutes(15);
		}
		if (resultsDir == null) resultsDir = Path.of("logs");
	}

	public static BacktestProperties defaults() {
		return new BacktestProperties(false, DataSource.CSV, 10_000.0, 0.25, 2.0, 7, 20, 250, 10,
				Duration.ofMinutes(15), false, Path.of("logs"), false);
	}

	public boolean inSession(int hourUtc) {
		return hourUtc >= sessionStartUtc && hourUtc < sessionEndUtc;
	}

	public int minimumBars() {
		return warmupBars + minBufferBars;
	}

	public enum DataSource {
		CSV,
		SYNTHETIC
	}
}

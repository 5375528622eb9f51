package com.scalper.config;

import java.time.Duration;
import java.time.Instant;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

@Validated
@ConfigurationProperties(prefix = "market")
public record MarketDataProperties(
		@NotBlank String symbol,
		Duration baseTimeframe,
		CsvConfig csv,
		SyntheticConfig synthetic) {

	public MarketDataProperties {
		if (baseTimeframe == null || baseTimeframe.isZero() || baseTimeframe.isNegative()) {
			baseTimeframe = Duration.ofMinutes(5);
		}
		if (csv == null) {
			csv = new CsvConfig("data/historical/XAUUSD_M5.csv", ",", true,
					"time", "open", "high", "low", "close", "volume", "ISO");
		}
		if (synthetic == null) {
			synthetic = new SyntheticConfig(5000, 42L, 2350.0, Instant.parse("2024-01-01T00:00:00Z"));
		}
	}

	public record CsvConfig(
			String path,
			String delimiter,
			boolean hasHeader,
			String timeColumn,
			String openColumn,
			String highColumn,
			String lowColumn,
			String closeColumn,
			String volumeColumn,
			// ISO, MILLIS or SECONDS
			String timeFormat) {
	}

	public record SyntheticConfig(
			int bars,
			long seed,
			double startPrice,
			Instant startTime) {

		public SyntheticConfig {
			if (bars <= 0) bars = 5000;
			if (startPrice <= 0) startPrice = 2350.0;
			if (startTime == null) startTime = Instant.parse("2024-01-01T00:00:00Z");
		}
	}
}

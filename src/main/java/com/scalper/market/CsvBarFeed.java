package com.scalper.market;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scalper.config.MarketDataProperties;

public class CsvBarFeed implements BarFeed {

	private static final Logger LOGGER = LoggerFactory.getLogger(CsvBarFeed.class);
	private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

	private static final int DEFAULT_TIME_INDEX = 0;
	private static final int DEFAULT_OPEN_INDEX = 1;
	private static final int DEFAULT_HIGH_INDEX = 2;
	private static final int DEFAULT_LOW_INDEX = 3;
	private static final int DEFAULT_CLOSE_INDEX = 4;
	private static final int DEFAULT_VOLUME_INDEX = 5;

	private final MarketDataProperties properties;

	public CsvBarFeed(MarketDataProperties properties) {
		this.properties = properties;
	}

	@Override
	public List<Bar> fetchBars(Duration timeframe, int count) {
		List<Bar> bars = loadBars(Path.of(properties.csv().path()));
		if (timeframe != null && !timeframe.equals(properties.baseTimeframe())) {
			bars = TimeframeResampler.resample(bars, timeframe);
		}
		if (count > 0 && bars.size() > count) {
			return List.copyOf(bars.subList(bars.size() - count, bars.size()));
		}
		return bars;
	}

	public List<Bar> loadBars(Path path) {
		MarketDataProperties.CsvConfig csvConfig = properties.csv();
		if (path == null || !Files.exists(path)) {
			LOGGER.warn("EVENT=CSV_MISSING path={}", path);
			return List.of();
		}

		List<Bar> bars = new ArrayList<>();
		try (BufferedReader reader = Files.newBufferedReader(path)) {
			String line;
			boolean headerProcessed = false;
			Map<String, Integer> headerIndex = new HashMap<>();
			while ((line = reader.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				String[] parts = splitCsvLine(line, csvConfig.delimiter());
				if (!headerProcessed && csvConfig.hasHeader()) {
					headerIndex = parseHeader(parts);
					headerProcessed = true;
					continue;
				}
				headerProcessed = true;
				Bar bar = parseBar(parts, headerIndex, csvConfig);
				if (bar != null) {
					bars.add(bar);
				}
			}
		} catch (IOException e) {
			LOGGER.error("EVENT=CSV_READ_FAILED path={} reason={}", path, e.getMessage());
			return List.of();
		}

		bars.sort(Comparator.comparingLong(Bar::time));
		List<Bar> unique = dropDuplicateTimes(bars);
		LOGGER.info("EVENT=CSV_LOADED symbol={} bars={} duplicatesDropped={} path={}", properties.symbol(),
				unique.size(), bars.size() - unique.size(), path);
		return unique;
	}

	private List<Bar> dropDuplicateTimes(List<Bar> sorted) {
		List<Bar> unique = new ArrayList<>(sorted.size());
		for (Bar bar : sorted) {
			if (!unique.isEmpty() && unique.get(unique.size() - 1).time() == bar.time()) {
				continue;
			}
			unique.add(bar);
		}
		return unique;
	}

	private String[] splitCsvLine(String line, String delimiter) {
		String effective = delimiter == null || delimiter.isEmpty() ? "," : delimiter;
		return line.split(java.util.regex.Pattern.quote(effective));
	}

	private Map<String, Integer> parseHeader(String[] header) {
		Map<String, Integer> indexMap = new HashMap<>();
		for (int i = 0; i < header.length; i++) {
			indexMap.put(normalize(header[i]), i);
		}
		return indexMap;
	}

	private Bar parseBar(String[] parts, Map<String, Integer> headerIndex, MarketDataProperties.CsvConfig config) {
		try {
			int timeIdx = resolveIndex(headerIndex, config.timeColumn(), DEFAULT_TIME_INDEX);
			int openIdx = resolveIndex(headerIndex, config.openColumn(), DEFAULT_OPEN_INDEX);
			int highIdx = resolveIndex(headerIndex, config.highColumn(), DEFAULT_HIGH_INDEX);
			int lowIdx = resolveIndex(headerIndex, config.lowColumn(), DEFAULT_LOW_INDEX);
			int closeIdx = resolveIndex(headerIndex, config.closeColumn(), DEFAULT_CLOSE_INDEX);
			int volumeIdx = resolveIndex(headerIndex, config.volumeColumn(), DEFAULT_VOLUME_INDEX);

			long time = parseTime(parts[timeIdx], config.timeFormat());
			double open = Double.parseDouble(parts[openIdx].trim());
			double high = Double.parseDouble(parts[highIdx].trim());
			double low = Double.parseDouble(parts[lowIdx].trim());
			double close = Double.parseDouble(parts[closeIdx].trim());
			long volume = volumeIdx < parts.length ? parseVolume(parts[volumeIdx]) : 0L;
			if (open <= 0 || high <= 0 || low <= 0 || close <= 0) {
				LOGGER.debug("Skipping CSV row with non-positive price at {}", time);
				return null;
			}
			return Bar.of(time, open, high, low, close, volume);
		} catch (RuntimeException e) {
			LOGGER.debug("Skipping invalid CSV row: {}", e.getMessage());
			return null;
		}
	}

	private long parseVolume(String raw) {
		String value = raw.trim();
		if (value.isEmpty()) {
			return 0L;
		}
		return (long) Double.parseDouble(value);
	}

	private long parseTime(String raw, String format) {
		String value = raw.trim();
		String normalizedFormat = format == null ? "ISO" : format.toUpperCase(Locale.ROOT);
		return switch (normalizedFormat) {
			case "MILLIS" -> Long.parseLong(value);
			case "SECONDS" -> Long.parseLong(value) * 1000L;
			default -> parseIsoTime(value);
		};
	}

	private long parseIsoTime(String value) {
		try {
			return Instant.parse(value).toEpochMilli();
		} catch (DateTimeParseException ignored) {
			return LocalDateTime.parse(value, SPACE_SEPARATED).toInstant(ZoneOffset.UTC).toEpochMilli();
		}
	}

	private int resolveIndex(Map<String, Integer> headerIndex, String column, int fallbackIndex) {
		if (headerIndex == null || headerIndex.isEmpty()) {
			return fallbackIndex;
		}
		Integer index = headerIndex.get(normalize(column));
		return index == null ? fallbackIndex : index;
	}

	private String normalize(String raw) {
		if (raw == null) {
			return "";
		}
		return raw.trim()
				.toLowerCase(Locale.ROOT)
				.replace(" ", "")
				.replace("_", "");
	}
}

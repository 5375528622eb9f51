package com.scalper.strategy.indicators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

import com.scalper.market.TrendDirection;

class TrendClassifierTest {

	@Test
	void stackedAveragesAbovePriceAreBullish() {
		assertEquals(TrendDirection.BULLISH, TrendClassifier.classify(2345.0, 2342.0, 2340.0, 2330.0));
	}

	@Test
	void stackedAveragesBelowPriceAreBearish() {
		assertEquals(TrendDirection.BEARISH, TrendClassifier.classify(2320.0, 2325.0, 2330.0, 2340.0));
	}

	@Test
	void mixedStackOrPriceAcrossTrendIsNeutral() {
		assertEquals(TrendDirection.NEUTRAL, TrendClassifier.classify(2345.0, 2340.0, 2342.0, 2330.0));
		assertEquals(TrendDirection.NEUTRAL, TrendClassifier.classify(2325.0, 2342.0, 2340.0, 2330.0));
	}

	@Test
	void warmingUpAverageGivesNoClassification() {
		assertNull(TrendClassifier.classify(2345.0, 2342.0, 2340.0, null));
	}
}

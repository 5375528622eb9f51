package com.scalper.strategy;

import static com.scalper.market.BarFixtures.features;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.scalper.market.Bar;
import com.scalper.market.BarFixtures;

class DivergenceDetectorTest {

	@Test
	void lowerLowWithHigherRsiIsBullish() {
		List<Bar> bars = halves(2340.0, 30.0, 2335.0, 35.0);
		assertEquals(Divergence.BULLISH, DivergenceDetector.classify(bars, 20));
	}

	@Test
	void higherHighWithLowerRsiIsBearish() {
		List<Bar> bars = halves(2340.0, 70.0, 2345.0, 65.0);
		assertEquals(Divergence.BEARISH, DivergenceDetector.classify(bars, 20));
	}

	@Test
	void confirmedMoveIsNotDivergence() {
		assertEquals(Divergence.NONE, DivergenceDetector.classify(halves(2340.0, 40.0, 2335.0, 30.0), 20));
		assertEquals(Divergence.NONE, DivergenceDetector.classify(halves(2340.0, 60.0, 2345.0, 70.0), 20));
	}

	@Test
	void onlyTrailingWindowIsConsidered() {
		List<Bar> bars = new ArrayList<>(halves(2300.0, 10.0, 2300.0, 10.0));
		bars.addAll(shift(halves(2340.0, 30.0, 2335.0, 35.0), bars.size()));
		assertEquals(Divergence.BULLISH, DivergenceDetector.classify(bars, 20));
	}

	@Test
	void insufficientDataOrMissingRsiIsNone() {
		assertEquals(Divergence.NONE, DivergenceDetector.classify(halves(2340.0, 30.0, 2335.0, 35.0), 40));
		assertEquals(Divergence.NONE, DivergenceDetector.classify(List.of(), 20));
		assertEquals(Divergence.NONE, DivergenceDetector.classify(halves(2340.0, null, 2335.0, 35.0), 20));
	}

	private static List<Bar> halves(double firstClose, Double firstRsi, double secondClose, Double secondRsi) {
		List<Bar> bars = new ArrayList<>(20);
		List<Bar> first = BarFixtures.flat(10, firstClose, features().rsi(firstRsi, 0.0).build());
		List<Bar> second = BarFixtures.flat(10, secondClose, features().rsi(secondRsi, 0.0).build());
		bars.addAll(first);
		bars.addAll(shift(second, 10));
		return bars;
	}

	private static List<Bar> shift(List<Bar> bars, int offset) {
		List<Bar> shifted = new ArrayList<>(bars.size());
		for (Bar bar : bars) {
			shifted.add(new Bar(bar.time() + offset * BarFixtures.FIVE_MINUTES, bar.open(), bar.high(), bar.low(),
					bar.close(), bar.volume(), bar.features()));
		}
		return shifted;
	}
}

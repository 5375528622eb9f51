package com.scalper.strategy.indicators;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.scalper.market.Bar;
import com.scalper.market.BarFixtures;

class SwingDetectorTest {

	@Test
	void pivotIsPublishedOnConfirmationBarOnly() {
		List<Bar> bars = bars(1.0, 2.0, 5.0, 2.0, 1.0, 1.5, 1.5);

		List<SwingDetector.SwingState> states = SwingDetector.detect(bars, 2);

		assertNull(states.get(2).lastSwingHigh());
		assertNull(states.get(3).lastSwingHigh());
		assertTrue(states.get(4).highConfirmed());
		assertEquals(5.0, states.get(4).lastSwingHigh());
		assertFalse(states.get(5).highConfirmed());
		assertEquals(5.0, states.get(6).lastSwingHigh());
	}

	@Test
	void swingLowUsesLows() {
		List<Bar> bars = bars(5.0, 4.0, 1.0, 4.0, 5.0, 5.0);

		List<SwingDetector.SwingState> states = SwingDetector.detect(bars, 2);

		assertTrue(states.get(4).lowConfirmed());
		assertEquals(0.5, states.get(4).lastSwingLow());
		assertEquals(0.5, states.get(5).lastSwingLow());
	}

	@Test
	void prefixResultsDoNotDependOnLaterBars() {
		List<Bar> bars = BarFixtures.wave(120);

		List<SwingDetector.SwingState> full = SwingDetector.detect(bars, 5);
		List<SwingDetector.SwingState> prefix = SwingDetector.detect(bars.subList(0, 70), 5);

		assertThat(full.subList(0, 70)).isEqualTo(prefix);
	}

	@Test
	void rejectsNonPositiveWindow() {
		assertThatThrownBy(() -> SwingDetector.detect(List.of(), 0)).isInstanceOf(IllegalArgumentException.class);
	}

	private static List<Bar> bars(double... highs) {
		List<Bar> bars = new ArrayList<>(highs.length);
		for (int i = 0; i < highs.length; i++) {
			double high = highs[i];
			bars.add(Bar.of(BarFixtures.START + i * BarFixtures.FIVE_MINUTES, high - 0.25, high, high - 0.5,
					high - 0.25, 10L));
		}
		return bars;
	}
}

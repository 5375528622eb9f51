package com.scalper.strategy;

import java.util.List;
import java.util.Optional;

import com.scalper.market.Bar;

public interface SignalGenerator {

	Optional<Signal> evaluate(List<Bar> recentBars, List<Bar> higherTimeframeBars);
}

package com.scalper.market;

import java.time.Duration;
import java.util.List;

public interface BarFeed {

	// count 0 means everything available
	List<Bar> fetchBars(Duration timeframe, int count);
}

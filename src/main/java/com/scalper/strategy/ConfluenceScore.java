package com.scalper.strategy;

import java.util.List;

public record ConfluenceScore(
		Direction direction,
		int score,
		int requiredScore,
		boolean counterTrend,
		List<String> reasons) {

	// counter-trend candidate without divergence confirmation
	public static final int REJECTED = -1;

	public ConfluenceScore {
		reasons = reasons == null ? List.of() : List.copyOf(reasons);
	}

	public static ConfluenceScore rejected(Direction direction, int requiredScore) {
		return new ConfluenceScore(direction, REJECTED, requiredScore, true, List.of());
	}

	public boolean isRejected() {
		return score == REJECTED;
	}

	public boolean qualifies() {
		return !isRejected() && score >= requiredScore;
	}
}

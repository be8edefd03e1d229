package com.zenith.scalp;

import java.time.Instant;

import com.zenith.strategy.TradeSide;

public record ExitPlan(
		String symbol,
		CandidateModel model,
		TradeSide side,
		double entry,
		double stop,
		Double tp1,
		Double tp2,
		double trailAtrMultiple,
		long maxHoldSec,
		int maxBars,
		Instant openedAt,
		long entryCandleOpenTime) {

	public double risk() {
		return Math.abs(entry - stop);
	}
}

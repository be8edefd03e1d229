package com.zenith.scalp;

import java.util.ArrayList;
import java.util.List;

import com.zenith.market.Candle;

/**
 * Three-candle imbalances: a bullish gap leaves the third low above the first high, a bearish gap leaves the
 * third high below the first low.
 */
public final class FairValueGapDetector {

	private FairValueGapDetector() {
	}

	/**
	 * Gaps inside the last {@code lookback} candles, most recent first.
	 */
	public static List<FairValueGap> detect(List<Candle> candles, int lookback) {
		List<FairValueGap> gaps = new ArrayList<>();
		int start = Math.max(2, candles.size() - lookback);
		for (int i = candles.size() - 1; i >= start; i--) {
			Candle first = candles.get(i - 2);
			Candle third = candles.get(i);
			if (third.low() > first.high()) {
				gaps.add(new FairValueGap(true, first.high(), third.low(), third.openTime()));
			} else if (third.high() < first.low()) {
				gaps.add(new FairValueGap(false, third.high(), first.low(), third.openTime()));
			}
		}
		return gaps;
	}

	public static double averageSize(List<FairValueGap> gaps) {
		if (gaps.isEmpty()) {
			return 0.0;
		}
		double total = 0.0;
		for (FairValueGap gap : gaps) {
			total += gap.size();
		}
		return total / gaps.size();
	}
}

package com.zenith.scalp;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.zenith.market.BookSnapshot;
import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

/**
 * Everything the scalp models read for one symbol on one tick.
 */
public record ScalpFeatures(
		String symbol,
		List<Candle> candles,
		double close,
		double ema25,
		double ema50,
		double ema100,
		double rsi14,
		double atr22,
		double tickSize,
		VolumeProfile volumeProfile,
		List<FairValueGap> fairValueGaps,
		double fairValueGapAvgSize,
		OrderFlow orderFlow,
		BookSnapshot book,
		TradingSession session,
		MarketRegime regime,
		double signalAgeSec,
		Instant timestamp) {

	public ScalpFeatures {
		candles = List.copyOf(candles);
		fairValueGaps = fairValueGaps == null ? List.of() : List.copyOf(fairValueGaps);
	}

	public Candle lastCandle() {
		return candles.get(candles.size() - 1);
	}

	public Optional<Candle> previousCandle() {
		return candles.size() > 1 ? Optional.of(candles.get(candles.size() - 2)) : Optional.empty();
	}

	/**
	 * Most recent gap in the direction of the side.
	 */
	public Optional<FairValueGap> gapFor(TradeSide side) {
		boolean bullish = side == TradeSide.LONG;
		return fairValueGaps.stream().filter(gap -> gap.bullish() == bullish).findFirst();
	}

	public MicroSnapshot microFor(TradeSide side) {
		double bid = book.bidDepth();
		double ask = book.askDepth();
		double depthBias = side == TradeSide.LONG
				? bid / Math.max(1.0, ask)
				: Math.max(1.0, ask) / Math.max(1.0, bid);
		return new MicroSnapshot(book.spreadBp(), book.latencyMs(), book.quoteAgeMs(), depthBias);
	}

	public MicroSnapshot neutralMicro() {
		return new MicroSnapshot(book.spreadBp(), book.latencyMs(), book.quoteAgeMs(), 1.0);
	}
}

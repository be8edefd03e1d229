package com.zenith.strategy;

import java.time.Instant;
import java.util.List;

import com.zenith.market.Candle;
import com.zenith.market.MarketEnrichment;
import com.zenith.market.MarketMetrics;
import com.zenith.market.MarketSnapshot;
import com.zenith.strategy.indicators.CandleIndicators;
import com.zenith.strategy.indicators.EmaIndicator;
import com.zenith.strategy.indicators.SeriesStats;

public final class MarketSnapshotFactory {

	private static final int RANGE_LOOKBACK = 30;

	private MarketSnapshotFactory() {
	}

	public static MarketSnapshot fromCandles(String symbol, String interval, List<Candle> candles) {
		if (candles == null || candles.isEmpty()) {
			throw new IllegalArgumentException("No candles provided for market snapshot of " + symbol);
		}
		MarketMetrics metrics = computeMetrics(candles);
		return new MarketSnapshot(symbol, interval, candles, metrics, MarketEnrichment.empty(),
				SignalGenerator.derive(metrics));
	}

	static MarketMetrics computeMetrics(List<Candle> candles) {
		int size = candles.size();
		double[] closes = new double[size];
		double[] volumes = new double[size];
		for (int i = 0; i < size; i++) {
			closes[i] = candles.get(i).close();
			volumes[i] = candles.get(i).volume();
		}
		Candle last = candles.get(size - 1);
		double lastPrice = last.close();

		double[] returns = new double[Math.max(0, size - 1)];
		int returnCount = 0;
		for (int i = 1; i < size; i++) {
			if (closes[i - 1] > 0) {
				returns[returnCount++] = (closes[i] - closes[i - 1]) / closes[i - 1] * 100.0;
			}
		}
		double[] validReturns = new double[returnCount];
		System.arraycopy(returns, 0, validReturns, 0, returnCount);

		double atr = CandleIndicators.atr(candles, 14);
		double support = Double.POSITIVE_INFINITY;
		double resistance = Double.NEGATIVE_INFINITY;
		for (Candle candle : candles.subList(Math.max(0, size - RANGE_LOOKBACK), size)) {
			support = Math.min(support, candle.low());
			resistance = Math.max(resistance, candle.high());
		}

		double shortVolume = SeriesStats.sma(volumes, 20);
		double longVolume = SeriesStats.sma(volumes, 60);
		double lastVolume = volumes[size - 1];
		double priorVolume = size > 1 ? volumes[size - 2] : lastVolume;

		return new MarketMetrics(
				lastPrice,
				SeriesStats.percentChange(closeAgo(closes, 1), lastPrice),
				SeriesStats.percentChange(closeAgo(closes, 5), lastPrice),
				SeriesStats.percentChange(closeAgo(closes, 15), lastPrice),
				SeriesStats.sma(closes, 5),
				SeriesStats.sma(closes, 15),
				EmaIndicator.of(closes, 21),
				EmaIndicator.of(closes, 55),
				SeriesStats.rsi(closes, 14),
				SeriesStats.stddev(validReturns),
				lastPrice > 0 ? atr / lastPrice * 100.0 : 0.0,
				longVolume == 0.0 ? 1.0 : shortVolume / longVolume,
				priorVolume == 0.0 ? 0.0 : (lastVolume - priorVolume) / priorVolume * 100.0,
				SeriesStats.volumeAcceleration(volumes),
				CandleIndicators.moneyFlowIndex(candles, 14),
				CandleIndicators.onBalanceVolumeSlope(candles, 10),
				support,
				resistance,
				Instant.ofEpochMilli(last.closeTime()));
	}

	private static double closeAgo(double[] closes, int candlesAgo) {
		int index = closes.length - 1 - candlesAgo;
		return index >= 0 ? closes[index] : closes[closes.length - 1];
	}
}

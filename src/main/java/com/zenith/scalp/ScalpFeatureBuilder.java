package com.zenith.scalp;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.DoubleNum;

import com.zenith.market.BookSnapshot;
import com.zenith.market.Candle;

/**
 * Builds {@link ScalpFeatures} from a kline window and the current book.
 */
public class ScalpFeatureBuilder {

	static final int MIN_CANDLES = 30;
	private static final int FLOW_WINDOW = 5;
	private static final int BUBBLE_LOOKBACK = 20;
	private static final double BUBBLE_MULTIPLE = 2.5;
	private static final int FVG_LOOKBACK = 30;

	public ScalpFeatures build(String symbol, List<Candle> candles, BookSnapshot book, double tickSize,
			Instant now) {
		if (candles.size() < MIN_CANDLES) {
			throw new IllegalArgumentException("Scalp features need at least " + MIN_CANDLES + " candles for "
					+ symbol + " but got " + candles.size());
		}
		BarSeries series = toSeries(symbol, candles);
		int end = series.getEndIndex();
		ClosePriceIndicator close = new ClosePriceIndicator(series);
		double ema25 = new EMAIndicator(close, 25).getValue(end).doubleValue();
		double ema50 = new EMAIndicator(close, 50).getValue(end).doubleValue();
		double ema100 = new EMAIndicator(close, 100).getValue(end).doubleValue();
		double rsi = new RSIIndicator(close, 14).getValue(end).doubleValue();
		double atr = new ATRIndicator(series, 22).getValue(end).doubleValue();

		Candle last = candles.get(candles.size() - 1);
		double lastClose = last.close();
		List<FairValueGap> gaps = FairValueGapDetector.detect(candles, FVG_LOOKBACK);
		double signalAgeSec = Math.max(0.0, (now.toEpochMilli() - last.closeTime()) / 1000.0);

		return new ScalpFeatures(
				symbol,
				candles,
				lastClose,
				ema25,
				ema50,
				ema100,
				Double.isNaN(rsi) ? 50.0 : rsi,
				atr,
				tickSize > 0 ? tickSize : fallbackTick(lastClose),
				VolumeProfileCalculator.compute(candles, VolumeProfileCalculator.DEFAULT_BINS),
				gaps,
				FairValueGapDetector.averageSize(gaps),
				orderFlow(candles),
				book,
				TradingSession.at(now),
				MarketRegime.fromEmaStack(lastClose, ema25, ema50, ema100),
				signalAgeSec,
				now);
	}

	static BarSeries toSeries(String symbol, List<Candle> candles) {
		BarSeries series = new BaseBarSeriesBuilder()
				.withName(symbol)
				.withNumTypeOf(DoubleNum.class)
				.build();
		long lastEnd = Long.MIN_VALUE;
		for (Candle candle : candles) {
			if (candle.closeTime() <= lastEnd) {
				continue;
			}
			lastEnd = candle.closeTime();
			ZonedDateTime endTime = Instant.ofEpochMilli(candle.closeTime()).atZone(ZoneOffset.UTC);
			Duration period = Duration.ofMillis(Math.max(1L, candle.closeTime() - candle.openTime() + 1));
			series.addBar(period, endTime, candle.open(), candle.high(), candle.low(), candle.close(),
					candle.volume());
		}
		return series;
	}

	static OrderFlow orderFlow(List<Candle> candles) {
		int size = candles.size();
		double buy = 0.0;
		double sell = 0.0;
		for (Candle candle : candles.subList(Math.max(0, size - FLOW_WINDOW), size)) {
			buy += candle.takerBuyVolume();
			sell += candle.takerSellVolume();
		}
		List<Candle> history = candles.subList(Math.max(0, size - 1 - BUBBLE_LOOKBACK), size - 1);
		double average = history.stream().mapToDouble(Candle::volume).average().orElse(0.0);
		boolean bubble = average > 0 && candles.get(size - 1).volume() >= average * BUBBLE_MULTIPLE;
		return new OrderFlow(buy, sell, bubble);
	}

	private static double fallbackTick(double price) {
		return price >= 1000 ? 0.1 : price >= 10 ? 0.01 : 0.0001;
	}
}

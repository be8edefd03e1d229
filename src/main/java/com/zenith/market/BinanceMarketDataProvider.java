package com.zenith.market;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.market.dto.BookTickerResponse;
import com.zenith.market.dto.OpenInterestResponse;
import com.zenith.market.dto.OrderBookDepthResponse;
import com.zenith.market.dto.PremiumIndexResponse;
import com.zenith.market.dto.TakerVolumeEntry;
import com.zenith.market.dto.Ticker24hResponse;
import com.zenith.strategy.MarketSnapshotFactory;

import reactor.core.publisher.Mono;

/**
 * Snapshots from public futures endpoints. Klines are required; every enrichment endpoint is best effort.
 */
public class BinanceMarketDataProvider implements MarketDataProvider {

	private static final Logger LOGGER = LoggerFactory.getLogger(BinanceMarketDataProvider.class);
	static final int DEPTH_LEVELS = 10;
	private static final double MAX_TAKER_RATIO = 10.0;

	private final BinanceMarketClient client;
	private final Clock clock;

	public BinanceMarketDataProvider(BinanceMarketClient client, Clock clock) {
		this.client = client;
		this.clock = clock;
	}

	@Override
	public Mono<MarketSnapshot> snapshot(String symbol, String interval, int limit) {
		return client.fetchFuturesKlines(symbol, interval, limit)
				.map(candles -> MarketSnapshotFactory.fromCandles(symbol, interval, candles))
				.flatMap(snapshot -> enrichment(symbol)
						.map(enriched -> snapshot.withEnrichment(enriched.value(), enriched.lastPrice())));
	}

	@Override
	public Mono<BookSnapshot> book(String symbol) {
		long started = clock.millis();
		return Mono.zip(client.fetchFuturesBookTicker(symbol), client.fetchOrderBookDepth(symbol, DEPTH_LEVELS))
				.map(tuple -> toBook(tuple.getT1(), tuple.getT2(), started, clock.millis()));
	}

	static BookSnapshot toBook(BookTickerResponse ticker, OrderBookDepthResponse depth, long started, long now) {
		Long quoteTime = ticker.time() != null ? ticker.time()
				: depth.eventTime() != null ? depth.eventTime() : depth.transactionTime();
		long quoteAge = quoteTime == null ? 0L : Math.max(0L, now - quoteTime);
		return new BookSnapshot(
				value(ticker.bidPrice()),
				value(ticker.askPrice()),
				depth.bidQuantity(DEPTH_LEVELS),
				depth.askQuantity(DEPTH_LEVELS),
				quoteAge,
				Math.max(0L, now - started));
	}

	record Enriched(MarketEnrichment value, Double lastPrice) {
	}

	private Mono<Enriched> enrichment(String symbol) {
		return Mono.zip(
						optional(symbol, "ticker24h", client.fetch24hTicker(symbol)),
						optional(symbol, "premiumIndex", client.fetchPremiumIndex(symbol)),
						optional(symbol, "openInterest", client.fetchOpenInterest(symbol)),
						optional(symbol, "takerVolume", client.fetchTakerVolume(symbol, "5m", 1)))
				.map(tuple -> enrich(tuple.getT1(), tuple.getT2(), tuple.getT3(), tuple.getT4()));
	}

	static Enriched enrich(Optional<Ticker24hResponse> ticker, Optional<PremiumIndexResponse> premium,
			Optional<OpenInterestResponse> openInterest, Optional<List<TakerVolumeEntry>> takerVolume) {
		Double ratio = takerVolume
				.filter(entries -> !entries.isEmpty())
				.map(entries -> entries.get(entries.size() - 1).buySellRatio())
				.map(BigDecimal::doubleValue)
				.filter(Double::isFinite)
				.map(value -> Math.max(0.0, Math.min(MAX_TAKER_RATIO, value)))
				.orElse(null);
		MarketEnrichment enrichment = new MarketEnrichment(
				ticker.map(Ticker24hResponse::priceChangePercent).map(BigDecimal::doubleValue).orElse(null),
				ticker.map(Ticker24hResponse::highPrice).map(BigDecimal::doubleValue).orElse(null),
				ticker.map(Ticker24hResponse::lowPrice).map(BigDecimal::doubleValue).orElse(null),
				ticker.map(Ticker24hResponse::quoteVolume).map(BigDecimal::doubleValue).orElse(null),
				premium.map(PremiumIndexResponse::markPrice).map(BigDecimal::doubleValue).orElse(null),
				premium.map(PremiumIndexResponse::indexPrice).map(BigDecimal::doubleValue).orElse(null),
				premium.map(PremiumIndexResponse::lastFundingRate).map(BigDecimal::doubleValue).orElse(null),
				premium.map(PremiumIndexResponse::nextFundingTime).filter(time -> time > 0)
						.map(Instant::ofEpochMilli).orElse(null),
				openInterest.map(OpenInterestResponse::openInterest).map(BigDecimal::doubleValue).orElse(null),
				ratio,
				takerFlowBias(ratio));
		Double lastPrice = ticker.map(Ticker24hResponse::lastPrice).map(BigDecimal::doubleValue).orElse(null);
		return new Enriched(enrichment, lastPrice);
	}

	static String takerFlowBias(Double ratio) {
		if (ratio == null) {
			return null;
		}
		if (ratio > 1.05) {
			return "long";
		}
		return ratio < 0.95 ? "short" : "neutral";
	}

	private static <T> Mono<Optional<T>> optional(String symbol, String source, Mono<T> call) {
		return call.map(Optional::of)
				.defaultIfEmpty(Optional.empty())
				.onErrorResume(error -> {
					LOGGER.debug("EVENT=ENRICHMENT_SKIP symbol={} source={} reason={}", symbol, source,
							error.getMessage());
					return Mono.just(Optional.empty());
				});
	}

	private static double value(BigDecimal decimal) {
		return decimal == null ? 0.0 : decimal.doubleValue();
	}
}

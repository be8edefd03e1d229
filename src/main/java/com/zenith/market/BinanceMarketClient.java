package com.zenith.market;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenith.market.dto.BookTickerResponse;
import com.zenith.market.dto.OpenInterestResponse;
import com.zenith.market.dto.OrderBookDepthResponse;
import com.zenith.market.dto.PremiumIndexResponse;
import com.zenith.market.dto.Ticker24hResponse;
import com.zenith.market.dto.TakerVolumeEntry;

import reactor.core.publisher.Mono;

@Component
public class BinanceMarketClient {

	private static final ParameterizedTypeReference<List<TakerVolumeEntry>> TAKER_LIST =
			new ParameterizedTypeReference<>() { };

	private final WebClient binanceWebClient;

	public BinanceMarketClient(@Qualifier("binanceWebClient") WebClient binanceWebClient) {
		this.binanceWebClient = binanceWebClient;
	}

	public Mono<List<Candle>> fetchFuturesKlines(String symbol, String interval, int limit) {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/klines")
						.queryParam("symbol", symbol)
						.queryParam("interval", interval)
						.queryParam("limit", limit)
						.build())
				.retrieve()
				.bodyToMono(JsonNode.class)
				.map(BinanceMarketClient::parseKlines);
	}

	public Mono<Ticker24hResponse> fetch24hTicker(String symbol) {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/ticker/24hr")
						.queryParam("symbol", symbol)
						.build())
				.retrieve()
				.bodyToMono(Ticker24hResponse.class);
	}

	public Mono<PremiumIndexResponse> fetchPremiumIndex(String symbol) {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/premiumIndex")
						.queryParam("symbol", symbol)
						.build())
				.retrieve()
				.bodyToMono(PremiumIndexResponse.class);
	}

	public Mono<OpenInterestResponse> fetchOpenInterest(String symbol) {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/openInterest")
						.queryParam("symbol", symbol)
						.build())
				.retrieve()
				.bodyToMono(OpenInterestResponse.class);
	}

	public Mono<List<TakerVolumeEntry>> fetchTakerVolume(String symbol, String period, int limit) {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/futures/data/takerlongshortRatio")
						.queryParam("symbol", symbol)
						.queryParam("period", period)
						.queryParam("limit", limit)
						.build())
				.retrieve()
				.bodyToMono(TAKER_LIST);
	}

	public Mono<BookTickerResponse> fetchFuturesBookTicker(String symbol) {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/ticker/bookTicker")
						.queryParam("symbol", symbol)
						.build())
				.retrieve()
				.bodyToMono(BookTickerResponse.class);
	}

	public Mono<OrderBookDepthResponse> fetchOrderBookDepth(String symbol, int limit) {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/depth")
						.queryParam("symbol", symbol)
						.queryParam("limit", limit)
						.build())
				.retrieve()
				.bodyToMono(OrderBookDepthResponse.class);
	}

	static List<Candle> parseKlines(JsonNode node) {
		if (node == null || !node.isArray()) {
			return List.of();
		}
		List<Candle> candles = new ArrayList<>();
		for (JsonNode entry : node) {
			if (!entry.isArray() || entry.size() < 7) {
				continue;
			}
			double volume = entry.get(5).asDouble();
			double takerBuy = entry.size() > 9 ? entry.get(9).asDouble() : volume / 2.0;
			candles.add(new Candle(
					entry.get(0).asLong(),
					entry.get(1).asDouble(),
					entry.get(2).asDouble(),
					entry.get(3).asDouble(),
					entry.get(4).asDouble(),
					volume,
					entry.get(6).asLong(),
					takerBuy));
		}
		return candles;
	}
}

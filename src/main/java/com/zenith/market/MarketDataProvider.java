package com.zenith.market;

import reactor.core.publisher.Mono;

public interface MarketDataProvider {

	Mono<MarketSnapshot> snapshot(String symbol, String interval, int limit);

	Mono<BookSnapshot> book(String symbol);
}

package com.zenith.exchange;

import java.math.BigDecimal;
import java.util.List;

import com.zenith.exchange.dto.AccountBalance;
import com.zenith.exchange.dto.ExchangeInfoResponse;
import com.zenith.exchange.dto.OrderResponse;
import com.zenith.exchange.dto.PositionRisk;

import reactor.core.publisher.Mono;

/**
 * Exchange operations the engine depends on. Implementations report failures as error signals;
 * callers decide what is retryable.
 */
public interface ExchangeAdapter {

	Mono<List<AccountBalance>> fetchAccountBalance();

	Mono<List<PositionRisk>> fetchPositions();

	Mono<ExchangeInfoResponse> fetchExchangeInfo();

	Mono<TradingFilters> fetchTradingFilters(String symbol);

	Mono<OrderResponse> placeMarketOrder(String symbol, OrderSide side, String quantity, OrderOptions options);

	Mono<OrderResponse> placeLimitOrder(String symbol, OrderSide side, String quantity, BigDecimal price,
			OrderOptions options);

	Mono<Void> setLeverage(String symbol, int leverage);

	/**
	 * Largest notional the exchange allows at the given leverage, or empty when no bracket applies.
	 */
	Mono<BigDecimal> getMaxNotionalForLeverage(String symbol, int leverage);
}

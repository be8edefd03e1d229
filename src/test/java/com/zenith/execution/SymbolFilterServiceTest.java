package com.zenith.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.zenith.exchange.ExchangeAdapter;
import com.zenith.exchange.TradingFilters;
import com.zenith.exchange.dto.ExchangeInfoResponse;
import com.zenith.exchange.dto.ExchangeInfoResponse.ExchangeFilter;
import com.zenith.exchange.dto.ExchangeInfoResponse.SymbolInfo;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class SymbolFilterServiceTest {

	@Test
	void parseExchangeInfoKeepsTrackedSymbolsOnly() {
		Map<String, TradingFilters> parsed = SymbolFilterService.parseExchangeInfo(exchangeInfo(),
				List.of("ethusdt", "XRPUSDT"));

		assertThat(parsed).containsOnlyKeys("ETHUSDT");
		TradingFilters filters = parsed.get("ETHUSDT");
		assertThat(filters.stepSize()).isEqualByComparingTo("0.01");
		assertThat(filters.minQty()).isEqualByComparingTo("0.01");
		assertThat(filters.maxQty()).isEqualByComparingTo("500");
		assertThat(filters.minNotional()).isEqualByComparingTo("20");
		assertThat(filters.tickSize()).isEqualByComparingTo("0.01");
		assertThat(filters.stepSizePrecision()).isEqualTo(2);
	}

	@Test
	void filtersAreCachedUntilTheTtlExpires() {
		ExchangeAdapter exchange = mock(ExchangeAdapter.class);
		when(exchange.fetchExchangeInfo()).thenReturn(Mono.just(exchangeInfo()));
		SymbolFilterService service = new SymbolFilterService(exchange, 60_000,
				Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
		service.track(List.of("ETHUSDT"));

		StepVerifier.create(service.filtersFor("ETHUSDT"))
				.assertNext(filters -> assertThat(filters.symbol()).isEqualTo("ETHUSDT"))
				.verifyComplete();
		StepVerifier.create(service.normalize("ETHUSDT", new BigDecimal("0.123"), new BigDecimal("3000")))
				.assertNext(quantity -> assertThat(quantity.quantityText()).isEqualTo("0.120"))
				.verifyComplete();

		verify(exchange, times(1)).fetchExchangeInfo();
	}

	@Test
	void unknownSymbolErrors() {
		ExchangeAdapter exchange = mock(ExchangeAdapter.class);
		when(exchange.fetchExchangeInfo()).thenReturn(Mono.just(exchangeInfo()));
		SymbolFilterService service = new SymbolFilterService(exchange, 60_000, Clock.systemUTC());

		StepVerifier.create(service.filtersFor("DOGEUSDT"))
				.expectError(IllegalStateException.class)
				.verify();
	}

	private static ExchangeInfoResponse exchangeInfo() {
		ExchangeFilter lot = new ExchangeFilter("LOT_SIZE", new BigDecimal("0.01"), new BigDecimal("1000"),
				new BigDecimal("0.01"), null, null, null, null);
		ExchangeFilter marketLot = new ExchangeFilter("MARKET_LOT_SIZE", new BigDecimal("0.01"),
				new BigDecimal("500"), new BigDecimal("0.01"), null, null, null, null);
		ExchangeFilter notional = new ExchangeFilter("MIN_NOTIONAL", null, null, null, null, new BigDecimal("20"),
				null, null);
		ExchangeFilter price = new ExchangeFilter("PRICE_FILTER", null, null, null, null, null, null,
				new BigDecimal("0.01"));
		SymbolInfo eth = new SymbolInfo("ETHUSDT", "TRADING", "PERPETUAL", "USDT", 3, 2,
				List.of(lot, marketLot, notional, price));
		SymbolInfo other = new SymbolInfo("OTHERUSDT", "TRADING", "PERPETUAL", "USDT", 0, 4, List.of(lot));
		return new ExchangeInfoResponse(List.of(eth, other));
	}
}

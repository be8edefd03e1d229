package com.zenith.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.zenith.exchange.ExchangeAdapter;
import com.zenith.exchange.TradingFilters;
import com.zenith.execution.MarginCheck.CapSource;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class MarginGuardTest {

	private static final TradingFilters FILTERS = TradingFilters.of("BTCUSDT", new BigDecimal("0.001"),
			new BigDecimal("0.001"), new BigDecimal("1000"), new BigDecimal("5"));
	private static final BigDecimal PRICE = new BigDecimal("100");

	private final ExchangeAdapter exchange = mock(ExchangeAdapter.class);
	private final MarginGuard guard = new MarginGuard(exchange);

	@Test
	void orderWithinMarginCapPassesUnchanged() {
		when(exchange.getMaxNotionalForLeverage(eq("BTCUSDT"), anyInt())).thenReturn(Mono.empty());
		NormalizedQuantity order = QuantityNormalizer.normalize(FILTERS, new BigDecimal("2"), PRICE);

		StepVerifier.create(guard.enforce("BTCUSDT", 5, PRICE, order, new BigDecimal("100")))
				.assertNext(check -> {
					assertThat(check.allowed()).isTrue();
					assertThat(check.order()).isSameAs(order);
					assertThat(check.notionalCap()).isEqualByComparingTo("450");
					assertThat(check.capSource()).isEqualTo(CapSource.MARGIN);
				})
				.verifyComplete();
	}

	@Test
	void oversizedOrderIsReducedToTheBracketCap() {
		when(exchange.getMaxNotionalForLeverage("BTCUSDT", 10)).thenReturn(Mono.just(new BigDecimal("250")));
		NormalizedQuantity order = QuantityNormalizer.normalize(FILTERS, new BigDecimal("10"), PRICE);

		StepVerifier.create(guard.enforce("BTCUSDT", 10, PRICE, order, new BigDecimal("1000")))
				.assertNext(check -> {
					assertThat(check.allowed()).isTrue();
					assertThat(check.capSource()).isEqualTo(CapSource.LEVERAGE_BRACKET);
					assertThat(check.order().quantityText()).isEqualTo("2.500");
				})
				.verifyComplete();
	}

	@Test
	void bracketLookupFailureFallsBackToMarginCap() {
		when(exchange.getMaxNotionalForLeverage(eq("BTCUSDT"), anyInt()))
				.thenReturn(Mono.error(new IllegalStateException("brackets down")));
		NormalizedQuantity order = QuantityNormalizer.normalize(FILTERS, new BigDecimal("10"), PRICE);

		StepVerifier.create(guard.enforce("BTCUSDT", 2, PRICE, order, new BigDecimal("100")))
				.assertNext(check -> {
					assertThat(check.allowed()).isTrue();
					assertThat(check.capSource()).isEqualTo(CapSource.MARGIN);
					assertThat(check.order().quantityText()).isEqualTo("1.800");
				})
				.verifyComplete();
	}

	@Test
	void capBelowMinNotionalRejects() {
		when(exchange.getMaxNotionalForLeverage(eq("BTCUSDT"), anyInt())).thenReturn(Mono.empty());
		NormalizedQuantity order = QuantityNormalizer.normalize(FILTERS, new BigDecimal("1"), PRICE);

		StepVerifier.create(guard.enforce("BTCUSDT", 1, PRICE, order, new BigDecimal("4")))
				.assertNext(check -> assertThat(check.allowed()).isFalse())
				.verifyComplete();
	}

	@Test
	void missingMarginRejects() {
		NormalizedQuantity order = QuantityNormalizer.normalize(FILTERS, new BigDecimal("1"), PRICE);

		StepVerifier.create(guard.enforce("BTCUSDT", 5, PRICE, order, BigDecimal.ZERO))
				.assertNext(check -> assertThat(check.allowed()).isFalse())
				.verifyComplete();
	}

	@Test
	void capGrowsWithLeverageAndShrinksWithMargin() {
		BigDecimal previous = BigDecimal.ZERO;
		for (int leverage = 1; leverage <= 125; leverage++) {
			BigDecimal cap = MarginGuard.marginCap(new BigDecimal("250"), leverage);
			assertThat(cap).isGreaterThanOrEqualTo(previous);
			previous = cap;
		}
		BigDecimal larger = MarginGuard.effectiveCap(MarginGuard.marginCap(new BigDecimal("500"), 10),
				new BigDecimal("3000"));
		BigDecimal smaller = MarginGuard.effectiveCap(MarginGuard.marginCap(new BigDecimal("200"), 10),
				new BigDecimal("3000"));
		assertThat(smaller).isLessThanOrEqualTo(larger);
	}
}

package com.zenith.execution;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.exchange.ExchangeAdapter;
import com.zenith.execution.MarginCheck.CapSource;

import reactor.core.publisher.Mono;

/**
 * Caps an order's notional by what the free margin and the exchange leverage bracket can carry.
 */
public class MarginGuard {

	private static final Logger LOGGER = LoggerFactory.getLogger(MarginGuard.class);
	static final BigDecimal SAFETY_BUFFER = new BigDecimal("0.9");

	private final ExchangeAdapter exchange;

	public MarginGuard(ExchangeAdapter exchange) {
		this.exchange = exchange;
	}

	public Mono<MarginCheck> enforce(String symbol, int leverage, BigDecimal referencePrice, NormalizedQuantity order,
			BigDecimal availableMargin) {
		if (!order.isTradable()) {
			return Mono.just(MarginCheck.reject(order, null, CapSource.NONE));
		}
		if (referencePrice == null || referencePrice.signum() <= 0) {
			return Mono.just(MarginCheck.allow(order, null, CapSource.NONE));
		}
		if (availableMargin == null || availableMargin.signum() <= 0) {
			LOGGER.warn("EVENT=MARGIN_UNAVAILABLE symbol={} available={}", symbol, availableMargin);
			return Mono.just(MarginCheck.reject(order, BigDecimal.ZERO, CapSource.MARGIN));
		}
		int effectiveLeverage = Math.max(leverage, 1);
		BigDecimal marginCap = marginCap(availableMargin, effectiveLeverage);
		return bracketCap(symbol, effectiveLeverage)
				.map(bracket -> evaluate(symbol, referencePrice, order, marginCap, bracket.orElse(null)));
	}

	MarginCheck evaluate(String symbol, BigDecimal price, NormalizedQuantity order, BigDecimal marginCap,
			BigDecimal bracketCap) {
		BigDecimal cap = effectiveCap(marginCap, bracketCap);
		CapSource source = cap.compareTo(marginCap) == 0 ? CapSource.MARGIN : CapSource.LEVERAGE_BRACKET;
		BigDecimal notional = order.quantity().multiply(price);
		if (notional.compareTo(cap) <= 0) {
			return MarginCheck.allow(order, cap, source);
		}
		if (cap.compareTo(order.filters().minNotional()) < 0) {
			LOGGER.warn("EVENT=MARGIN_CAP_BELOW_MIN_NOTIONAL symbol={} cap={} minNotional={} source={}",
					symbol, cap, order.filters().minNotional(), source);
			return MarginCheck.reject(order, cap, source);
		}
		BigDecimal cappedQty = cap.divide(price, MathContext.DECIMAL64);
		NormalizedQuantity reduced = QuantityNormalizer.normalize(order.filters(), cappedQty, price);
		if (!reduced.isTradable()) {
			LOGGER.warn("EVENT=MARGIN_CAP_REJECT symbol={} cap={} desiredNotional={} reason={}",
					symbol, cap, notional, reduced.rejection());
			return MarginCheck.reject(reduced, cap, source);
		}
		LOGGER.info("EVENT=MARGIN_CAP symbol={} source={} cap={} desiredQty={} cappedQty={}",
				symbol, source, cap, order.quantityText(), reduced.quantityText());
		return MarginCheck.allow(reduced, cap, source);
	}

	static BigDecimal marginCap(BigDecimal availableMargin, int leverage) {
		return availableMargin.multiply(BigDecimal.valueOf(Math.max(leverage, 1))).multiply(SAFETY_BUFFER);
	}

	static BigDecimal effectiveCap(BigDecimal marginCap, BigDecimal bracketCap) {
		if (bracketCap != null && bracketCap.signum() > 0 && bracketCap.compareTo(marginCap) < 0) {
			return bracketCap;
		}
		return marginCap;
	}

	private Mono<Optional<BigDecimal>> bracketCap(String symbol, int leverage) {
		return exchange.getMaxNotionalForLeverage(symbol, leverage)
				.map(Optional::of)
				.defaultIfEmpty(Optional.empty())
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=LEVERAGE_BRACKET_FAIL symbol={} leverage={} reason={}", symbol, leverage,
							error.getMessage());
					return Mono.just(Optional.empty());
				});
	}
}

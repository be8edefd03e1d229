package com.zenith.exchange;

import java.math.BigDecimal;

import com.zenith.exchange.dto.ExchangeInfoResponse.ExchangeFilter;
import com.zenith.exchange.dto.ExchangeInfoResponse.SymbolInfo;

/**
 * Quantity rules for one symbol. {@code maxQty} and {@code maxNotional} are null when unbounded;
 * the precision fields are null when the exchange does not report them.
 */
public record TradingFilters(
		String symbol,
		BigDecimal stepSize,
		BigDecimal minQty,
		BigDecimal maxQty,
		BigDecimal minNotional,
		BigDecimal maxNotional,
		Integer quantityPrecision,
		Integer stepSizePrecision,
		BigDecimal tickSize) {

	public TradingFilters {
		stepSize = nonNegative(stepSize);
		minQty = nonNegative(minQty);
		minNotional = nonNegative(minNotional);
		maxQty = positiveOrNull(maxQty);
		maxNotional = positiveOrNull(maxNotional);
	}

	public static TradingFilters of(String symbol, BigDecimal stepSize, BigDecimal minQty, BigDecimal maxQty,
			BigDecimal minNotional) {
		return new TradingFilters(symbol, stepSize, minQty, maxQty, minNotional, null, null,
				precisionOf(stepSize), null);
	}

	public boolean hasStep() {
		return stepSize.signum() > 0;
	}

	public static TradingFilters fromSymbolInfo(SymbolInfo info) {
		ExchangeFilter marketLot = findFilter(info, "MARKET_LOT_SIZE");
		ExchangeFilter lot = findFilter(info, "LOT_SIZE");
		ExchangeFilter notional = findFilter(info, "NOTIONAL");
		if (notional == null) {
			notional = findFilter(info, "MIN_NOTIONAL");
		}
		ExchangeFilter price = findFilter(info, "PRICE_FILTER");

		BigDecimal stepSize = firstNonNull(marketLot == null ? null : positiveOrNull(marketLot.stepSize()),
				lot == null ? null : lot.stepSize());
		BigDecimal minQty = max(marketLot == null ? null : marketLot.minQty(), lot == null ? null : lot.minQty());
		BigDecimal maxQty = minPositive(marketLot == null ? null : marketLot.maxQty(),
				lot == null ? null : lot.maxQty());
		BigDecimal minNotional = null;
		BigDecimal maxNotional = null;
		if (notional != null) {
			minNotional = notional.minNotional() != null ? notional.minNotional() : notional.notional();
			maxNotional = notional.maxNotional();
		}
		Integer quantityPrecision = info.quantityPrecision() == null ? null : Math.max(0, info.quantityPrecision());
		return new TradingFilters(
				info.symbol() == null ? null : info.symbol().toUpperCase(),
				stepSize,
				minQty,
				maxQty,
				minNotional,
				maxNotional,
				quantityPrecision,
				precisionOf(stepSize),
				price == null ? null : price.tickSize());
	}

	/**
	 * Fractional digits of a step after trailing zeros are dropped, e.g. {@code 0.00100000 -> 3}.
	 */
	public static Integer precisionOf(BigDecimal step) {
		if (step == null || step.signum() <= 0) {
			return null;
		}
		return Math.max(0, step.stripTrailingZeros().scale());
	}

	private static ExchangeFilter findFilter(SymbolInfo info, String type) {
		if (info.filters() == null) {
			return null;
		}
		return info.filters().stream()
				.filter(filter -> filter != null && type.equalsIgnoreCase(filter.filterType()))
				.findFirst()
				.orElse(null);
	}

	private static BigDecimal firstNonNull(BigDecimal first, BigDecimal second) {
		return first != null ? first : second;
	}

	private static BigDecimal max(BigDecimal first, BigDecimal second) {
		BigDecimal left = nonNegative(first);
		BigDecimal right = nonNegative(second);
		return left.max(right);
	}

	private static BigDecimal minPositive(BigDecimal first, BigDecimal second) {
		BigDecimal left = positiveOrNull(first);
		BigDecimal right = positiveOrNull(second);
		if (left == null) {
			return right;
		}
		return right == null ? left : left.min(right);
	}

	private static BigDecimal nonNegative(BigDecimal value) {
		return value == null || value.signum() < 0 ? BigDecimal.ZERO : value;
	}

	private static BigDecimal positiveOrNull(BigDecimal value) {
		return value == null || value.signum() <= 0 ? null : value;
	}
}

package com.zenith.exchange.dto;

import java.math.BigDecimal;
import java.util.List;

public record ExchangeInfoResponse(
		List<SymbolInfo> symbols) {

	public record SymbolInfo(
			String symbol,
			String status,
			String contractType,
			String quoteAsset,
			Integer quantityPrecision,
			Integer pricePrecision,
			List<ExchangeFilter> filters) {
	}

	public record ExchangeFilter(
			String filterType,
			BigDecimal minQty,
			BigDecimal maxQty,
			BigDecimal stepSize,
			BigDecimal minNotional,
			BigDecimal notional,
			BigDecimal maxNotional,
			BigDecimal tickSize) {
	}
}

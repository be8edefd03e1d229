package com.zenith.exchange.dto;

import java.math.BigDecimal;

public record OrderResponse(
		Long orderId,
		String symbol,
		String status,
		String side,
		String type,
		BigDecimal origQty,
		BigDecimal executedQty,
		BigDecimal avgPrice,
		BigDecimal price,
		String clientOrderId) {

	public BigDecimal filledQuantity() {
		if (executedQty != null && executedQty.signum() > 0) {
			return executedQty;
		}
		return origQty == null ? BigDecimal.ZERO : origQty;
	}

	public BigDecimal fillPrice() {
		if (avgPrice != null && avgPrice.signum() > 0) {
			return avgPrice;
		}
		return price == null ? BigDecimal.ZERO : price;
	}
}

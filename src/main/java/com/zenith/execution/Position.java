package com.zenith.execution;

import java.math.BigDecimal;
import java.math.MathContext;

import com.zenith.strategy.TradeSide;

public record Position(
		String symbol,
		TradeSide side,
		BigDecimal quantity,
		BigDecimal entryPrice,
		BigDecimal markPrice,
		BigDecimal unrealizedProfit,
		StrategyMetadata metadata) {

	public Position withMetadata(StrategyMetadata value) {
		return new Position(symbol, side, quantity, entryPrice, markPrice, unrealizedProfit, value);
	}

	public BigDecimal notional() {
		BigDecimal price = markPrice != null && markPrice.signum() > 0 ? markPrice : entryPrice;
		return price == null ? BigDecimal.ZERO : quantity.multiply(price);
	}

	/**
	 * Unrealized profit as a percentage of entry notional, or null when it cannot be derived.
	 */
	public Double unrealizedPct() {
		if (unrealizedProfit == null || entryPrice == null || entryPrice.signum() <= 0 || quantity.signum() <= 0) {
			return null;
		}
		BigDecimal basis = entryPrice.multiply(quantity);
		return unrealizedProfit.divide(basis, MathContext.DECIMAL64).doubleValue() * 100.0;
	}
}

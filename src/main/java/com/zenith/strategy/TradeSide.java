package com.zenith.strategy;

import java.util.Locale;

import com.zenith.exchange.OrderSide;

public enum TradeSide {
	LONG,
	SHORT;

	public OrderSide entryOrderSide() {
		return this == LONG ? OrderSide.BUY : OrderSide.SELL;
	}

	public OrderSide exitOrderSide() {
		return entryOrderSide().opposite();
	}

	public TradeSide opposite() {
		return this == LONG ? SHORT : LONG;
	}

	public Bias toBias() {
		return this == LONG ? Bias.LONG : Bias.SHORT;
	}

	/** +1 for long, -1 for short. */
	public int direction() {
		return this == LONG ? 1 : -1;
	}

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}

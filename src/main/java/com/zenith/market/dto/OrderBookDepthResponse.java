package com.zenith.market.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OrderBookDepthResponse(
		long lastUpdateId,
		@JsonProperty("E") Long eventTime,
		@JsonProperty("T") Long transactionTime,
		List<List<String>> bids,
		List<List<String>> asks) {

	public double bidQuantity(int levels) {
		return sumQuantity(bids, levels);
	}

	public double askQuantity(int levels) {
		return sumQuantity(asks, levels);
	}

	private static double sumQuantity(List<List<String>> side, int levels) {
		if (side == null) {
			return 0.0;
		}
		double total = 0.0;
		for (int i = 0; i < Math.min(levels, side.size()); i++) {
			List<String> level = side.get(i);
			if (level != null && level.size() > 1) {
				total += Double.parseDouble(level.get(1));
			}
		}
		return total;
	}
}

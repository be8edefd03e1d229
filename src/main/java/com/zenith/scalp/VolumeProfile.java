package com.zenith.scalp;

import java.util.List;

/**
 * Point of control, 70% value area bounds and low-volume nodes of a candle window.
 */
public record VolumeProfile(double poc, double vah, double val, List<Double> lowVolumeNodes) {

	public VolumeProfile {
		lowVolumeNodes = lowVolumeNodes == null ? List.of() : List.copyOf(lowVolumeNodes);
	}

	public boolean contains(double price) {
		return price <= vah && price >= val;
	}
}

package com.zenith.strategy;

public record LocalSignal(
		Bias bias,
		double confidence,
		double edgeScore,
		String reasoning,
		double longScore,
		double shortScore) {

	public static LocalSignal neutral() {
		return new LocalSignal(Bias.FLAT, 0.0, 0.0, "no signal", 0.0, 0.0);
	}
}

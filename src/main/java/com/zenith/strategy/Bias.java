package com.zenith.strategy;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Bias {
	LONG,
	SHORT,
	FLAT;

	@JsonValue
	public String wireValue() {
		return name().toLowerCase(Locale.ROOT);
	}

	public boolean isDirectional() {
		return this != FLAT;
	}

	public TradeSide toSide() {
		return switch (this) {
			case LONG -> TradeSide.LONG;
			case SHORT -> TradeSide.SHORT;
			case FLAT -> null;
		};
	}

	/**
	 * Parses {@code long}/{@code short}/{@code flat} case-insensitively; anything else yields null.
	 */
	public static Bias fromText(String text) {
		if (text == null) {
			return null;
		}
		return switch (text.trim().toLowerCase(Locale.ROOT)) {
			case "long" -> LONG;
			case "short" -> SHORT;
			case "flat" -> FLAT;
			default -> null;
		};
	}
}

package com.zenith.scalp;

import java.util.Locale;

public enum CandidateModel {
	BREAKOUT,
	MEAN,
	EMA50,
	NONE;

	public static CandidateModel fromText(String text) {
		if (text == null || text.isBlank()) {
			return null;
		}
		try {
			return valueOf(text.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			return null;
		}
	}
}

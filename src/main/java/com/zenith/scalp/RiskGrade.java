package com.zenith.scalp;

import java.util.Locale;

/**
 * News/shock risk grade reported for a symbol.
 */
public enum RiskGrade {
	NONE,
	NOTICE,
	HIGH,
	CRITICAL;

	public boolean isElevated() {
		return this == HIGH || this == CRITICAL;
	}

	public static RiskGrade fromText(String text) {
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

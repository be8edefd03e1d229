package com.zenith.scalp;

import java.time.Instant;
import java.time.ZoneOffset;

public enum TradingSession {
	ASIA,
	BRIDGE,
	LONDON,
	NY;

	/**
	 * Session by UTC hour: [0,7) Asia, [7,11) bridge, [11,16) London, otherwise New York.
	 */
	public static TradingSession at(Instant instant) {
		int hour = instant.atZone(ZoneOffset.UTC).getHour();
		if (hour < 7) {
			return ASIA;
		}
		if (hour < 11) {
			return BRIDGE;
		}
		if (hour < 16) {
			return LONDON;
		}
		return NY;
	}

	public boolean isRestrictedUnderShock() {
		return this == NY || this == BRIDGE;
	}
}

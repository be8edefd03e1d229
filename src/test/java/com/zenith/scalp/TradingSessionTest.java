package com.zenith.scalp;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;

import org.junit.jupiter.api.Test;

class TradingSessionTest {

	@Test
	void sessionsFollowUtcHours() {
		assertEquals(TradingSession.ASIA, TradingSession.at(Instant.parse("2024-05-01T00:00:00Z")));
		assertEquals(TradingSession.ASIA, TradingSession.at(Instant.parse("2024-05-01T06:59:59Z")));
		assertEquals(TradingSession.BRIDGE, TradingSession.at(Instant.parse("2024-05-01T07:00:00Z")));
		assertEquals(TradingSession.LONDON, TradingSession.at(Instant.parse("2024-05-01T11:00:00Z")));
		assertEquals(TradingSession.NY, TradingSession.at(Instant.parse("2024-05-01T16:00:00Z")));
		assertEquals(TradingSession.NY, TradingSession.at(Instant.parse("2024-05-01T23:59:59Z")));
	}
}

package com.zenith.scalp;

import com.zenith.strategy.TradeSide;

public enum CandidateSignal {
	LONG,
	SHORT,
	NONE;

	public boolean isDirectional() {
		return this != NONE;
	}

	public TradeSide toSide() {
		return switch (this) {
			case LONG -> TradeSide.LONG;
			case SHORT -> TradeSide.SHORT;
			case NONE -> null;
		};
	}

	public static CandidateSignal of(TradeSide side) {
		return side == TradeSide.LONG ? LONG : SHORT;
	}
}

package com.zenith.scalp;

import com.zenith.strategy.TradeSide;

/**
 * Admission check on spread, expected slippage, latency, quote age and the side's depth bias. Caps tighten
 * under a HIGH shock grade.
 */
public class MicrostructureGate {

	private final ScalpProperties properties;

	public MicrostructureGate(ScalpProperties properties) {
		this.properties = properties;
	}

	public record Caps(double spreadBp, double slippageBp, long latencyMs, long quoteAgeMs, double depthBias) {
	}

	public Caps capsFor(RiskGrade grade, TradeSide side) {
		double spread = properties.resolvedSpreadCapBp();
		double slippage = properties.resolvedSlippageCapBp();
		if (grade == RiskGrade.HIGH) {
			spread = Math.min(spread, properties.resolvedHighGradeSpreadCapBp());
			slippage = Math.min(slippage, properties.resolvedHighGradeSlippageCapBp());
		}
		return new Caps(spread, slippage, properties.resolvedLatencyCapMs(), properties.resolvedQuoteAgeCapMs(),
				properties.depthBiasFor(side));
	}

	public boolean admits(MicroSnapshot micro, double expectedSlippageBp, RiskGrade grade, TradeSide side) {
		Caps caps = capsFor(grade, side);
		return micro.spreadBp() <= caps.spreadBp()
				&& expectedSlippageBp <= caps.slippageBp()
				&& micro.latencyMs() <= caps.latencyMs()
				&& micro.quoteAgeMs() <= caps.quoteAgeMs()
				&& micro.depthBias() >= caps.depthBias();
	}

	public double expectedSlippageBp(MicroSnapshot micro) {
		return micro.spreadBp() * properties.resolvedSlippageFactor();
	}

	/**
	 * New York and the London bridge are closed to scalping while a HIGH or CRITICAL shock is active.
	 */
	public static boolean sessionBlocked(TradingSession session, RiskGrade grade) {
		return session.isRestrictedUnderShock() && grade.isElevated();
	}
}

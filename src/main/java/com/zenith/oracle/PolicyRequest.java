package com.zenith.oracle;

import java.util.List;

import com.zenith.scalp.MarketRegime;
import com.zenith.scalp.RiskGrade;
import com.zenith.scalp.TradingSession;

/**
 * Condensed feature view plus the top candidates, as sent to the policy oracle.
 */
public record PolicyRequest(
		String symbol,
		double close,
		double atr,
		double rsi,
		double spreadBp,
		TradingSession session,
		MarketRegime regime,
		RiskGrade riskGrade,
		List<PolicyCandidate> candidates) {
}

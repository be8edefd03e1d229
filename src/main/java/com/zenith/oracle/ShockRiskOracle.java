package com.zenith.oracle;

import com.zenith.scalp.RiskGrade;

import reactor.core.publisher.Mono;

public interface ShockRiskOracle {

	/**
	 * Never errors: an unreachable endpoint resolves to the configured default grade.
	 */
	Mono<RiskGrade> gradeFor(String symbol);
}

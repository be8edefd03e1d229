package com.zenith.oracle;

import reactor.core.publisher.Mono;

public interface StrategyOracle {

	/**
	 * Errors with {@link OracleException} when the answer cannot be used.
	 */
	Mono<OracleDecision> request(StrategyContext context);
}

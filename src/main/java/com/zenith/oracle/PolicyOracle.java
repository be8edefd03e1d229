package com.zenith.oracle;

import reactor.core.publisher.Mono;

public interface PolicyOracle {

	Mono<PolicyVerdict> evaluate(PolicyRequest request);
}

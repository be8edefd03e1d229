package com.zenith.oracle;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenith.config.OracleProperties;
import com.zenith.scalp.RiskGrade;

import reactor.core.publisher.Mono;

public class HttpShockRiskOracle implements ShockRiskOracle {

	private static final Logger LOGGER = LoggerFactory.getLogger(HttpShockRiskOracle.class);

	private final WebClient oracleWebClient;
	private final OracleProperties properties;

	public HttpShockRiskOracle(WebClient oracleWebClient, OracleProperties properties) {
		this.oracleWebClient = oracleWebClient;
		this.properties = properties;
	}

	@Override
	public Mono<RiskGrade> gradeFor(String symbol) {
		RiskGrade fallback = properties.resolvedDefaultRiskGrade();
		if (!OracleProperties.isConfigured(properties.shockRiskUrl())) {
			return Mono.just(fallback);
		}
		return oracleWebClient
				.get()
				.uri(properties.shockRiskUrl(), uriBuilder -> uriBuilder.queryParam("symbol", symbol).build())
				.retrieve()
				.bodyToMono(JsonNode.class)
				.timeout(Duration.ofMillis(properties.timeoutMs()))
				.map(node -> {
					RiskGrade grade = RiskGrade.fromText(OracleResponseParser.text(node, "grade"));
					if (grade == null) {
						throw new OracleException("Shock risk payload has no usable grade: " + node);
					}
					return grade;
				})
				.defaultIfEmpty(fallback)
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=SHOCK_RISK_FALLBACK symbol={} grade={} reason={}", symbol, fallback,
							error.getMessage());
					return Mono.just(fallback);
				});
	}
}

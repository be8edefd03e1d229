package com.zenith.oracle;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenith.config.OracleProperties;

import reactor.core.publisher.Mono;

public class HttpStrategyOracle implements StrategyOracle {

	private static final Logger LOGGER = LoggerFactory.getLogger(HttpStrategyOracle.class);

	private final WebClient oracleWebClient;
	private final OracleProperties properties;
	private final OracleResponseParser parser;

	public HttpStrategyOracle(WebClient oracleWebClient, OracleProperties properties, OracleResponseParser parser) {
		this.oracleWebClient = oracleWebClient;
		this.properties = properties;
		this.parser = parser;
	}

	@Override
	public Mono<OracleDecision> request(StrategyContext context) {
		if (!OracleProperties.isConfigured(properties.strategyUrl())) {
			return Mono.error(new OracleException("Strategy oracle URL is not configured"));
		}
		long started = System.nanoTime();
		return oracleWebClient
				.post()
				.uri(properties.strategyUrl())
				.bodyValue(context)
				.retrieve()
				.bodyToMono(JsonNode.class)
				.timeout(Duration.ofMillis(properties.timeoutMs()))
				.switchIfEmpty(Mono.error(new OracleException("Strategy oracle returned no body")))
				.map(payload -> parser.parseStrategy(payload, context.symbol()))
				.doOnNext(decision -> LOGGER.info(
						"EVENT=ORACLE_STRATEGY symbol={} bias={} confidence={} tookMs={}", decision.symbol(),
						decision.bias(), decision.confidence(), (System.nanoTime() - started) / 1_000_000))
				.onErrorMap(WebClientResponseException.class, ex -> new OracleException(
						"Strategy oracle failed with status=" + ex.getStatusCode().value(), ex));
	}
}

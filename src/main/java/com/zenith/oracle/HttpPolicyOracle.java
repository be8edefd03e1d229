package com.zenith.oracle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenith.config.OracleProperties;
import com.zenith.scalp.CandidateModel;
import com.zenith.scalp.CandidateSignal;
import com.zenith.scalp.EntryLevel;

import reactor.core.publisher.Mono;

public class HttpPolicyOracle implements PolicyOracle {

	private static final Logger LOGGER = LoggerFactory.getLogger(HttpPolicyOracle.class);

	private final WebClient oracleWebClient;
	private final OracleProperties properties;
	private final OracleResponseParser parser;

	public HttpPolicyOracle(WebClient oracleWebClient, OracleProperties properties, OracleResponseParser parser) {
		this.oracleWebClient = oracleWebClient;
		this.properties = properties;
		this.parser = parser;
	}

	@Override
	public Mono<PolicyVerdict> evaluate(PolicyRequest request) {
		if (!OracleProperties.isConfigured(properties.policyUrl())) {
			return Mono.error(new OracleException("Policy oracle URL is not configured"));
		}
		return oracleWebClient
				.post()
				.uri(properties.policyUrl())
				.bodyValue(request)
				.retrieve()
				.bodyToMono(JsonNode.class)
				.timeout(Duration.ofMillis(properties.timeoutMs()))
				.switchIfEmpty(Mono.error(new OracleException("Policy oracle returned no body")))
				.map(payload -> toVerdict(parser.unwrap(payload)))
				.doOnNext(verdict -> LOGGER.info("EVENT=ORACLE_POLICY symbol={} allow={} model={} side={}",
						request.symbol(), verdict.allow(), verdict.model(), verdict.side()))
				.onErrorMap(WebClientResponseException.class, ex -> new OracleException(
						"Policy oracle failed with status=" + ex.getStatusCode().value(), ex));
	}

	static PolicyVerdict toVerdict(JsonNode node) {
		JsonNode allow = node.get("allow");
		if (allow == null || !allow.isBoolean()) {
			throw new OracleException("Policy oracle payload is missing allow");
		}
		JsonNode chosen = node.has("chosen") ? node.get("chosen") : node;
		CandidateModel model = CandidateModel.fromText(OracleResponseParser.text(chosen, "model"));
		CandidateSignal side = signal(OracleResponseParser.text(chosen, "side"));
		Double quality = OracleResponseParser.confidence(node.get("quality"));
		Double tpRR = OracleResponseParser.confidence(node.get("tpRR"));
		EntryLevel entryHint = EntryLevel.fromText(OracleResponseParser.text(node, "entryHint"));
		List<String> notes = new ArrayList<>();
		JsonNode notesNode = node.get("notes");
		if (notesNode != null && notesNode.isArray()) {
			notesNode.forEach(note -> {
				if (note.isTextual() && !note.asText().isBlank()) {
					notes.add(note.asText().trim());
				}
			});
		}
		return new PolicyVerdict(allow.asBoolean(), model, side, quality, tpRR, entryHint, notes);
	}

	private static CandidateSignal signal(String text) {
		if (text == null || text.isBlank()) {
			return null;
		}
		try {
			return CandidateSignal.valueOf(text.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			return null;
		}
	}
}

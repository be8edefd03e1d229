package com.zenith.oracle;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zenith.strategy.Bias;
import com.zenith.strategy.DecisionAction;

/**
 * Validates oracle payloads. Anything malformed is rejected with {@link OracleException}.
 */
public class OracleResponseParser {

	static final int MAX_REASONING_WORDS = 22;
	static final String NO_REASONING = "No reasoning provided";

	private final ObjectMapper objectMapper;

	public OracleResponseParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public OracleDecision parseStrategy(JsonNode payload, String fallbackSymbol) {
		JsonNode node = unwrap(payload);
		Bias bias = Bias.fromText(text(node, "bias"));
		if (bias == null) {
			throw new OracleException("Invalid bias returned from strategy oracle: " + node.get("bias"));
		}
		Double confidence = confidence(node.get("confidence"));
		if (confidence == null) {
			throw new OracleException("Invalid confidence returned from strategy oracle: " + node.get("confidence"));
		}
		String symbol = text(node, "symbol");
		return new OracleDecision(
				symbol == null || symbol.isBlank() ? fallbackSymbol : symbol.trim().toUpperCase(Locale.ROOT),
				bias,
				Math.max(0.0, Math.min(1.0, confidence)),
				sanitizeReasoning(text(node, "reasoning")),
				DecisionAction.fromText(text(node, "action")),
				positive(node.get("entryPrice")),
				positive(node.get("exitPrice")));
	}

	/**
	 * Accepts an object, or a string holding JSON optionally wrapped in a markdown code fence.
	 */
	JsonNode unwrap(JsonNode payload) {
		if (payload == null || payload.isNull() || payload.isMissingNode()) {
			throw new OracleException("Oracle payload was empty");
		}
		if (payload.isTextual()) {
			String cleaned = payload.asText().trim()
					.replaceFirst("^```(?:json)?\\s*", "")
					.replaceFirst("```\\s*$", "")
					.trim();
			if (cleaned.isEmpty()) {
				throw new OracleException("Oracle payload was empty");
			}
			try {
				return unwrap(objectMapper.readTree(cleaned));
			} catch (JsonProcessingException ex) {
				throw new OracleException("Failed to parse oracle JSON", ex);
			}
		}
		if (!payload.isObject()) {
			throw new OracleException("Oracle payload was not an object");
		}
		return payload;
	}

	/**
	 * Numbers are taken as-is; strings may carry a trailing percent sign, in which case they are divided by 100.
	 */
	static Double confidence(JsonNode node) {
		if (node == null || node.isNull()) {
			return null;
		}
		if (node.isNumber()) {
			double value = node.asDouble();
			return Double.isFinite(value) ? value : null;
		}
		if (!node.isTextual()) {
			return null;
		}
		String raw = node.asText().trim();
		boolean percent = raw.endsWith("%");
		if (percent) {
			raw = raw.substring(0, raw.length() - 1).trim();
		}
		try {
			double value = Double.parseDouble(raw);
			if (!Double.isFinite(value)) {
				return null;
			}
			return percent ? value / 100.0 : value;
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	static String sanitizeReasoning(String reasoning) {
		if (reasoning == null) {
			return NO_REASONING;
		}
		String normalized = reasoning.replaceAll("\\s+", " ").trim();
		if (normalized.isEmpty()) {
			return NO_REASONING;
		}
		String[] words = normalized.split(" ");
		if (words.length <= MAX_REASONING_WORDS) {
			return normalized;
		}
		return String.join(" ", Arrays.copyOf(words, MAX_REASONING_WORDS)) + "...";
	}

	static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}

	private static Double positive(JsonNode node) {
		if (node == null || !(node.isNumber() || node.isTextual())) {
			return null;
		}
		double value = node.asDouble(Double.NaN);
		return value > 0 ? value : null;
	}
}

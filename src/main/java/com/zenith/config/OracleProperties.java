package com.zenith.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.zenith.scalp.RiskGrade;

import jakarta.validation.constraints.Positive;

@Validated
@ConfigurationProperties(prefix = "oracle")
public record OracleProperties(
		String strategyUrl,
		String policyUrl,
		String shockRiskUrl,
		String apiKey,
		@Positive long timeoutMs,
		RiskGrade defaultRiskGrade) {

	public RiskGrade resolvedDefaultRiskGrade() {
		return defaultRiskGrade == null ? RiskGrade.NONE : defaultRiskGrade;
	}

	public static boolean isConfigured(String url) {
		return url != null && !url.isBlank();
	}
}

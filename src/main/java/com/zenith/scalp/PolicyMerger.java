package com.zenith.scalp;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.oracle.PolicyCandidate;
import com.zenith.oracle.PolicyOracle;
import com.zenith.oracle.PolicyRequest;
import com.zenith.oracle.PolicyVerdict;

import reactor.core.publisher.Mono;

/**
 * Forwards the best candidates to the policy oracle and applies its verdict. An oracle failure counts as a
 * disallow.
 */
public class PolicyMerger {

	private static final Logger LOGGER = LoggerFactory.getLogger(PolicyMerger.class);
	static final String DISALLOW_REASON = "policy: disallow";
	private static final int MAX_NOTES = 3;
	private static final int MAX_REASONS_FORWARDED = 6;

	private final PolicyOracle oracle;
	private final ScalpProperties properties;

	public PolicyMerger(PolicyOracle oracle, ScalpProperties properties) {
		this.oracle = oracle;
		this.properties = properties;
	}

	/**
	 * Candidates after policy, the adopted one first.
	 */
	public Mono<List<Candidate>> merge(ScalpFeatures features, RiskGrade grade, List<Candidate> candidates) {
		List<Candidate> top = candidates.stream()
				.sorted(Comparator.comparingDouble(Candidate::quality).reversed())
				.limit(properties.resolvedPolicyCandidates())
				.toList();
		if (top.isEmpty()) {
			return Mono.just(List.of(Candidate.none(features.neutralMicro(), DISALLOW_REASON)));
		}
		PolicyRequest request = new PolicyRequest(features.symbol(), features.close(), features.atr22(),
				features.rsi14(), features.book().spreadBp(), features.session(), features.regime(), grade,
				top.stream().map(PolicyMerger::condensed).toList());
		return oracle.evaluate(request)
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=POLICY_FALLBACK symbol={} reason={}", features.symbol(), error.getMessage());
					return Mono.just(PolicyVerdict.disallow());
				})
				.defaultIfEmpty(PolicyVerdict.disallow())
				.map(verdict -> apply(top, verdict));
	}

	static List<Candidate> apply(List<Candidate> top, PolicyVerdict verdict) {
		if (top.isEmpty()) {
			return List.of();
		}
		if (!verdict.allow()) {
			return List.of(top.get(0).disallowed(DISALLOW_REASON));
		}
		Optional<Candidate> pick = top.stream()
				.filter(candidate -> candidate.isActionable() && candidate.model() == verdict.model())
				.filter(candidate -> verdict.side() == null || !verdict.side().isDirectional()
						|| candidate.signal() == verdict.side())
				.findFirst();
		if (pick.isEmpty()) {
			return top;
		}
		Candidate chosen = pick.get();
		double quality = Math.min(1.0, chosen.quality());
		if (verdict.quality() != null) {
			quality = Math.min(quality, verdict.quality());
		}
		List<String> notes = verdict.notes().stream().limit(MAX_NOTES).toList();
		List<Candidate> merged = new ArrayList<>();
		merged.add(chosen.adopt(quality, verdict.tpRR(), verdict.entryHint(), notes));
		top.stream().filter(candidate -> candidate != chosen).forEach(merged::add);
		return merged;
	}

	/**
	 * First directional candidate whose quality clears its model threshold.
	 */
	public Optional<Candidate> select(List<Candidate> merged) {
		return merged.stream()
				.filter(Candidate::isActionable)
				.filter(candidate -> candidate.quality() >= properties.qualityThreshold(candidate.model()))
				.findFirst();
	}

	private static PolicyCandidate condensed(Candidate candidate) {
		CandidateModel model = candidate.model() == CandidateModel.NONE ? CandidateModel.BREAKOUT : candidate.model();
		return new PolicyCandidate(model, candidate.signal(), candidate.quality(),
				candidate.reasons().stream().limit(MAX_REASONS_FORWARDED).toList());
	}
}

package com.zenith.scalp;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every strategy model over the tick's features. Always returns at least one candidate.
 */
public class ScalpCandidateEngine {

	private static final Logger LOGGER = LoggerFactory.getLogger(ScalpCandidateEngine.class);

	private final List<StrategyModel> models;

	public ScalpCandidateEngine(List<StrategyModel> models) {
		this.models = List.copyOf(models);
	}

	public List<Candidate> build(ScalpFeatures features, RiskGrade grade) {
		List<Candidate> out = new ArrayList<>();
		for (StrategyModel model : models) {
			List<Candidate> found = model.evaluate(features, grade);
			out.addAll(found);
			for (Candidate candidate : found) {
				LOGGER.debug("EVENT=SCALP_CANDIDATE symbol={} model={} signal={} quality={} reasons={}",
						features.symbol(), candidate.model(), candidate.signal(), candidate.quality(),
						candidate.reasons());
			}
		}
		if (out.isEmpty()) {
			String reason = MicrostructureGate.sessionBlocked(features.session(), grade)
					? "shock risk restricted"
					: "no candidate";
			out.add(Candidate.none(features.neutralMicro(), reason));
		}
		return out;
	}
}

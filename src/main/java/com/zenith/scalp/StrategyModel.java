package com.zenith.scalp;

import java.util.List;

/**
 * One scalp setup. Returns the candidates it found on this tick, possibly none.
 */
public interface StrategyModel {

	CandidateModel model();

	List<Candidate> evaluate(ScalpFeatures features, RiskGrade grade);
}

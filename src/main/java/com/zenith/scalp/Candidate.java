package com.zenith.scalp;

import java.util.ArrayList;
import java.util.List;

public record Candidate(
		CandidateSignal signal,
		CandidateModel model,
		double quality,
		EntryLevel entryHint,
		StopHint stopHint,
		TakeProfitPlan tpPlan,
		MicroSnapshot micro,
		List<String> reasons) {

	public Candidate {
		reasons = reasons == null ? List.of() : List.copyOf(reasons);
	}

	public boolean isActionable() {
		return signal.isDirectional() && model != CandidateModel.NONE;
	}

	public static Candidate none(MicroSnapshot micro, String reason) {
		return new Candidate(CandidateSignal.NONE, CandidateModel.NONE, 0.0, EntryLevel.EMA50, StopHint.swing(0),
				new TakeProfitPlan(1.0, null, TargetLabel.NA), micro, List.of(reason));
	}

	/**
	 * The same candidate, switched off by policy, with quality zeroed.
	 */
	public Candidate disallowed(String reason) {
		return new Candidate(CandidateSignal.NONE, CandidateModel.NONE, 0.0, entryHint, stopHint, tpPlan, micro,
				appended(List.of(reason)));
	}

	public Candidate adopt(double cappedQuality, Double tp1RR, EntryLevel level, List<String> notes) {
		TakeProfitPlan plan = tp1RR != null && tp1RR > 0 ? tpPlan.withTp1RR(tp1RR) : tpPlan;
		return new Candidate(signal, model, cappedQuality, level != null ? level : entryHint, stopHint, plan, micro,
				appended(notes));
	}

	private List<String> appended(List<String> extra) {
		List<String> merged = new ArrayList<>(reasons);
		merged.addAll(extra);
		return merged;
	}
}

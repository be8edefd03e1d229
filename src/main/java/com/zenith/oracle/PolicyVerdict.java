package com.zenith.oracle;

import java.util.List;

import com.zenith.scalp.CandidateModel;
import com.zenith.scalp.CandidateSignal;
import com.zenith.scalp.EntryLevel;

/**
 * Policy oracle answer. Everything except {@code allow} is optional.
 */
public record PolicyVerdict(
		boolean allow,
		CandidateModel model,
		CandidateSignal side,
		Double quality,
		Double tpRR,
		EntryLevel entryHint,
		List<String> notes) {

	public PolicyVerdict {
		notes = notes == null ? List.of() : List.copyOf(notes);
	}

	public static PolicyVerdict disallow() {
		return new PolicyVerdict(false, null, null, null, null, null, List.of());
	}
}

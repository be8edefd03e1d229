package com.zenith.oracle;

import java.util.List;

import com.zenith.scalp.CandidateModel;
import com.zenith.scalp.CandidateSignal;

public record PolicyCandidate(CandidateModel model, CandidateSignal side, double quality, List<String> reasons) {
}

package com.brandinsight.research.service.discovery;

import com.brandinsight.research.dto.CandidateCompetitor;

/**
 * @param confidence re-computed relevance in [0,1]; becomes the candidate's score when accepted
 */
public record CandidateValidationResult(
        CandidateCompetitor candidate,
        boolean valid,
        double confidence,
        String reason
) {
    public static CandidateValidationResult reject(CandidateCompetitor candidate, String reason) {
        return new CandidateValidationResult(candidate, false, 0.0, reason);
    }
}

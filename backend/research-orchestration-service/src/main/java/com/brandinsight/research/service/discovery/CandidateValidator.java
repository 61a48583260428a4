package com.brandinsight.research.service.discovery;

import com.brandinsight.research.dto.CandidateCompetitor;

import java.util.List;

public interface CandidateValidator {

    /**
     * @return one result per candidate, in input order
     */
    List<CandidateValidationResult> validateBatch(List<CandidateCompetitor> candidates, String niche, String targetHandle);
}

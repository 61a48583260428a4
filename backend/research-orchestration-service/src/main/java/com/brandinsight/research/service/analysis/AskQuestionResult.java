package com.brandinsight.research.service.analysis;

import com.brandinsight.research.entity.AiQuestionType;
import com.brandinsight.research.entity.AnalysisRecord;

/**
 * @param alreadyAnswered true when the stored answer was returned without calling the provider
 */
public record AskQuestionResult(
        Long id,
        AiQuestionType questionType,
        String question,
        String answer,
        int tokensUsed,
        long durationMs,
        boolean alreadyAnswered
) {
    static AskQuestionResult of(AnalysisRecord record, boolean alreadyAnswered) {
        return new AskQuestionResult(
                record.getId(),
                record.getQuestionType(),
                record.getQuestion(),
                record.getAnswer(),
                record.getTokensUsed() == null ? 0 : record.getTokensUsed(),
                record.getDurationMs() == null ? 0L : record.getDurationMs(),
                alreadyAnswered
        );
    }
}

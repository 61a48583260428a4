package com.brandinsight.research.service.analysis;

import com.brandinsight.research.entity.AiQuestionType;

/**
 * Per-type result of a catalog run. Exactly one of result / error is set.
 */
public record QuestionOutcome(
        AiQuestionType questionType,
        AskQuestionResult result,
        String error
) {
    public static QuestionOutcome succeeded(AskQuestionResult result) {
        return new QuestionOutcome(result.questionType(), result, null);
    }

    public static QuestionOutcome failed(AiQuestionType questionType, String error) {
        return new QuestionOutcome(questionType, null, error);
    }

    public boolean isSucceeded() {
        return result != null;
    }
}

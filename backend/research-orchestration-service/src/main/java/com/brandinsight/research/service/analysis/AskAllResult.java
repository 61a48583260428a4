package com.brandinsight.research.service.analysis;

import java.util.List;

public record AskAllResult(
        List<QuestionOutcome> outcomes,
        int totalTokens
) {
    public long succeededCount() {
        return outcomes.stream().filter(QuestionOutcome::isSucceeded).count();
    }

    public long newAnswerCount() {
        return outcomes.stream()
                .filter(QuestionOutcome::isSucceeded)
                .filter(o -> !o.result().alreadyAnswered())
                .count();
    }

    public List<QuestionOutcome> failures() {
        return outcomes.stream().filter(o -> !o.isSucceeded()).toList();
    }
}

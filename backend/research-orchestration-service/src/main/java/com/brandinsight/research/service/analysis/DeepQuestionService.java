package com.brandinsight.research.service.analysis;

import com.brandinsight.research.client.GenerationOptions;
import com.brandinsight.research.client.GenerationResult;
import com.brandinsight.research.client.TextGenerationClient;
import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.entity.AiQuestionType;
import com.brandinsight.research.entity.AnalysisRecord;
import com.brandinsight.research.exception.ProviderException;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.store.ResearchStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 분석 질문 서비스.
 *
 * 질문 유형마다 별도의 생성 요청을 보내며, (job, 질문 유형)당 답변은 하나만 저장됩니다.
 * 이미 답변된 유형은 저장된 답변을 그대로 반환하고 생성 제공자를 호출하지 않습니다.
 * 생성 실패는 호출자에게 그대로 전파되며 대체 문구로 채우지 않습니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeepQuestionService {

    private static final int CONTEXT_COLUMN_LIMIT = 500;
    private static final int PROMPT_COLUMN_LIMIT = 1000;

    private final ResearchStore store;
    private final TextGenerationClient generationClient;
    private final ConnectorHealthTracker healthTracker;
    private final ResearchProperties properties;

    public AskQuestionResult askQuestion(String jobId, AiQuestionType questionType, QuestionContext context) {
        if (questionType == AiQuestionType.CUSTOM) {
            throw new IllegalArgumentException("CUSTOM questions need question text; use askCustomQuestion");
        }
        return ask(jobId, questionType, QuestionPromptCatalog.promptFor(questionType).question(), context);
    }

    /**
     * Ask a caller-supplied question. Stored under CUSTOM, one per job like every other type.
     */
    public AskQuestionResult askCustomQuestion(String jobId, String question, QuestionContext context) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Custom question must not be blank");
        }
        return ask(jobId, AiQuestionType.CUSTOM, question.strip(), context);
    }

    /**
     * Run the whole catalog in order. A failed type is recorded and the next one still runs.
     */
    public AskAllResult askAllQuestions(String jobId, QuestionContext context) {
        List<AiQuestionType> catalog = AiQuestionType.catalog();
        log.info("[Analysis] Starting {} questions for {} (job {})", catalog.size(), context.brandName(), jobId);

        List<QuestionOutcome> outcomes = new ArrayList<>();
        int totalTokens = 0;
        for (AiQuestionType type : catalog) {
            try {
                AskQuestionResult result = askQuestion(jobId, type, context);
                outcomes.add(QuestionOutcome.succeeded(result));
                totalTokens += result.tokensUsed();
            } catch (RuntimeException e) {
                log.warn("[Analysis] {} failed for job {}: {}", type, jobId, e.getMessage());
                outcomes.add(QuestionOutcome.failed(type, e.getMessage()));
            }
        }

        AskAllResult result = new AskAllResult(List.copyOf(outcomes), totalTokens);
        log.info("[Analysis] Complete for job {}: {} new answers, {} failed, {} total tokens",
                jobId, result.newAnswerCount(), result.failures().size(), totalTokens);
        return result;
    }

    public List<AnalysisRecord> getAnsweredQuestions(String jobId) {
        return store.findAnsweredAnalyses(jobId);
    }

    private AskQuestionResult ask(String jobId, AiQuestionType questionType, String question, QuestionContext context) {
        Optional<AnalysisRecord> existing = store.findAnalysis(jobId, questionType);
        if (existing.isPresent() && existing.get().hasAnswer()) {
            log.debug("[Analysis] {} already answered for job {}", questionType, jobId);
            return AskQuestionResult.of(existing.get(), true);
        }

        ResearchProperties.Analysis config = properties.getAnalysis();
        String contextBlock = context.render();
        String userPrompt = question + "\n\nContext:\n" + contextBlock;
        String systemPrompt = QuestionPromptCatalog.promptFor(questionType).systemPrompt();

        log.info("[Analysis] Asking {} for job {}", questionType, jobId);
        long start = System.currentTimeMillis();

        GenerationResult generated;
        try {
            generated = generationClient.generate(systemPrompt, userPrompt,
                    new GenerationOptions(config.getModel(), config.getMaxTokens(), config.getTemperature()));
            if (generated == null || generated.text() == null || generated.text().isBlank()) {
                throw new ProviderException("EMPTY_ANSWER", TextGenerationClient.CONNECTOR,
                        "Empty answer for " + questionType, null);
            }
            healthTracker.markOk(TextGenerationClient.CONNECTOR);
        } catch (RuntimeException e) {
            healthTracker.markDegraded(TextGenerationClient.CONNECTOR, e.getMessage());
            throw e;
        }
        long durationMs = System.currentTimeMillis() - start;

        AnalysisRecord record = AnalysisRecord.builder()
                .researchJobId(jobId)
                .questionType(questionType)
                .question(question)
                .answer(generated.text())
                .contextUsed(truncate(contextBlock, CONTEXT_COLUMN_LIMIT))
                .promptUsed(truncate(userPrompt, PROMPT_COLUMN_LIMIT))
                .modelUsed(generated.model() != null ? generated.model() : config.getModel())
                .tokensUsed(generated.tokensUsed())
                .durationMs(durationMs)
                .answered(true)
                .answeredAt(LocalDateTime.now())
                .build();

        AnalysisRecord saved = store.upsertAnalysis(record);
        log.info("[Analysis] {} answered for job {}: {} tokens, {}ms",
                questionType, jobId, generated.tokensUsed(), durationMs);
        return AskQuestionResult.of(saved, false);
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }
}

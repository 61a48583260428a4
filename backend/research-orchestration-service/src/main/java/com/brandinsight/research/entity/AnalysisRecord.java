package com.brandinsight.research.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Stored answer to one analysis question. At most one row per (job, question type).
 */
@Entity
@Table(name = "ai_questions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_ai_questions_job_type",
                columnNames = {"research_job_id", "question_type"}),
        indexes = @Index(name = "idx_ai_questions_job_id", columnList = "research_job_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "research_job_id", nullable = false, length = 64)
    private String researchJobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "question_type", nullable = false, length = 32)
    private AiQuestionType questionType;

    @Column(name = "question", columnDefinition = "TEXT")
    private String question;

    @Column(name = "answer", columnDefinition = "TEXT")
    private String answer;

    @Column(name = "context_used", length = 500)
    private String contextUsed;

    @Column(name = "prompt_used", length = 1000)
    private String promptUsed;

    @Column(name = "model_used", length = 64)
    private String modelUsed;

    @Column(name = "tokens_used")
    @Builder.Default
    private Integer tokensUsed = 0;

    @Column(name = "duration_ms")
    @Builder.Default
    private Long durationMs = 0L;

    @Column(name = "is_answered", nullable = false)
    @Builder.Default
    private boolean answered = false;

    @Column(name = "answered_at")
    private LocalDateTime answeredAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Copy a freshly generated answer onto this row, keeping its identity
     */
    public void applyAnswer(AnalysisRecord generated) {
        this.question = generated.getQuestion();
        this.answer = generated.getAnswer();
        this.contextUsed = generated.getContextUsed();
        this.promptUsed = generated.getPromptUsed();
        this.modelUsed = generated.getModelUsed();
        this.tokensUsed = generated.getTokensUsed();
        this.durationMs = generated.getDurationMs();
        this.answered = generated.isAnswered();
        this.answeredAt = generated.getAnsweredAt();
    }

    public boolean hasAnswer() {
        return answered && answer != null && !answer.isBlank();
    }
}

package com.brandinsight.research.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A community discussion that mentions the target brand. Identity is (job, url).
 */
@Entity
@Table(name = "community_insights",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_community_insights_job_url",
                columnNames = {"research_job_id", "url"}),
        indexes = {
                @Index(name = "idx_community_insights_job_id", columnList = "research_job_id"),
                @Index(name = "idx_community_insights_source", columnList = "source")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommunityInsight {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "research_job_id", nullable = false, length = 64)
    private String researchJobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 32)
    private CommunitySource source;

    @Column(name = "url", nullable = false, length = 1024)
    private String url;

    @Column(name = "title", length = 512)
    private String title;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "source_query", length = 512)
    private String sourceQuery;

    @Enumerated(EnumType.STRING)
    @Column(name = "sentiment", length = 16)
    @Builder.Default
    private InsightSentiment sentiment = InsightSentiment.NEUTRAL;

    @Column(name = "metric", length = 64)
    private String metric;

    @Column(name = "metric_value")
    private Double metricValue;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}

package com.brandinsight.research.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Unprocessed web search hit kept as brand context for later steps.
 */
@Entity
@Table(name = "raw_search_results",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_raw_search_results_job_url",
                columnNames = {"research_job_id", "url"}),
        indexes = @Index(name = "idx_raw_search_results_job_id", columnList = "research_job_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawSearchResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "research_job_id", nullable = false, length = 64)
    private String researchJobId;

    @Column(name = "query", length = 512)
    private String query;

    @Column(name = "title", length = 512)
    private String title;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    @Column(name = "url", nullable = false, length = 1024)
    private String url;

    @Column(name = "source", length = 64)
    private String source;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}

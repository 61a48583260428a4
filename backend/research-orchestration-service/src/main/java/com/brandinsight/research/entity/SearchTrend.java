package com.brandinsight.research.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "search_trends",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_search_trends_job_keyword",
                columnNames = {"research_job_id", "keyword"}),
        indexes = @Index(name = "idx_search_trends_job_id", columnList = "research_job_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchTrend {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "research_job_id", nullable = false, length = 64)
    private String researchJobId;

    @Column(name = "keyword", nullable = false, length = 255)
    private String keyword;

    @Column(name = "average_interest")
    private Double averageInterest;

    @Column(name = "peak_interest")
    private Integer peakInterest;

    /**
     * Related queries, newline separated
     */
    @Column(name = "related_queries", columnDefinition = "TEXT")
    private String relatedQueries;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}

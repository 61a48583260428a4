package com.brandinsight.research.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A research job about one target brand.
 * Intake data (handles, niche, bio) is written by the surrounding product;
 * the orchestrator only reads it and maintains the status fields.
 */
@Entity
@Table(name = "research_jobs", indexes = {
        @Index(name = "idx_research_jobs_status", columnList = "status"),
        @Index(name = "idx_research_jobs_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchJob {

    @Id
    @Column(name = "job_id", length = 64)
    private String id;

    @Column(name = "brand_name", length = 255)
    private String brandName;

    @Column(name = "handle", nullable = false, length = 128)
    private String handle;

    @Column(name = "niche", length = 255)
    private String niche;

    @Column(name = "bio", columnDefinition = "TEXT")
    private String bio;

    @Column(name = "website_url", length = 1024)
    private String websiteUrl;

    /**
     * Known social handles keyed by lower-case platform name
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "research_job_handles", joinColumns = @JoinColumn(name = "job_id"))
    @MapKeyColumn(name = "platform", length = 32)
    @Column(name = "handle", length = 128)
    @Builder.Default
    private Map<String, String> handles = new HashMap<>();

    @Column(name = "web_research_summary", columnDefinition = "TEXT")
    private String webResearchSummary;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    @Builder.Default
    private ResearchJobStatus status = ResearchJobStatus.PENDING;

    @Column(name = "last_run_at")
    private LocalDateTime lastRunAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Generate a new job ID
     */
    public static String generateJobId() {
        return "rj_" + UUID.randomUUID().toString().replace("-", "").substring(0, 20);
    }
}

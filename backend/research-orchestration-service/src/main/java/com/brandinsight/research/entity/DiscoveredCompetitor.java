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
 * Persisted competitor of a research job. Identity is (job, platform, lower-cased handle).
 */
@Entity
@Table(name = "discovered_competitors",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_discovered_competitors_job_platform_handle",
                columnNames = {"research_job_id", "platform", "handle"}),
        indexes = @Index(name = "idx_discovered_competitors_job_id", columnList = "research_job_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveredCompetitor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "research_job_id", nullable = false, length = 64)
    private String researchJobId;

    @Column(name = "platform", nullable = false, length = 32)
    private String platform;

    @Column(name = "handle", nullable = false, length = 128)
    private String handle;

    @Column(name = "discovery_reason", length = 512)
    private String discoveryReason;

    @Column(name = "relevance_score")
    private Double relevanceScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "competitor_type", length = 32)
    private CompetitorType competitorType;

    @Enumerated(EnumType.STRING)
    @Column(name = "discovery_layer", length = 32)
    private DiscoveryLayer discoveryLayer;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}

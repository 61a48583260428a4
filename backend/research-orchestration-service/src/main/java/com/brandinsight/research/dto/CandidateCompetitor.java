package com.brandinsight.research.dto;

import com.brandinsight.research.entity.CompetitorType;
import com.brandinsight.research.entity.DiscoveredCompetitor;
import com.brandinsight.research.entity.DiscoveryLayer;

import java.util.Locale;

/**
 * Competitor produced by one discovery layer. Identity is (platform, normalized handle).
 */
public record CandidateCompetitor(
        String handle,
        String platform,
        String discoveryReason,
        double relevanceScore,
        CompetitorType competitorType,
        DiscoveryLayer layer
) {
    public CandidateCompetitor {
        if (relevanceScore < 0.0 || relevanceScore > 1.0) {
            relevanceScore = Math.max(0.0, Math.min(1.0, relevanceScore));
        }
    }

    public static String normalizeHandle(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        while (value.startsWith("@")) {
            value = value.substring(1);
        }
        return value;
    }

    public String identityKey() {
        return (platform == null ? "" : platform.toLowerCase(Locale.ROOT)) + ":" + normalizeHandle(handle);
    }

    public CandidateCompetitor withScore(double score) {
        return new CandidateCompetitor(handle, platform, discoveryReason, score, competitorType, layer);
    }

    public DiscoveredCompetitor toEntity(String jobId) {
        return DiscoveredCompetitor.builder()
                .researchJobId(jobId)
                .platform(platform.toLowerCase(Locale.ROOT))
                .handle(normalizeHandle(handle))
                .discoveryReason(discoveryReason)
                .relevanceScore(relevanceScore)
                .competitorType(competitorType)
                .discoveryLayer(layer)
                .build();
    }

    public static CandidateCompetitor fromEntity(DiscoveredCompetitor entity) {
        return new CandidateCompetitor(
                entity.getHandle(),
                entity.getPlatform(),
                entity.getDiscoveryReason(),
                entity.getRelevanceScore() == null ? 0.0 : entity.getRelevanceScore(),
                entity.getCompetitorType(),
                entity.getDiscoveryLayer()
        );
    }
}

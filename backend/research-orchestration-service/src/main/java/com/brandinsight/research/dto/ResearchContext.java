package com.brandinsight.research.dto;

import com.brandinsight.research.entity.ResearchJob;

import java.util.Locale;
import java.util.Map;

/**
 * Read-only input of one orchestration run.
 *
 * @param handles            known social handles keyed by lower-case platform
 * @param webResearchSummary prior web research, may be null
 */
public record ResearchContext(
        String jobId,
        String brandName,
        String handle,
        String niche,
        String bio,
        String websiteUrl,
        Map<String, String> handles,
        String webResearchSummary
) {
    public ResearchContext {
        handles = handles == null ? Map.of() : Map.copyOf(handles);
    }

    public static ResearchContext fromJob(ResearchJob job) {
        return new ResearchContext(
                job.getId(),
                job.getBrandName(),
                job.getHandle(),
                job.getNiche(),
                job.getBio(),
                job.getWebsiteUrl(),
                job.getHandles(),
                job.getWebResearchSummary()
        );
    }

    /**
     * Copy with a web research summary filled in from freshly gathered context
     */
    public ResearchContext withWebResearchSummary(String summary) {
        return new ResearchContext(jobId, brandName, handle, niche, bio, websiteUrl, handles, summary);
    }

    /**
     * Brand name if set, otherwise the handle without '@'
     */
    public String displayName() {
        return brandName != null && !brandName.isBlank() ? brandName.trim() : cleanHandle();
    }

    /**
     * Lower-cased handle without leading '@'
     */
    public String cleanHandle() {
        return CandidateCompetitor.normalizeHandle(handle);
    }

    public String nicheOrDefault() {
        return niche != null && !niche.isBlank() ? niche.trim() : "business";
    }

    public boolean hasWebResearch() {
        return webResearchSummary != null && !webResearchSummary.isBlank();
    }

    public String handleFor(String platform) {
        return handles.get(platform.toLowerCase(Locale.ROOT));
    }
}

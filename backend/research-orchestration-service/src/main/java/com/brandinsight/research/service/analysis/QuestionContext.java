package com.brandinsight.research.service.analysis;

import com.brandinsight.research.dto.ResearchContext;

import java.util.List;

/**
 * Signals embedded in every analysis prompt.
 */
public record QuestionContext(
        String brandName,
        String handle,
        String bio,
        String niche,
        String websiteUrl,
        String webResearchExcerpt,
        List<String> knownCompetitors
) {
    public QuestionContext {
        knownCompetitors = knownCompetitors == null ? List.of() : List.copyOf(knownCompetitors);
    }

    public static QuestionContext from(ResearchContext context, List<String> competitorHandles, int excerptChars) {
        String excerpt = context.webResearchSummary();
        if (excerpt != null && excerpt.length() > excerptChars) {
            excerpt = excerpt.substring(0, excerptChars);
        }
        return new QuestionContext(
                context.displayName(),
                context.cleanHandle(),
                context.bio(),
                context.niche(),
                context.websiteUrl(),
                excerpt,
                competitorHandles
        );
    }

    /**
     * Multi-line context block appended to the user prompt
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Brand: ").append(brandName).append('\n');
        appendIfPresent(sb, "Handle: @", handle);
        appendIfPresent(sb, "Bio: ", bio);
        appendIfPresent(sb, "Niche: ", niche);
        appendIfPresent(sb, "Website: ", websiteUrl);
        if (!knownCompetitors.isEmpty()) {
            sb.append("Known competitors: @").append(String.join(", @", knownCompetitors)).append('\n');
        }
        if (webResearchExcerpt != null && !webResearchExcerpt.isBlank()) {
            sb.append("\nWeb research:\n").append(webResearchExcerpt.strip()).append('\n');
        }
        return sb.toString().strip();
    }

    private static void appendIfPresent(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(label).append(value.strip()).append('\n');
        }
    }
}

package com.brandinsight.research.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Externalized settings for the research orchestration pipeline.
 *
 * Checkpoint thresholds decide when a persisted step counts as done
 * (done when the persisted count is at least the threshold).
 */
@ConfigurationProperties(prefix = "research")
@Validated
@Data
public class ResearchProperties {

    @Valid
    private Checkpoint checkpoint = new Checkpoint();

    @Valid
    private Discovery discovery = new Discovery();

    @Valid
    private Analysis analysis = new Analysis();

    @Valid
    private Community community = new Community();

    @Valid
    private Scraping scraping = new Scraping();

    @Valid
    private Scripts scripts = new Scripts();

    @Data
    public static class Checkpoint {
        /** Raw brand-context search results */
        @Min(0)
        private int brandContext = 1;

        /** Discovery is done once more than 3 competitors exist */
        @Min(0)
        private int discovery = 4;

        /** Answered question types out of the 12-type catalog */
        @Min(0)
        private int analysis = 10;

        @Min(0)
        private int community = 1;

        @Min(0)
        private int profileScraping = 1;

        @Min(0)
        private int searchTrends = 1;
    }

    @Data
    public static class Discovery {
        /** Fallback layers only run while the merged set is below this size */
        @Min(1)
        private int minCandidates = 5;

        /** Validator rejects candidates below this confidence */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.5;

        /** Per-layer result cap */
        @Min(1)
        private int resultLimit = 15;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double platformSearchScore = 0.85;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double keywordSearchScore = 0.75;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double browserScore = 0.7;

        /** Platform assumed for bare @mentions and browser results */
        @NotBlank
        private String defaultPlatform = "instagram";

        /** Platforms searched by the direct layer when the job declares no handles */
        private Map<String, String> platformSites = new LinkedHashMap<>(Map.of(
                "instagram", "instagram.com",
                "tiktok", "tiktok.com"
        ));
    }

    @Data
    public static class Analysis {
        @NotBlank
        private String model = "gpt-4o";

        @Min(1)
        private int maxTokens = 1500;

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.7;

        /** Upper bound for the web-research excerpt embedded in prompts */
        @Min(0)
        private int contextExcerptChars = 4000;
    }

    @Data
    public static class Community {
        @Min(1)
        private int maxResultsPerQuery = 60;

        @Min(1)
        private int maxLinksPerQuery = 5;
    }

    @Data
    public static class Scraping {
        /** Number of top-ranked competitors scraped alongside the target */
        @Min(0)
        private int maxCompetitors = 3;

        @Min(1)
        private int brandContextResults = 20;
    }

    @Data
    public static class Scripts {
        @NotBlank
        private String pythonExecutable = "python3";

        private String discoveryScript = "scripts/competitor_discovery.py";

        @Min(1)
        private int discoveryTimeoutSeconds = 60;

        private String trendsScript = "scripts/google_trends.py";

        @Min(1)
        private int trendsTimeoutSeconds = 90;

        private String profileScript = "scripts/instagram_scraper.py";

        @Min(1)
        private int profileTimeoutSeconds = 120;

        private String tiktokScript = "scripts/tiktok_scraper.py";

        /** Working directory the script paths are resolved against; empty means the process cwd */
        private String workingDirectory = "";
    }
}

package com.brandinsight.research.client;

import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Instagram / TikTok profile scraping through the helper scripts.
 *
 * instagram: {@code instagram_scraper.py <handle> <postsLimit>}
 * tiktok:    {@code tiktok_scraper.py profile <handle> <maxVideos>}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PythonProfileScraperClient implements ProfileScraperClient {

    private static final String POSTS_LIMIT = "12";

    private final ScriptProcessRunner runner;
    private final ResearchProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(String platform) {
        return "instagram".equals(platform) || "tiktok".equals(platform);
    }

    @Override
    public ScrapedProfile scrape(String platform, String handle) {
        if (!supports(platform)) {
            throw new IllegalArgumentException("Unsupported platform: " + platform);
        }
        String connector = ProfileScraperClient.connectorName(platform);
        String clean = handle.startsWith("@") ? handle.substring(1) : handle;
        ResearchProperties.Scripts scripts = properties.getScripts();

        ScriptResult result = "instagram".equals(platform)
                ? runner.runPython(connector, scripts.getProfileScript(), List.of(clean, POSTS_LIMIT),
                        scripts.getProfileTimeoutSeconds())
                : runner.runPython(connector, scripts.getTiktokScript(), List.of("profile", clean, POSTS_LIMIT),
                        scripts.getProfileTimeoutSeconds());

        return parse(connector, platform, clean, result.stdout());
    }

    ScrapedProfile parse(String connector, String platform, String handle, String stdout) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stdout);
        } catch (Exception e) {
            throw new ProviderException(connector, "Malformed scraper output: " + e.getMessage(), e);
        }
        if (root.hasNonNull("error")) {
            throw new ProviderException(connector, "Scraper error: " + root.get("error").asText());
        }

        // tiktok nests the profile block, instagram returns it at the root
        JsonNode profile = root.has("profile") ? root.get("profile") : root;

        String profileUrl = "instagram".equals(platform)
                ? "https://www.instagram.com/" + handle + "/"
                : "https://www.tiktok.com/@" + handle;

        Integer postsCount = null;
        if (profile.hasNonNull("total_posts")) {
            postsCount = profile.get("total_posts").asInt();
        } else if (root.has("videos")) {
            postsCount = root.get("videos").size();
        }

        return new ScrapedProfile(
                platform,
                handle,
                longOrNull(profile, "follower_count"),
                longOrNull(profile, "following_count"),
                postsCount,
                profile.path("bio").asText(null),
                profileUrl
        );
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : null;
    }
}

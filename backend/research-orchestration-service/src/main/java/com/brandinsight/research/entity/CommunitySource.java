package com.brandinsight.research.entity;

import java.net.URI;
import java.util.Locale;

/**
 * Domain family of a community insight.
 *
 * - REDDIT: reddit.com threads and comments
 * - QUORA: Q&A answers
 * - TRUSTPILOT: review pages
 * - FORUM: any other discussion board
 */
public enum CommunitySource {
    REDDIT("reddit"),
    QUORA("quora"),
    TRUSTPILOT("trustpilot"),
    FORUM("forum");

    private final String value;

    CommunitySource(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Infer the family from a result URL. Unknown hosts fall back to FORUM.
     */
    public static CommunitySource fromUrl(String url) {
        String host = hostOf(url);
        if (host.endsWith("reddit.com") || host.equals("redd.it")) return REDDIT;
        if (host.endsWith("quora.com")) return QUORA;
        if (host.endsWith("trustpilot.com")) return TRUSTPILOT;
        return FORUM;
    }

    private static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return url.toLowerCase(Locale.ROOT);
        }
    }
}

package com.brandinsight.research.client;

/**
 * Public profile statistics returned by a scraper. Counts are null when the scraper could not read them.
 */
public record ScrapedProfile(
        String platform,
        String handle,
        Long followers,
        Long following,
        Integer postsCount,
        String bio,
        String profileUrl
) {
}

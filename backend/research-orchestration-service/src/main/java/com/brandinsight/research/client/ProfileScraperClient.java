package com.brandinsight.research.client;

public interface ProfileScraperClient {

    /**
     * Connector name for a platform, e.g. {@code instagram_scraper}
     */
    static String connectorName(String platform) {
        return platform + "_scraper";
    }

    boolean supports(String platform);

    ScrapedProfile scrape(String platform, String handle);
}

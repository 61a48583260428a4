package com.brandinsight.research.client;

import java.util.List;

/**
 * Headless-browser competitor search. Highest latency of all discovery paths.
 */
public interface BrowserAutomationClient {

    String CONNECTOR = "browser_agent";

    /**
     * @return raw handles as found on the page, possibly with a leading '@'
     */
    List<String> searchCompetitors(String handle, String niche);
}

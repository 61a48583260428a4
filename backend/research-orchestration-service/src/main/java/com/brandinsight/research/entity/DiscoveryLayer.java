package com.brandinsight.research.entity;

/**
 * Strategy that produced a competitor candidate, in fallback order.
 * Attached when the candidate is created and never inferred afterwards.
 */
public enum DiscoveryLayer {
    DIRECT_PLATFORM_SEARCH("direct_platform_search", false),
    KEYWORD_SEARCH("keyword_search", false),
    LEGACY_SCRIPT("legacy_discovery_script", true),
    BROWSER_AUTOMATION("browser_agent", true);

    private final String connectorName;
    private final boolean fallbackOnly;

    DiscoveryLayer(String connectorName, boolean fallbackOnly) {
        this.connectorName = connectorName;
        this.fallbackOnly = fallbackOnly;
    }

    /**
     * Connector name reported to the health tracker
     */
    public String getConnectorName() {
        return connectorName;
    }

    /**
     * Fallback layers run only while the merged set is below the minimum
     */
    public boolean isFallbackOnly() {
        return fallbackOnly;
    }
}

package com.brandinsight.research.client;

import java.util.List;

/**
 * Web search provider. Implementations throw ProviderException on transport or parse failure
 * and return an empty list when the query simply has no hits.
 */
public interface WebSearchClient {

    /**
     * Connector name used for health tracking
     */
    String getConnectorName();

    List<WebSearchResult> search(String query, SearchOptions options);
}

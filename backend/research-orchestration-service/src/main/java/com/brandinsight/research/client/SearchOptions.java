package com.brandinsight.research.client;

import java.util.List;

/**
 * @param maxResults upper bound on returned hits
 * @param sites      optional domain scope rendered as {@code site:} operators
 */
public record SearchOptions(
        int maxResults,
        List<String> sites
) {
    public SearchOptions {
        sites = sites == null ? List.of() : List.copyOf(sites);
    }

    public static SearchOptions limit(int maxResults) {
        return new SearchOptions(maxResults, List.of());
    }

    public static SearchOptions scoped(int maxResults, List<String> sites) {
        return new SearchOptions(maxResults, sites);
    }

    /**
     * Append the site scope to a query, e.g. {@code acme (site:instagram.com OR site:tiktok.com)}
     */
    public String render(String query) {
        if (sites.isEmpty()) {
            return query;
        }
        if (sites.size() == 1) {
            return query + " site:" + sites.get(0);
        }
        StringBuilder scope = new StringBuilder(" (");
        for (int i = 0; i < sites.size(); i++) {
            if (i > 0) {
                scope.append(" OR ");
            }
            scope.append("site:").append(sites.get(i));
        }
        return query + scope.append(')');
    }
}

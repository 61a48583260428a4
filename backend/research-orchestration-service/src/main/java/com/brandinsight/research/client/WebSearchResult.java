package com.brandinsight.research.client;

public record WebSearchResult(
        String title,
        String body,
        String url
) {
    /**
     * Title and body joined for text matching
     */
    public String text() {
        return (title == null ? "" : title) + " " + (body == null ? "" : body);
    }
}

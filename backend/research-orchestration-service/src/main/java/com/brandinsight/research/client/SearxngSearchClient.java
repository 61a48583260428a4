package com.brandinsight.research.client;

import com.brandinsight.research.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Platform-scoped search through a SearXNG instance (JSON API).
 * Used where exact social platform URLs matter, so the site scope is always applied.
 */
@Component("platformSearchClient")
@Slf4j
public class SearxngSearchClient implements WebSearchClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${research.search.searxng.base-url:}")
    private String baseUrl;

    @Value("${research.search.timeout-seconds:30}")
    private int timeoutSeconds;

    public SearxngSearchClient(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getConnectorName() {
        return "searxng_platform_search";
    }

    public boolean isEnabled() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    @Override
    public List<WebSearchResult> search(String query, SearchOptions options) {
        if (!isEnabled()) {
            throw new ProviderException("NOT_CONFIGURED", getConnectorName(),
                    "SearXNG base URL is not configured", null);
        }
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String rendered = options.render(query);
        String endpoint = baseUrl.endsWith("/") ? baseUrl + "search" : baseUrl + "/search";

        String response;
        try {
            response = webClient.get()
                    .uri(uriBuilder -> {
                        URI uri = URI.create(endpoint);
                        return uriBuilder
                                .scheme(uri.getScheme())
                                .host(uri.getHost())
                                .port(uri.getPort())
                                .path(uri.getPath())
                                .queryParam("q", rendered)
                                .queryParam("format", "json")
                                .build();
                    })
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (Exception e) {
            throw new ProviderException(getConnectorName(), "SearXNG request failed: " + e.getMessage(), e);
        }

        return parseResults(response, options.maxResults());
    }

    List<WebSearchResult> parseResults(String response, int maxResults) {
        List<WebSearchResult> results = new ArrayList<>();
        if (response == null || response.isBlank()) {
            return results;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ProviderException(getConnectorName(), "Malformed SearXNG response: " + e.getMessage(), e);
        }
        for (JsonNode item : root.path("results")) {
            if (results.size() >= maxResults) {
                break;
            }
            String url = item.path("url").asText("");
            if (url.isBlank()) {
                continue;
            }
            results.add(new WebSearchResult(
                    item.path("title").asText(""),
                    item.path("content").asText(""),
                    url
            ));
        }
        return results;
    }
}

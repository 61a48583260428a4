package com.brandinsight.research.client;

import com.brandinsight.research.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Browser-automation agent reached over HTTP.
 * The agent drives a real browser through a search engine and returns handle strings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrowserAgentClient implements BrowserAutomationClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${research.browser.base-url:}")
    private String baseUrl;

    @Value("${research.browser.timeout-seconds:90}")
    private int timeoutSeconds;

    public boolean isEnabled() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    @Override
    public List<String> searchCompetitors(String handle, String niche) {
        if (!isEnabled()) {
            throw new ProviderException("NOT_CONFIGURED", CONNECTOR, "Browser agent URL is not configured", null);
        }
        String url = baseUrl.endsWith("/") ? baseUrl + "competitors/search" : baseUrl + "/competitors/search";

        String response;
        try {
            response = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("handle", handle, "niche", niche == null ? "" : niche))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (WebClientResponseException e) {
            throw new ProviderException("HTTP_" + e.getStatusCode().value(), CONNECTOR,
                    "Browser agent error: " + e.getStatusText(), e);
        } catch (Exception e) {
            throw new ProviderException(CONNECTOR, "Browser agent request failed: " + e.getMessage(), e);
        }

        List<String> handles = parseHandles(response);
        log.info("Browser agent returned {} handles for @{}", handles.size(), handle);
        return handles;
    }

    List<String> parseHandles(String response) {
        List<String> handles = new ArrayList<>();
        if (response == null || response.isBlank()) {
            return handles;
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            for (JsonNode node : root.path("handles")) {
                String value = node.asText("").trim();
                if (!value.isEmpty()) {
                    handles.add(value);
                }
            }
        } catch (Exception e) {
            throw new ProviderException(CONNECTOR, "Malformed browser agent response: " + e.getMessage(), e);
        }
        return handles;
    }
}

package com.brandinsight.research.client;

import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Search-interest lookup through the trends helper script.
 *
 * Two invocations per lookup: {@code interest_over_time} (required) and
 * {@code related_queries} (optional; failure leaves related queries empty).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PythonTrendsClient implements TrendLookupClient {

    /** Upstream accepts at most 5 keywords per request */
    static final int MAX_KEYWORDS = 5;

    private static final int MAX_RELATED = 10;

    private final ScriptProcessRunner runner;
    private final ResearchProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public List<TrendSeries> lookup(List<String> keywords) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(String::trim)
                .toList()));
        if (unique.size() > MAX_KEYWORDS) {
            unique = unique.subList(0, MAX_KEYWORDS);
        }
        if (unique.isEmpty()) {
            return List.of();
        }

        ResearchProperties.Scripts scripts = properties.getScripts();
        List<String> interestArgs = new ArrayList<>();
        interestArgs.add("interest_over_time");
        interestArgs.addAll(unique);
        ScriptResult interest = runner.runPython(CONNECTOR, scripts.getTrendsScript(),
                interestArgs, scripts.getTrendsTimeoutSeconds());
        JsonNode interestData = readData(interest.stdout(), true);

        JsonNode relatedData = null;
        try {
            List<String> relatedArgs = new ArrayList<>();
            relatedArgs.add("related_queries");
            relatedArgs.addAll(unique);
            ScriptResult related = runner.runPython(CONNECTOR, scripts.getTrendsScript(),
                    relatedArgs, scripts.getTrendsTimeoutSeconds());
            relatedData = readData(related.stdout(), false);
        } catch (ProviderException e) {
            log.warn("Related queries unavailable for {}: {}", unique, e.getMessage());
        }

        return toSeries(unique, interestData, relatedData);
    }

    private JsonNode readData(String stdout, boolean required) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stdout);
        } catch (Exception e) {
            throw new ProviderException(CONNECTOR, "Malformed trends output: " + e.getMessage(), e);
        }
        if (root.hasNonNull("error")) {
            String message = "Trends lookup error: " + root.get("error").asText();
            if (required) {
                throw new ProviderException(CONNECTOR, message);
            }
            log.warn(message);
            return null;
        }
        return root.path("data");
    }

    /**
     * interest data shape: {date: {keyword: value}}; related data shape: {keyword: {top: [{query, value}]}}
     */
    List<TrendSeries> toSeries(List<String> keywords, JsonNode interestData, JsonNode relatedData) {
        List<TrendSeries> series = new ArrayList<>();
        for (String keyword : keywords) {
            long sum = 0;
            int points = 0;
            int peak = 0;
            Iterator<Map.Entry<String, JsonNode>> dates = interestData == null
                    ? Collections.<Map.Entry<String, JsonNode>>emptyIterator()
                    : interestData.fields();
            while (dates.hasNext()) {
                JsonNode value = dates.next().getValue().get(keyword);
                if (value != null && value.isNumber()) {
                    int v = value.asInt();
                    sum += v;
                    points++;
                    peak = Math.max(peak, v);
                }
            }

            List<String> related = new ArrayList<>();
            if (relatedData != null) {
                for (JsonNode item : relatedData.path(keyword).path("top")) {
                    if (related.size() >= MAX_RELATED) {
                        break;
                    }
                    String query = item.path("query").asText("");
                    if (!query.isBlank()) {
                        related.add(query);
                    }
                }
            }

            double average = points == 0 ? 0.0 : (double) sum / points;
            series.add(new TrendSeries(keyword, average, peak, related));
        }
        return series;
    }
}

package com.brandinsight.research.service.auxiliary;

import com.brandinsight.research.client.SearchOptions;
import com.brandinsight.research.client.WebSearchClient;
import com.brandinsight.research.client.WebSearchResult;
import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.entity.RawSearchResult;
import com.brandinsight.research.exception.ProviderException;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.store.ResearchStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Brand context search: general web results about the target, stored as raw results
 * and condensed into the web research excerpt used by analysis prompts.
 */
@Service
@Slf4j
public class BrandContextSearchService {

    static final String SOURCE = "brand_context";
    static final int SUMMARY_SNIPPETS = 5;

    private final WebSearchClient searchClient;
    private final ResearchStore store;
    private final ConnectorHealthTracker healthTracker;
    private final ResearchProperties properties;

    public BrandContextSearchService(@Qualifier("generalSearchClient") WebSearchClient searchClient,
                                     ResearchStore store,
                                     ConnectorHealthTracker healthTracker,
                                     ResearchProperties properties) {
        this.searchClient = searchClient;
        this.store = store;
        this.healthTracker = healthTracker;
        this.properties = properties;
    }

    /**
     * @throws ProviderException when every query failed
     */
    public BrandContextResult gather(ResearchContext context) {
        List<String> queries = buildQueries(context);
        SearchOptions options = SearchOptions.limit(properties.getScraping().getBrandContextResults());

        List<WebSearchResult> collected = new ArrayList<>();
        int saved = 0;
        int failed = 0;
        String lastError = null;

        for (String query : queries) {
            List<WebSearchResult> results;
            try {
                results = searchClient.search(query, options);
                healthTracker.markOk(searchClient.getConnectorName());
            } catch (RuntimeException e) {
                failed++;
                lastError = e.getMessage();
                healthTracker.markDegraded(searchClient.getConnectorName(), e.getMessage());
                log.warn("[BrandContext] Query failed \"{}\": {}", query, e.getMessage());
                continue;
            }
            for (WebSearchResult result : results) {
                collected.add(result);
                RawSearchResult raw = RawSearchResult.builder()
                        .researchJobId(context.jobId())
                        .query(query)
                        .title(result.title())
                        .body(result.body())
                        .url(result.url())
                        .source(SOURCE)
                        .build();
                if (store.insertRawResultIfAbsent(raw)) {
                    saved++;
                }
            }
        }

        if (failed == queries.size()) {
            throw new ProviderException(searchClient.getConnectorName(),
                    "All brand context queries failed: " + lastError);
        }

        String summary = summarize(collected.stream().map(WebSearchResult::body).toList());
        log.info("[BrandContext] {} results ({} new) for {}, {} failed queries",
                collected.size(), saved, context.displayName(), failed);
        return new BrandContextResult(collected.size(), saved, failed, summary);
    }

    /**
     * Excerpt rebuilt from already stored results, used when the step is skipped on resume
     */
    public String summaryFromStore(String jobId) {
        return summarize(store.findRawResults(jobId, SUMMARY_SNIPPETS * 2).stream()
                .map(RawSearchResult::getBody)
                .toList());
    }

    static List<String> buildQueries(ResearchContext context) {
        String h = context.cleanHandle();
        String brand = context.displayName();
        Set<String> queries = new LinkedHashSet<>();
        queries.add("\"" + brand + "\"");
        queries.add("\"" + brand + "\" official");
        queries.add("\"" + h + "\" website");
        queries.add("\"" + h + "\" about");
        queries.add("\"" + h + "\" review");
        return new ArrayList<>(queries);
    }

    private static String summarize(List<String> snippets) {
        List<String> lines = new ArrayList<>();
        for (String snippet : snippets) {
            if (snippet != null && !snippet.isBlank()) {
                lines.add(snippet.strip());
            }
            if (lines.size() >= SUMMARY_SNIPPETS) {
                break;
            }
        }
        return lines.isEmpty() ? null : String.join("\n", lines);
    }
}

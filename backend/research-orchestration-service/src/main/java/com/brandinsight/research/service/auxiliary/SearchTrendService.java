package com.brandinsight.research.service.auxiliary;

import com.brandinsight.research.client.TrendLookupClient;
import com.brandinsight.research.client.TrendSeries;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.entity.SearchTrend;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.store.ResearchStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Search interest for the brand and its niche, one stored row per keyword.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchTrendService {

    private final TrendLookupClient trendClient;
    private final ResearchStore store;
    private final ConnectorHealthTracker healthTracker;

    /**
     * @throws RuntimeException when the lookup itself fails
     */
    public TrendsResult analyze(ResearchContext context) {
        List<String> keywords = keywordsFor(context);
        List<TrendSeries> series;
        try {
            series = trendClient.lookup(keywords);
            healthTracker.markOk(TrendLookupClient.CONNECTOR);
        } catch (RuntimeException e) {
            healthTracker.markDegraded(TrendLookupClient.CONNECTOR, e.getMessage());
            throw e;
        }

        int saved = 0;
        int existing = 0;
        for (TrendSeries trend : series) {
            SearchTrend row = SearchTrend.builder()
                    .researchJobId(context.jobId())
                    .keyword(trend.keyword())
                    .averageInterest(trend.averageInterest())
                    .peakInterest(trend.peakInterest())
                    .relatedQueries(String.join("\n", trend.relatedQueries()))
                    .build();
            if (store.insertTrendIfAbsent(row)) {
                saved++;
            } else {
                existing++;
            }
        }
        log.info("[SearchTrends] {} keywords for job {}: {} saved, {} existing",
                keywords.size(), context.jobId(), saved, existing);
        return new TrendsResult(keywords, saved, existing);
    }

    static List<String> keywordsFor(ResearchContext context) {
        Set<String> keywords = new LinkedHashSet<>();
        keywords.add(context.displayName());
        if (context.niche() != null && !context.niche().isBlank()) {
            keywords.add(context.niche().trim());
            keywords.add(context.niche().trim() + " trends");
        }
        return new ArrayList<>(keywords);
    }
}

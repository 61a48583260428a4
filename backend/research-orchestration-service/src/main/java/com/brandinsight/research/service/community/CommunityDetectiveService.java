package com.brandinsight.research.service.community;

import com.brandinsight.research.client.SearchOptions;
import com.brandinsight.research.client.WebSearchClient;
import com.brandinsight.research.client.WebSearchResult;
import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.dto.StepError;
import com.brandinsight.research.entity.CommunityInsight;
import com.brandinsight.research.entity.CommunitySource;
import com.brandinsight.research.entity.InsightSentiment;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.store.ResearchStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 커뮤니티 신호 수집 (Voice of Customer).
 *
 * 토론 사이트 위주의 고정 쿼리로 검색한 뒤 두 가지 조건을 모두 만족하는 결과만 저장합니다.
 * 1. URL 도메인이 커뮤니티 계열일 것
 * 2. 제목+본문에 대상 핸들이나 브랜드명이 포함될 것
 * 니치 키워드 일치 여부는 로그로만 남깁니다. 같은 (job, url)은 다시 저장하지 않습니다.
 */
@Service
@Slf4j
public class CommunityDetectiveService {

    static final String STEP = "COMMUNITY";
    static final String METRIC = "search_rank";

    private static final Set<String> COMMUNITY_DOMAINS = Set.of(
            "reddit.com", "redd.it", "quora.com", "trustpilot.com", "indiehackers.com"
    );
    private static final List<String> COMMUNITY_TOKENS = List.of("community", "forum", "discuss");

    private final WebSearchClient searchClient;
    private final CommunityQueryBuilder queryBuilder;
    private final ResearchStore store;
    private final ConnectorHealthTracker healthTracker;
    private final ResearchProperties properties;

    public CommunityDetectiveService(@Qualifier("generalSearchClient") WebSearchClient searchClient,
                                     CommunityQueryBuilder queryBuilder,
                                     ResearchStore store,
                                     ConnectorHealthTracker healthTracker,
                                     ResearchProperties properties) {
        this.searchClient = searchClient;
        this.queryBuilder = queryBuilder;
        this.store = store;
        this.healthTracker = healthTracker;
        this.properties = properties;
    }

    public CommunityScanResult scan(ResearchContext context) {
        ResearchProperties.Community config = properties.getCommunity();
        List<String> queries = new ArrayList<>(new LinkedHashSet<>(queryBuilder.buildQueries(context)));
        List<String> targets = targetTerms(context);
        List<String> nicheKeywords = nicheKeywords(context.niche());

        log.info("[Community] Scanning {} queries for {} (job {})", queries.size(), context.displayName(), context.jobId());

        int linksCollected = 0;
        int insightsSaved = 0;
        int skippedExisting = 0;
        int filteredOut = 0;
        List<StepError> errors = new ArrayList<>();

        for (String query : queries) {
            List<WebSearchResult> results;
            try {
                results = searchClient.search(query, SearchOptions.limit(config.getMaxResultsPerQuery()));
                healthTracker.markOk(searchClient.getConnectorName());
            } catch (RuntimeException e) {
                healthTracker.markDegraded(searchClient.getConnectorName(), e.getMessage());
                errors.add(new StepError(STEP, query, e.getMessage()));
                log.warn("[Community] Query failed \"{}\": {}", query, e.getMessage());
                continue;
            }

            int accepted = 0;
            for (int rank = 0; rank < results.size() && accepted < config.getMaxLinksPerQuery(); rank++) {
                WebSearchResult result = results.get(rank);
                if (!isCommunityUrl(result.url())) {
                    filteredOut++;
                    continue;
                }
                String text = result.text().toLowerCase(Locale.ROOT);
                if (targets.stream().noneMatch(text::contains)) {
                    log.debug("[Community] No brand mention: {}", result.title());
                    filteredOut++;
                    continue;
                }
                if (!nicheKeywords.isEmpty() && nicheKeywords.stream().noneMatch(text::contains)) {
                    log.debug("[Community] Weak niche match, keeping: {}", result.title());
                }

                accepted++;
                linksCollected++;
                if (store.insertInsightIfAbsent(toInsight(context.jobId(), result, query, rank + 1))) {
                    insightsSaved++;
                } else {
                    skippedExisting++;
                }
            }
        }

        log.info("[Community] Complete for job {}: queries={}, links={}, saved={}, existing={}, filtered={}, failed={}",
                context.jobId(), queries.size(), linksCollected, insightsSaved, skippedExisting, filteredOut, errors.size());
        return new CommunityScanResult(queries.size(), linksCollected, insightsSaved, skippedExisting,
                filteredOut, errors.size(), List.copyOf(errors));
    }

    static boolean isCommunityUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            host = null;
        }
        if (host != null) {
            String h = host.toLowerCase(Locale.ROOT);
            for (String domain : COMMUNITY_DOMAINS) {
                if (h.equals(domain) || h.endsWith("." + domain)) {
                    return true;
                }
            }
        }
        return COMMUNITY_TOKENS.stream().anyMatch(lower::contains);
    }

    private CommunityInsight toInsight(String jobId, WebSearchResult result, String query, int rank) {
        CommunitySource source = CommunitySource.fromUrl(result.url());
        String content = "Source: " + source.getValue() + "\n"
                + "Title: " + result.title() + "\n"
                + "Snippet: " + result.body() + "\n"
                + "Query Used: " + query;
        return CommunityInsight.builder()
                .researchJobId(jobId)
                .source(source)
                .url(result.url())
                .title(result.title())
                .content(content)
                .sourceQuery(query)
                .sentiment(InsightSentiment.NEUTRAL)
                .metric(METRIC)
                .metricValue((double) rank)
                .build();
    }

    private static List<String> targetTerms(ResearchContext context) {
        Set<String> terms = new LinkedHashSet<>();
        String handle = context.cleanHandle();
        if (handle.length() >= 2) {
            terms.add(handle);
        }
        if (context.brandName() != null && !context.brandName().isBlank()) {
            terms.add(context.brandName().trim().toLowerCase(Locale.ROOT).replace("@", ""));
        }
        return new ArrayList<>(terms);
    }

    private static List<String> nicheKeywords(String niche) {
        if (niche == null || niche.isBlank()) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>();
        for (String word : niche.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.length() > 3) {
                keywords.add(word);
            }
        }
        return keywords;
    }
}

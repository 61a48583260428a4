package com.brandinsight.research.service.discovery;

import com.brandinsight.research.client.SearchOptions;
import com.brandinsight.research.client.WebSearchClient;
import com.brandinsight.research.client.WebSearchResult;
import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.CandidateCompetitor;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.entity.CompetitorType;
import com.brandinsight.research.entity.DiscoveryLayer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 2: general web search on niche and look-alike phrasing.
 * Handles come from profile links and from @mentions in titles and snippets.
 */
@Component
@Slf4j
public class KeywordSearchLayer implements DiscoveryLayerProvider {

    private final WebSearchClient searchClient;
    private final SocialHandleExtractor extractor;
    private final ResearchProperties properties;

    public KeywordSearchLayer(@Qualifier("generalSearchClient") WebSearchClient searchClient,
                              SocialHandleExtractor extractor,
                              ResearchProperties properties) {
        this.searchClient = searchClient;
        this.extractor = extractor;
        this.properties = properties;
    }

    @Override
    public DiscoveryLayer layer() {
        return DiscoveryLayer.KEYWORD_SEARCH;
    }

    @Override
    public String connectorName() {
        return searchClient.getConnectorName();
    }

    @Override
    public List<CandidateCompetitor> discover(ResearchContext context, int limit) {
        String target = context.cleanHandle();
        String niche = context.nicheOrDefault();
        String platform = properties.getDiscovery().getDefaultPlatform();

        List<String> queries = buildQueries(target, niche, platform);
        SearchOptions options = SearchOptions.limit(limit * 2);
        double score = properties.getDiscovery().getKeywordSearchScore();

        Map<String, CandidateCompetitor> found = new LinkedHashMap<>();
        for (String query : queries) {
            for (WebSearchResult result : searchClient.search(query, options)) {
                List<ExtractedHandle> handles = new ArrayList<>();
                extractor.fromUrl(result.url()).ifPresent(handles::add);
                handles.addAll(extractor.fromText(result.text(), platform));

                for (ExtractedHandle extracted : handles) {
                    if (extracted.handle().equals(target)) {
                        continue;
                    }
                    CandidateCompetitor candidate = new CandidateCompetitor(
                            extracted.handle(),
                            extracted.platform(),
                            "Mentioned in search results for: " + query,
                            score,
                            CompetitorType.DISCOVERED,
                            DiscoveryLayer.KEYWORD_SEARCH
                    );
                    found.putIfAbsent(candidate.identityKey(), candidate);
                }
                if (found.size() >= limit) {
                    break;
                }
            }
            if (found.size() >= limit) {
                break;
            }
        }

        List<CandidateCompetitor> candidates = new ArrayList<>(found.values());
        log.info("Keyword search found {} candidates for @{} in '{}'", candidates.size(), target, niche);
        return candidates.size() > limit ? candidates.subList(0, limit) : candidates;
    }

    static List<String> buildQueries(String handle, String niche, String platform) {
        return List.of(
                niche + " competitors of " + handle,
                "top " + niche + " " + platform + " accounts",
                platform + " accounts like @" + handle,
                "similar to @" + handle + " " + platform,
                niche + " brands " + platform
        );
    }
}

package com.brandinsight.research.service.discovery;

import com.brandinsight.research.client.SearchOptions;
import com.brandinsight.research.client.SearxngSearchClient;
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
 * Layer 1: search scoped to social platform domains.
 * Hits are exact profile URLs, so the handle is read straight from the link.
 */
@Component
@Slf4j
public class DirectPlatformSearchLayer implements DiscoveryLayerProvider {

    private final WebSearchClient platformSearchClient;
    private final WebSearchClient generalSearchClient;
    private final SocialHandleExtractor extractor;
    private final ResearchProperties properties;

    public DirectPlatformSearchLayer(@Qualifier("platformSearchClient") WebSearchClient platformSearchClient,
                                     @Qualifier("generalSearchClient") WebSearchClient generalSearchClient,
                                     SocialHandleExtractor extractor,
                                     ResearchProperties properties) {
        this.platformSearchClient = platformSearchClient;
        this.generalSearchClient = generalSearchClient;
        this.extractor = extractor;
        this.properties = properties;
    }

    @Override
    public DiscoveryLayer layer() {
        return DiscoveryLayer.DIRECT_PLATFORM_SEARCH;
    }

    @Override
    public String connectorName() {
        return activeClient().getConnectorName();
    }

    @Override
    public List<CandidateCompetitor> discover(ResearchContext context, int limit) {
        WebSearchClient client = activeClient();
        List<String> sites = platformSites(context);
        SearchOptions options = SearchOptions.scoped(limit * 2, sites);
        String target = context.cleanHandle();
        String niche = context.nicheOrDefault();

        List<String> queries = List.of(
                context.displayName() + " " + niche,
                "accounts like @" + target,
                niche + " brands similar to " + context.displayName()
        );

        Map<String, CandidateCompetitor> found = new LinkedHashMap<>();
        for (String query : queries) {
            for (WebSearchResult result : client.search(query, options)) {
                extractor.fromUrl(result.url()).ifPresent(extracted -> {
                    if (extracted.handle().equals(target)) {
                        return;
                    }
                    CandidateCompetitor candidate = new CandidateCompetitor(
                            extracted.handle(),
                            extracted.platform(),
                            "Profile found via " + extracted.platform() + " search: " + query,
                            properties.getDiscovery().getPlatformSearchScore(),
                            CompetitorType.DISCOVERED,
                            DiscoveryLayer.DIRECT_PLATFORM_SEARCH
                    );
                    found.putIfAbsent(candidate.identityKey(), candidate);
                });
                if (found.size() >= limit) {
                    return new ArrayList<>(found.values());
                }
            }
        }
        log.info("Direct platform search found {} candidates for @{}", found.size(), target);
        return new ArrayList<>(found.values());
    }

    /**
     * Platforms where the target declared a handle; configured defaults otherwise
     */
    private List<String> platformSites(ResearchContext context) {
        Map<String, String> configured = properties.getDiscovery().getPlatformSites();
        List<String> sites = new ArrayList<>();
        for (String platform : context.handles().keySet()) {
            String site = configured.get(platform);
            if (site != null) {
                sites.add(site);
            }
        }
        return sites.isEmpty() ? new ArrayList<>(configured.values()) : sites;
    }

    private WebSearchClient activeClient() {
        if (platformSearchClient instanceof SearxngSearchClient searxng && !searxng.isEnabled()) {
            return generalSearchClient;
        }
        return platformSearchClient;
    }
}

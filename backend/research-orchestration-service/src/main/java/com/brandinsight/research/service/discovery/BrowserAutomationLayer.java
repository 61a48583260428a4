package com.brandinsight.research.service.discovery;

import com.brandinsight.research.client.BrowserAutomationClient;
import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.CandidateCompetitor;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.entity.CompetitorType;
import com.brandinsight.research.entity.DiscoveryLayer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 4: browser-automation search, last resort.
 */
@Component
@RequiredArgsConstructor
public class BrowserAutomationLayer implements DiscoveryLayerProvider {

    private final BrowserAutomationClient browserClient;
    private final SocialHandleExtractor extractor;
    private final ResearchProperties properties;

    @Override
    public DiscoveryLayer layer() {
        return DiscoveryLayer.BROWSER_AUTOMATION;
    }

    @Override
    public List<CandidateCompetitor> discover(ResearchContext context, int limit) {
        String target = context.cleanHandle();
        String platform = properties.getDiscovery().getDefaultPlatform();
        double score = properties.getDiscovery().getBrowserScore();

        Map<String, CandidateCompetitor> found = new LinkedHashMap<>();
        for (String raw : browserClient.searchCompetitors(target, context.nicheOrDefault())) {
            if (found.size() >= limit) {
                break;
            }
            extractor.normalize(raw)
                    .filter(handle -> !handle.equals(target))
                    .ifPresent(handle -> {
                        CandidateCompetitor candidate = new CandidateCompetitor(
                                handle, platform, "Found via browser search",
                                score, CompetitorType.DISCOVERED, DiscoveryLayer.BROWSER_AUTOMATION);
                        found.putIfAbsent(candidate.identityKey(), candidate);
                    });
        }
        return new ArrayList<>(found.values());
    }
}

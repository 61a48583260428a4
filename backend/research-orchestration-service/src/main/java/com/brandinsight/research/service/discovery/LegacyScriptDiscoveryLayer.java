package com.brandinsight.research.service.discovery;

import com.brandinsight.research.client.ScriptProcessRunner;
import com.brandinsight.research.client.ScriptResult;
import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.CandidateCompetitor;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.entity.CompetitorType;
import com.brandinsight.research.entity.DiscoveryLayer;
import com.brandinsight.research.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 3: the standalone discovery script, run as a time-boxed subprocess.
 *
 * Invocation: {@code competitor_discovery.py <handle> <bio> <niche> <limit>};
 * stdout is {@code {"competitors": [{handle, platform, discovery_reason, relevance_score, competitor_type}]}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LegacyScriptDiscoveryLayer implements DiscoveryLayerProvider {

    private final ScriptProcessRunner runner;
    private final ResearchProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public DiscoveryLayer layer() {
        return DiscoveryLayer.LEGACY_SCRIPT;
    }

    @Override
    public List<CandidateCompetitor> discover(ResearchContext context, int limit) {
        ResearchProperties.Scripts scripts = properties.getScripts();
        List<String> args = List.of(
                context.cleanHandle(),
                context.bio() == null ? "" : context.bio(),
                context.nicheOrDefault(),
                String.valueOf(limit)
        );
        ScriptResult result = runner.runPython(connectorName(), scripts.getDiscoveryScript(),
                args, scripts.getDiscoveryTimeoutSeconds());
        return parse(result.stdout(), limit);
    }

    List<CandidateCompetitor> parse(String stdout, int limit) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stdout);
        } catch (Exception e) {
            throw new ProviderException("MALFORMED_OUTPUT", connectorName(),
                    "Discovery script returned invalid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProviderException("MALFORMED_OUTPUT", connectorName(),
                    "Discovery script returned no JSON object", null);
        }
        if (root.hasNonNull("error")) {
            throw new ProviderException(connectorName(), "Discovery script error: " + root.get("error").asText());
        }

        String defaultPlatform = properties.getDiscovery().getDefaultPlatform();
        List<CandidateCompetitor> candidates = new ArrayList<>();
        for (JsonNode item : root.path("competitors")) {
            if (candidates.size() >= limit) {
                break;
            }
            String handle = item.path("handle").asText("");
            if (handle.isBlank()) {
                continue;
            }
            double score = item.path("relevance_score").isNumber()
                    ? item.get("relevance_score").asDouble()
                    : 0.5;
            candidates.add(new CandidateCompetitor(
                    CandidateCompetitor.normalizeHandle(handle),
                    item.path("platform").asText(defaultPlatform),
                    item.path("discovery_reason").asText("Suggested by discovery script"),
                    score,
                    CompetitorType.fromValue(item.path("competitor_type").asText(null)),
                    DiscoveryLayer.LEGACY_SCRIPT
            ));
        }
        log.info("Discovery script returned {} candidates", candidates.size());
        return candidates;
    }
}

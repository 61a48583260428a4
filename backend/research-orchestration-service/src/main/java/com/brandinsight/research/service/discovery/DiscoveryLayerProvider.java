package com.brandinsight.research.service.discovery;

import com.brandinsight.research.dto.CandidateCompetitor;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.entity.DiscoveryLayer;

import java.util.List;

/**
 * One competitor discovery strategy. Implementations may throw; the resolver isolates each layer.
 */
public interface DiscoveryLayerProvider {

    DiscoveryLayer layer();

    /**
     * Connector whose health this layer reports
     */
    default String connectorName() {
        return layer().getConnectorName();
    }

    List<CandidateCompetitor> discover(ResearchContext context, int limit);
}

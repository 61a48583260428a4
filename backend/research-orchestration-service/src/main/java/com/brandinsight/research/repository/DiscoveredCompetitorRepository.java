package com.brandinsight.research.repository;

import com.brandinsight.research.entity.DiscoveredCompetitor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DiscoveredCompetitorRepository extends JpaRepository<DiscoveredCompetitor, Long> {

    /**
     * Find competitors for a job, best first
     */
    List<DiscoveredCompetitor> findByResearchJobIdOrderByRelevanceScoreDescIdAsc(String researchJobId);

    Optional<DiscoveredCompetitor> findByResearchJobIdAndPlatformAndHandle(
            String researchJobId, String platform, String handle);

    long countByResearchJobId(String researchJobId);
}

package com.brandinsight.research.repository;

import com.brandinsight.research.entity.CommunityInsight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CommunityInsightRepository extends JpaRepository<CommunityInsight, Long> {

    boolean existsByResearchJobIdAndUrl(String researchJobId, String url);

    long countByResearchJobId(String researchJobId);

    List<CommunityInsight> findByResearchJobIdOrderByCreatedAtAsc(String researchJobId);
}

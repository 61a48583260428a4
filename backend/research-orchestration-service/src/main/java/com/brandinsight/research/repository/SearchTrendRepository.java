package com.brandinsight.research.repository;

import com.brandinsight.research.entity.SearchTrend;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SearchTrendRepository extends JpaRepository<SearchTrend, Long> {

    boolean existsByResearchJobIdAndKeyword(String researchJobId, String keyword);

    long countByResearchJobId(String researchJobId);
}

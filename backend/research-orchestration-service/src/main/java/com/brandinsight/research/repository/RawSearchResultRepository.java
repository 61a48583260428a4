package com.brandinsight.research.repository;

import com.brandinsight.research.entity.RawSearchResult;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RawSearchResultRepository extends JpaRepository<RawSearchResult, Long> {

    boolean existsByResearchJobIdAndUrl(String researchJobId, String url);

    long countByResearchJobId(String researchJobId);

    /**
     * Earliest stored results first, so the context excerpt is stable across runs
     */
    List<RawSearchResult> findByResearchJobIdOrderByIdAsc(String researchJobId, Pageable pageable);
}

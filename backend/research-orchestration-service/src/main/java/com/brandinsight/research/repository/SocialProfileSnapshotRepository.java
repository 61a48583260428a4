package com.brandinsight.research.repository;

import com.brandinsight.research.entity.SocialProfileSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SocialProfileSnapshotRepository extends JpaRepository<SocialProfileSnapshot, Long> {

    Optional<SocialProfileSnapshot> findByResearchJobIdAndPlatformAndHandle(
            String researchJobId, String platform, String handle);

    long countByResearchJobId(String researchJobId);
}

package com.brandinsight.research.repository;

import com.brandinsight.research.entity.ResearchJob;
import com.brandinsight.research.entity.ResearchJobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface ResearchJobRepository extends JpaRepository<ResearchJob, String> {

    /**
     * Update status without touching intake fields
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ResearchJob j SET j.status = :status, j.lastRunAt = :runAt, j.updatedAt = :runAt WHERE j.id = :jobId")
    int updateStatus(@Param("jobId") String jobId,
                     @Param("status") ResearchJobStatus status,
                     @Param("runAt") LocalDateTime runAt);
}

package com.brandinsight.research.repository;

import com.brandinsight.research.entity.AiQuestionType;
import com.brandinsight.research.entity.AnalysisRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisRecordRepository extends JpaRepository<AnalysisRecord, Long> {

    Optional<AnalysisRecord> findByResearchJobIdAndQuestionType(String researchJobId, AiQuestionType questionType);

    /**
     * Answered questions in the order they were first created
     */
    List<AnalysisRecord> findByResearchJobIdAndAnsweredTrueOrderByCreatedAtAscIdAsc(String researchJobId);

    /**
     * Answered rows excluding one type, used to keep CUSTOM out of the catalog count
     */
    long countByResearchJobIdAndAnsweredTrueAndQuestionTypeNot(String researchJobId, AiQuestionType questionType);
}

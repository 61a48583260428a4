package com.brandinsight.research.store;

import com.brandinsight.research.entity.*;

import java.util.List;
import java.util.Optional;

/**
 * Persistent store behind every idempotency and resume decision.
 *
 * Injected into the engine components instead of being reached through a
 * shared static client, so tests can substitute an in-memory double.
 */
public interface ResearchStore {

    Optional<ResearchJob> findJob(String jobId);

    void updateJobStatus(String jobId, ResearchJobStatus status);

    long countRecords(String jobId, RecordType recordType);

    // --- analysis ---

    Optional<AnalysisRecord> findAnalysis(String jobId, AiQuestionType questionType);

    /**
     * Create or overwrite the single row for (job, question type).
     */
    AnalysisRecord upsertAnalysis(AnalysisRecord record);

    List<AnalysisRecord> findAnsweredAnalyses(String jobId);

    // --- discovery ---

    /**
     * Create or overwrite the row for (job, platform, handle).
     *
     * @return true if a new row was created
     */
    boolean upsertCompetitor(DiscoveredCompetitor competitor);

    List<DiscoveredCompetitor> findCompetitors(String jobId);

    // --- insert-if-absent families ---

    /**
     * @return true if inserted, false if (job, url) already existed
     */
    boolean insertInsightIfAbsent(CommunityInsight insight);

    /**
     * @return true if inserted, false if (job, url) already existed
     */
    boolean insertRawResultIfAbsent(RawSearchResult result);

    List<RawSearchResult> findRawResults(String jobId, int limit);

    /**
     * @return true if inserted, false if (job, keyword) already existed
     */
    boolean insertTrendIfAbsent(SearchTrend trend);

    // --- profiles ---

    SocialProfileSnapshot upsertProfileSnapshot(SocialProfileSnapshot snapshot);
}

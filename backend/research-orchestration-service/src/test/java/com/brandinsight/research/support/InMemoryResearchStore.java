package com.brandinsight.research.support;

import com.brandinsight.research.entity.*;
import com.brandinsight.research.store.RecordType;
import com.brandinsight.research.store.ResearchStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ResearchStore test double keeping every row in memory with the same uniqueness keys as the JPA store.
 */
public class InMemoryResearchStore implements ResearchStore {

    private final AtomicLong ids = new AtomicLong();
    private final Map<String, ResearchJob> jobs = new HashMap<>();
    private final Map<String, AnalysisRecord> analyses = new LinkedHashMap<>();
    private final Map<String, DiscoveredCompetitor> competitors = new LinkedHashMap<>();
    private final Map<String, CommunityInsight> insights = new LinkedHashMap<>();
    private final Map<String, RawSearchResult> rawResults = new LinkedHashMap<>();
    private final Map<String, SearchTrend> trends = new LinkedHashMap<>();
    private final Map<String, SocialProfileSnapshot> profiles = new LinkedHashMap<>();
    private final Set<RecordType> failingCounts = EnumSet.noneOf(RecordType.class);
    private boolean failStatusUpdates;
    private boolean failProfileUpserts;

    public InMemoryResearchStore addJob(ResearchJob job) {
        jobs.put(job.getId(), job);
        return this;
    }

    /**
     * Make countRecords throw for the given record type
     */
    public void failCountsFor(RecordType recordType) {
        failingCounts.add(recordType);
    }

    public void failStatusUpdates() {
        failStatusUpdates = true;
    }

    public void failProfileUpserts() {
        failProfileUpserts = true;
    }

    public List<CommunityInsight> insights() {
        return new ArrayList<>(insights.values());
    }

    public List<SearchTrend> trends() {
        return new ArrayList<>(trends.values());
    }

    public List<SocialProfileSnapshot> profiles() {
        return new ArrayList<>(profiles.values());
    }

    @Override
    public Optional<ResearchJob> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public void updateJobStatus(String jobId, ResearchJobStatus status) {
        if (failStatusUpdates) {
            throw new IllegalStateException("status table locked");
        }
        ResearchJob job = jobs.get(jobId);
        if (job != null) {
            job.setStatus(status);
        }
    }

    @Override
    public long countRecords(String jobId, RecordType recordType) {
        if (failingCounts.contains(recordType)) {
            throw new IllegalStateException("count failed for " + recordType);
        }
        return switch (recordType) {
            case RAW_SEARCH_RESULT -> rawResults.values().stream().filter(r -> jobId.equals(r.getResearchJobId())).count();
            case COMPETITOR -> competitors.values().stream().filter(c -> jobId.equals(c.getResearchJobId())).count();
            case ANALYSIS_ANSWER -> analyses.values().stream()
                    .filter(a -> jobId.equals(a.getResearchJobId()) && a.isAnswered()
                            && a.getQuestionType() != AiQuestionType.CUSTOM)
                    .count();
            case COMMUNITY_INSIGHT -> insights.values().stream().filter(i -> jobId.equals(i.getResearchJobId())).count();
            case SOCIAL_PROFILE -> profiles.values().stream().filter(p -> jobId.equals(p.getResearchJobId())).count();
            case SEARCH_TREND -> trends.values().stream().filter(t -> jobId.equals(t.getResearchJobId())).count();
        };
    }

    @Override
    public Optional<AnalysisRecord> findAnalysis(String jobId, AiQuestionType questionType) {
        return Optional.ofNullable(analyses.get(jobId + "|" + questionType));
    }

    @Override
    public AnalysisRecord upsertAnalysis(AnalysisRecord record) {
        String key = record.getResearchJobId() + "|" + record.getQuestionType();
        AnalysisRecord existing = analyses.get(key);
        if (existing != null) {
            existing.applyAnswer(record);
            return existing;
        }
        record.setId(ids.incrementAndGet());
        analyses.put(key, record);
        return record;
    }

    @Override
    public List<AnalysisRecord> findAnsweredAnalyses(String jobId) {
        return analyses.values().stream()
                .filter(a -> jobId.equals(a.getResearchJobId()) && a.isAnswered())
                .toList();
    }

    @Override
    public boolean upsertCompetitor(DiscoveredCompetitor competitor) {
        String key = competitor.getResearchJobId() + "|" + competitor.getPlatform() + "|" + competitor.getHandle();
        DiscoveredCompetitor existing = competitors.get(key);
        if (existing != null) {
            existing.setRelevanceScore(competitor.getRelevanceScore());
            existing.setDiscoveryReason(competitor.getDiscoveryReason());
            existing.setCompetitorType(competitor.getCompetitorType());
            existing.setDiscoveryLayer(competitor.getDiscoveryLayer());
            return false;
        }
        competitor.setId(ids.incrementAndGet());
        competitors.put(key, competitor);
        return true;
    }

    @Override
    public List<DiscoveredCompetitor> findCompetitors(String jobId) {
        return competitors.values().stream()
                .filter(c -> jobId.equals(c.getResearchJobId()))
                .sorted(Comparator.comparing(DiscoveredCompetitor::getRelevanceScore).reversed()
                        .thenComparing(DiscoveredCompetitor::getId))
                .toList();
    }

    @Override
    public boolean insertInsightIfAbsent(CommunityInsight insight) {
        return insights.putIfAbsent(insight.getResearchJobId() + "|" + insight.getUrl(), insight) == null;
    }

    @Override
    public boolean insertRawResultIfAbsent(RawSearchResult result) {
        return rawResults.putIfAbsent(result.getResearchJobId() + "|" + result.getUrl(), result) == null;
    }

    @Override
    public List<RawSearchResult> findRawResults(String jobId, int limit) {
        return rawResults.values().stream()
                .filter(r -> jobId.equals(r.getResearchJobId()))
                .limit(limit)
                .toList();
    }

    @Override
    public boolean insertTrendIfAbsent(SearchTrend trend) {
        return trends.putIfAbsent(trend.getResearchJobId() + "|" + trend.getKeyword(), trend) == null;
    }

    @Override
    public SocialProfileSnapshot upsertProfileSnapshot(SocialProfileSnapshot snapshot) {
        if (failProfileUpserts) {
            throw new IllegalStateException("profile table locked");
        }
        String key = snapshot.getResearchJobId() + "|" + snapshot.getPlatform() + "|" + snapshot.getHandle();
        SocialProfileSnapshot existing = profiles.get(key);
        if (existing != null) {
            existing.refreshFrom(snapshot);
            return existing;
        }
        profiles.put(key, snapshot);
        return snapshot;
    }
}

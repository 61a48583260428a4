package com.brandinsight.research.store;

import com.brandinsight.research.entity.*;
import com.brandinsight.research.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * ResearchStore backed by Spring Data repositories.
 *
 * Inserts check for an existing row first; the unique constraints on each
 * table catch the remaining race between two concurrent writers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaResearchStore implements ResearchStore {

    private final ResearchJobRepository researchJobRepository;
    private final DiscoveredCompetitorRepository competitorRepository;
    private final AnalysisRecordRepository analysisRecordRepository;
    private final CommunityInsightRepository communityInsightRepository;
    private final RawSearchResultRepository rawSearchResultRepository;
    private final SearchTrendRepository searchTrendRepository;
    private final SocialProfileSnapshotRepository socialProfileRepository;

    @Override
    public Optional<ResearchJob> findJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        return researchJobRepository.findById(jobId);
    }

    @Override
    @Transactional
    public void updateJobStatus(String jobId, ResearchJobStatus status) {
        int updated = researchJobRepository.updateStatus(jobId, status, LocalDateTime.now());
        if (updated == 0) {
            log.warn("Status update matched no job: jobId={}, status={}", jobId, status);
        }
    }

    @Override
    public long countRecords(String jobId, RecordType recordType) {
        return switch (recordType) {
            case RAW_SEARCH_RESULT -> rawSearchResultRepository.countByResearchJobId(jobId);
            case COMPETITOR -> competitorRepository.countByResearchJobId(jobId);
            case ANALYSIS_ANSWER -> analysisRecordRepository.countByResearchJobIdAndAnsweredTrueAndQuestionTypeNot(
                    jobId, AiQuestionType.CUSTOM);
            case COMMUNITY_INSIGHT -> communityInsightRepository.countByResearchJobId(jobId);
            case SOCIAL_PROFILE -> socialProfileRepository.countByResearchJobId(jobId);
            case SEARCH_TREND -> searchTrendRepository.countByResearchJobId(jobId);
        };
    }

    @Override
    public Optional<AnalysisRecord> findAnalysis(String jobId, AiQuestionType questionType) {
        return analysisRecordRepository.findByResearchJobIdAndQuestionType(jobId, questionType);
    }

    @Override
    public AnalysisRecord upsertAnalysis(AnalysisRecord record) {
        Optional<AnalysisRecord> existing = analysisRecordRepository
                .findByResearchJobIdAndQuestionType(record.getResearchJobId(), record.getQuestionType());
        if (existing.isPresent()) {
            AnalysisRecord row = existing.get();
            row.applyAnswer(record);
            return analysisRecordRepository.save(row);
        }

        try {
            return analysisRecordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            // Another writer created the row between our read and insert; last upsert wins
            log.debug("Concurrent insert for {}/{}, updating existing row",
                    record.getResearchJobId(), record.getQuestionType());
            AnalysisRecord row = analysisRecordRepository
                    .findByResearchJobIdAndQuestionType(record.getResearchJobId(), record.getQuestionType())
                    .orElseThrow(() -> e);
            row.applyAnswer(record);
            return analysisRecordRepository.save(row);
        }
    }

    @Override
    public List<AnalysisRecord> findAnsweredAnalyses(String jobId) {
        return analysisRecordRepository.findByResearchJobIdAndAnsweredTrueOrderByCreatedAtAscIdAsc(jobId);
    }

    @Override
    public boolean upsertCompetitor(DiscoveredCompetitor competitor) {
        Optional<DiscoveredCompetitor> existing = competitorRepository.findByResearchJobIdAndPlatformAndHandle(
                competitor.getResearchJobId(), competitor.getPlatform(), competitor.getHandle());
        if (existing.isPresent()) {
            DiscoveredCompetitor row = existing.get();
            row.setDiscoveryReason(competitor.getDiscoveryReason());
            row.setRelevanceScore(competitor.getRelevanceScore());
            row.setCompetitorType(competitor.getCompetitorType());
            row.setDiscoveryLayer(competitor.getDiscoveryLayer());
            competitorRepository.save(row);
            return false;
        }

        try {
            competitorRepository.saveAndFlush(competitor);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Competitor {}:{} already stored for job {}",
                    competitor.getPlatform(), competitor.getHandle(), competitor.getResearchJobId());
            return false;
        }
    }

    @Override
    public List<DiscoveredCompetitor> findCompetitors(String jobId) {
        return competitorRepository.findByResearchJobIdOrderByRelevanceScoreDescIdAsc(jobId);
    }

    @Override
    public boolean insertInsightIfAbsent(CommunityInsight insight) {
        if (communityInsightRepository.existsByResearchJobIdAndUrl(insight.getResearchJobId(), insight.getUrl())) {
            return false;
        }
        try {
            communityInsightRepository.saveAndFlush(insight);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Insight already stored for job {}: {}", insight.getResearchJobId(), insight.getUrl());
            return false;
        }
    }

    @Override
    public boolean insertRawResultIfAbsent(RawSearchResult result) {
        if (rawSearchResultRepository.existsByResearchJobIdAndUrl(result.getResearchJobId(), result.getUrl())) {
            return false;
        }
        try {
            rawSearchResultRepository.saveAndFlush(result);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Raw result already stored for job {}: {}", result.getResearchJobId(), result.getUrl());
            return false;
        }
    }

    @Override
    public List<RawSearchResult> findRawResults(String jobId, int limit) {
        return rawSearchResultRepository.findByResearchJobIdOrderByIdAsc(jobId, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public boolean insertTrendIfAbsent(SearchTrend trend) {
        if (searchTrendRepository.existsByResearchJobIdAndKeyword(trend.getResearchJobId(), trend.getKeyword())) {
            return false;
        }
        try {
            searchTrendRepository.saveAndFlush(trend);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Trend already stored for job {}: {}", trend.getResearchJobId(), trend.getKeyword());
            return false;
        }
    }

    @Override
    public SocialProfileSnapshot upsertProfileSnapshot(SocialProfileSnapshot snapshot) {
        Optional<SocialProfileSnapshot> existing = socialProfileRepository.findByResearchJobIdAndPlatformAndHandle(
                snapshot.getResearchJobId(), snapshot.getPlatform(), snapshot.getHandle());
        if (existing.isPresent()) {
            SocialProfileSnapshot row = existing.get();
            row.refreshFrom(snapshot);
            return socialProfileRepository.save(row);
        }
        return socialProfileRepository.save(snapshot);
    }
}

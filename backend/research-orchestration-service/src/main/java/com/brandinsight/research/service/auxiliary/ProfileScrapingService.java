package com.brandinsight.research.service.auxiliary;

import com.brandinsight.research.client.ProfileScraperClient;
import com.brandinsight.research.client.ScrapedProfile;
import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.CandidateCompetitor;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.dto.StepError;
import com.brandinsight.research.entity.SocialProfileSnapshot;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.service.quality.DataQualityScorer;
import com.brandinsight.research.service.quality.QualityDataType;
import com.brandinsight.research.service.quality.QualityScoreReport;
import com.brandinsight.research.store.ResearchStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 프로필 스크래핑: 대상 브랜드의 instagram/tiktok 프로필과 상위 경쟁사 프로필을 수집합니다.
 * 대상별 실패는 오류로 기록하고 다음 대상을 계속 처리합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileScrapingService {

    static final String STEP = "PROFILE_SCRAPING";
    static final String PERSISTENCE = "PERSISTENCE";
    private static final List<String> TARGET_PLATFORMS = List.of("instagram", "tiktok");

    private final ProfileScraperClient scraperClient;
    private final ResearchStore store;
    private final DataQualityScorer qualityScorer;
    private final ConnectorHealthTracker healthTracker;
    private final ResearchProperties properties;

    public ProfileScrapeResult scrape(ResearchContext context, List<CandidateCompetitor> rankedCompetitors) {
        Map<String, ScrapeTarget> targets = new LinkedHashMap<>();

        for (String platform : TARGET_PLATFORMS) {
            String handle = context.handleFor(platform);
            if (handle == null && "instagram".equals(platform)) {
                handle = context.cleanHandle();
            }
            if (handle != null && !handle.isBlank()) {
                ScrapeTarget target = new ScrapeTarget(platform, CandidateCompetitor.normalizeHandle(handle), true);
                targets.putIfAbsent(target.key(), target);
            }
        }

        int competitorSlots = properties.getScraping().getMaxCompetitors();
        for (CandidateCompetitor competitor : rankedCompetitors) {
            if (competitorSlots <= 0) {
                break;
            }
            if (!scraperClient.supports(competitor.platform())) {
                continue;
            }
            ScrapeTarget target = new ScrapeTarget(competitor.platform(),
                    CandidateCompetitor.normalizeHandle(competitor.handle()), false);
            if (targets.putIfAbsent(target.key(), target) == null) {
                competitorSlots--;
            }
        }

        List<ScrapedProfile> scraped = new ArrayList<>();
        List<StepError> errors = new ArrayList<>();
        for (ScrapeTarget target : targets.values()) {
            String connector = ProfileScraperClient.connectorName(target.platform());
            ScrapedProfile profile;
            try {
                profile = scraperClient.scrape(target.platform(), target.handle());
                healthTracker.markOk(connector);
            } catch (RuntimeException e) {
                healthTracker.markDegraded(connector, e.getMessage());
                errors.add(new StepError(STEP, target.key(), e.getMessage()));
                log.warn("[ProfileScraping] {} failed: {}", target.key(), e.getMessage());
                continue;
            }

            // store failures are not the scraper's fault
            try {
                store.upsertProfileSnapshot(toSnapshot(context.jobId(), profile, target.isTarget()));
                scraped.add(profile);
            } catch (RuntimeException e) {
                errors.add(new StepError(STEP, PERSISTENCE, target.key() + ": " + e.getMessage()));
                log.warn("[ProfileScraping] Could not persist {} for job {}: {}",
                        target.key(), context.jobId(), e.getMessage());
            }
        }

        QualityScoreReport quality = qualityScorer.score("profile_scraping", scraped,
                QualityDataType.PROFILE, targets.size());
        log.info("[ProfileScraping] {} of {} profiles scraped for job {} (quality {})",
                scraped.size(), targets.size(), context.jobId(), quality.score());
        return new ProfileScrapeResult(targets.size(), scraped.size(), List.copyOf(errors), quality);
    }

    private static SocialProfileSnapshot toSnapshot(String jobId, ScrapedProfile profile, boolean target) {
        return SocialProfileSnapshot.builder()
                .researchJobId(jobId)
                .platform(profile.platform())
                .handle(profile.handle())
                .followers(profile.followers())
                .following(profile.following())
                .postsCount(profile.postsCount())
                .bio(profile.bio())
                .profileUrl(profile.profileUrl())
                .target(target)
                .build();
    }

    private record ScrapeTarget(String platform, String handle, boolean isTarget) {
        String key() {
            return platform + ":" + handle;
        }
    }
}

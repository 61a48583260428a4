package com.brandinsight.research.service.auxiliary;

import com.brandinsight.research.client.ProfileScraperClient;
import com.brandinsight.research.client.ScrapedProfile;
import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.CandidateCompetitor;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.dto.StepError;
import com.brandinsight.research.entity.CompetitorType;
import com.brandinsight.research.entity.DiscoveryLayer;
import com.brandinsight.research.entity.SocialProfileSnapshot;
import com.brandinsight.research.exception.ProviderException;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.service.quality.DataQualityScorer;
import com.brandinsight.research.support.InMemoryResearchStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * ProfileScrapingService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class ProfileScrapingServiceTest {

    @Mock
    private ProfileScraperClient scraperClient;

    private InMemoryResearchStore store;
    private ConnectorHealthTracker healthTracker;
    private ProfileScrapingService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryResearchStore();
        healthTracker = new ConnectorHealthTracker();
        service = new ProfileScrapingService(scraperClient, store, new DataQualityScorer(new ObjectMapper()),
                healthTracker, new ResearchProperties());
        lenient().when(scraperClient.supports(anyString()))
                .thenAnswer(invocation -> List.of("instagram", "tiktok").contains(invocation.<String>getArgument(0)));
    }

    private static CandidateCompetitor competitor(String handle, String platform) {
        return new CandidateCompetitor(handle, platform, "test", 0.8, CompetitorType.DISCOVERED, DiscoveryLayer.KEYWORD_SEARCH);
    }

    private static ScrapedProfile profile(String platform, String handle) {
        return new ScrapedProfile(platform, handle, 1200L, 300L, 50, "bio", "https://example/" + handle);
    }

    @Test
    @DisplayName("대상 프로필과 상위 3개 경쟁사 프로필을 수집한다")
    void scrapesTargetAndTopCompetitors() {
        // given
        ResearchContext context = new ResearchContext("rj_profiles", "Acme Coffee", "@acme_coffee", "coffee",
                null, null, Map.of("tiktok", "acme.tok"), null);
        when(scraperClient.scrape(anyString(), anyString()))
                .thenAnswer(invocation -> profile(invocation.getArgument(0), invocation.getArgument(1)));
        List<CandidateCompetitor> ranked = List.of(
                competitor("brew_masters", "instagram"),
                competitor("roastrepublic", "youtube"),
                competitor("daily_grind", "tiktok"),
                competitor("bean_scene", "instagram"),
                competitor("cup_culture", "instagram"));

        // when
        ProfileScrapeResult result = service.scrape(context, ranked);

        // then
        assertThat(result.attempted()).isEqualTo(5);
        assertThat(result.scraped()).isEqualTo(5);
        assertThat(result.errors()).isEmpty();
        assertThat(store.profiles()).extracting(SocialProfileSnapshot::getHandle)
                .containsExactly("acme_coffee", "acme.tok", "brew_masters", "daily_grind", "bean_scene");
        assertThat(store.profiles()).filteredOn(SocialProfileSnapshot::isTarget).hasSize(2);
        assertThat(result.quality().reliable()).isTrue();
        verify(scraperClient, never()).scrape(eq("youtube"), anyString());
    }

    @Test
    @DisplayName("대상별 실패는 오류로 기록하고 다음 대상을 계속 처리한다")
    void failureIsPerTarget() {
        // given
        ResearchContext context = new ResearchContext("rj_profiles", null, "acme_coffee", null,
                null, null, Map.of(), null);
        when(scraperClient.scrape("instagram", "acme_coffee"))
                .thenThrow(new ProviderException("instagram_scraper", "login wall"));
        when(scraperClient.scrape("instagram", "brew_masters")).thenReturn(profile("instagram", "brew_masters"));

        // when
        ProfileScrapeResult result = service.scrape(context, List.of(competitor("brew_masters", "instagram")));

        // then
        assertThat(result.scraped()).isEqualTo(1);
        assertThat(result.errors()).extracting(StepError::source).containsExactly("instagram:acme_coffee");
        assertThat(healthTracker.degradedNames()).isEmpty();
        assertThat(result.quality().warnings()).contains("Expected 2 items, got 1");
    }

    @Test
    @DisplayName("저장 실패는 PERSISTENCE 오류로 기록하고 스크래퍼를 저하 상태로 표시하지 않는다")
    void persistenceFailureIsNotScraperFailure() {
        // given
        ResearchContext context = new ResearchContext("rj_profiles", null, "acme_coffee", null,
                null, null, Map.of(), null);
        when(scraperClient.scrape("instagram", "acme_coffee")).thenReturn(profile("instagram", "acme_coffee"));
        store.failProfileUpserts();

        // when
        ProfileScrapeResult result = service.scrape(context, List.of());

        // then
        assertThat(result.attempted()).isEqualTo(1);
        assertThat(result.scraped()).isZero();
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.step()).isEqualTo("PROFILE_SCRAPING");
            assertThat(error.source()).isEqualTo("PERSISTENCE");
            assertThat(error.message()).startsWith("instagram:acme_coffee: ").contains("profile table locked");
        });
        assertThat(healthTracker.degradedNames()).isEmpty();
        assertThat(healthTracker.snapshot()).extracting(snapshot -> snapshot.name())
                .containsExactly(ProfileScraperClient.connectorName("instagram"));
    }
}

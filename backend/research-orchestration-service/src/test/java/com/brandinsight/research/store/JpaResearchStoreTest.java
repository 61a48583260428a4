package com.brandinsight.research.store;

import com.brandinsight.research.entity.*;
import com.brandinsight.research.repository.ResearchJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JpaResearchStore 통합 테스트 (H2 인메모리 DB)
 */
@DataJpaTest
@Import(JpaResearchStore.class)
@ActiveProfiles("test")
class JpaResearchStoreTest {

    private static final String JOB_ID = "rj_store_test";

    @Autowired
    private JpaResearchStore store;

    @Autowired
    private ResearchJobRepository jobRepository;

    @BeforeEach
    void setUp() {
        jobRepository.save(ResearchJob.builder()
                .id(JOB_ID)
                .brandName("Acme Coffee")
                .handle("acme_coffee")
                .handles(new HashMap<>(Map.of("instagram", "acme_coffee")))
                .build());
    }

    private static AnalysisRecord answer(AiQuestionType type, String text) {
        return AnalysisRecord.builder()
                .researchJobId(JOB_ID)
                .questionType(type)
                .question("q")
                .answer(text)
                .answered(true)
                .answeredAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("작업 조회와 상태 갱신")
    void findAndUpdateJob() {
        // when
        store.updateJobStatus(JOB_ID, ResearchJobStatus.RUNNING);

        // then
        ResearchJob job = store.findJob(JOB_ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(ResearchJobStatus.RUNNING);
        assertThat(job.getLastRunAt()).isNotNull();
        assertThat(job.getHandles()).containsEntry("instagram", "acme_coffee");
        assertThat(store.findJob("missing")).isEmpty();
        assertThat(store.findJob(" ")).isEmpty();
    }

    @Test
    @DisplayName("분석 답변은 (작업, 유형)당 한 행만 유지된다")
    void upsertAnalysisKeepsOneRow() {
        // given
        AnalysisRecord first = store.upsertAnalysis(answer(AiQuestionType.BRAND_VOICE, "v1"));

        // when
        AnalysisRecord second = store.upsertAnalysis(answer(AiQuestionType.BRAND_VOICE, "v2"));

        // then
        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(store.findAnalysis(JOB_ID, AiQuestionType.BRAND_VOICE).orElseThrow().getAnswer()).isEqualTo("v2");
        assertThat(store.countRecords(JOB_ID, RecordType.ANALYSIS_ANSWER)).isEqualTo(1);
    }

    @Test
    @DisplayName("답변되지 않은 행은 체크포인트 수에 포함되지 않는다")
    void unansweredNotCounted() {
        // given
        AnalysisRecord pending = answer(AiQuestionType.PAIN_POINTS, null);
        pending.setAnswered(false);
        store.upsertAnalysis(pending);
        store.upsertAnalysis(answer(AiQuestionType.GROWTH_STRATEGY, "grow"));

        // then
        assertThat(store.countRecords(JOB_ID, RecordType.ANALYSIS_ANSWER)).isEqualTo(1);
        assertThat(store.findAnsweredAnalyses(JOB_ID)).extracting(AnalysisRecord::getQuestionType)
                .containsExactly(AiQuestionType.GROWTH_STRATEGY);
    }

    @Test
    @DisplayName("CUSTOM 답변은 분석 체크포인트 수에 포함되지 않는다")
    void customAnswerNotCounted() {
        // given
        store.upsertAnalysis(answer(AiQuestionType.CUSTOM, "custom"));
        store.upsertAnalysis(answer(AiQuestionType.BRAND_VOICE, "voice"));

        // then
        assertThat(store.countRecords(JOB_ID, RecordType.ANALYSIS_ANSWER)).isEqualTo(1);
        assertThat(store.findAnsweredAnalyses(JOB_ID)).extracting(AnalysisRecord::getQuestionType)
                .containsExactly(AiQuestionType.CUSTOM, AiQuestionType.BRAND_VOICE);
    }

    @Test
    @DisplayName("경쟁사는 (플랫폼, 핸들)로 갱신되고 점수 내림차순으로 조회된다")
    void upsertCompetitors() {
        // given
        store.upsertCompetitor(competitor("brew_masters", 0.6));
        store.upsertCompetitor(competitor("daily_grind", 0.8));

        // when
        boolean created = store.upsertCompetitor(competitor("brew_masters", 0.9));

        // then
        assertThat(created).isFalse();
        List<DiscoveredCompetitor> competitors = store.findCompetitors(JOB_ID);
        assertThat(competitors).extracting(DiscoveredCompetitor::getHandle).containsExactly("brew_masters", "daily_grind");
        assertThat(competitors.get(0).getRelevanceScore()).isEqualTo(0.9);
        assertThat(store.countRecords(JOB_ID, RecordType.COMPETITOR)).isEqualTo(2);
    }

    @Test
    @DisplayName("insert-if-absent 계열은 같은 키를 두 번 저장하지 않는다")
    void insertIfAbsent() {
        // given
        CommunityInsight insight = CommunityInsight.builder()
                .researchJobId(JOB_ID).source(CommunitySource.REDDIT)
                .url("https://www.reddit.com/r/coffee/1").title("t").build();
        CommunityInsight again = CommunityInsight.builder()
                .researchJobId(JOB_ID).source(CommunitySource.REDDIT)
                .url("https://www.reddit.com/r/coffee/1").title("t2").build();
        SearchTrend trend = SearchTrend.builder().researchJobId(JOB_ID).keyword("coffee").averageInterest(50.0).peakInterest(80).build();
        SearchTrend trendAgain = SearchTrend.builder().researchJobId(JOB_ID).keyword("coffee").averageInterest(10.0).peakInterest(10).build();
        RawSearchResult raw = RawSearchResult.builder().researchJobId(JOB_ID).query("q").url("https://acme.example").source("brand_context").build();

        // then
        assertThat(store.insertInsightIfAbsent(insight)).isTrue();
        assertThat(store.insertInsightIfAbsent(again)).isFalse();
        assertThat(store.insertTrendIfAbsent(trend)).isTrue();
        assertThat(store.insertTrendIfAbsent(trendAgain)).isFalse();
        assertThat(store.insertRawResultIfAbsent(raw)).isTrue();
        assertThat(store.countRecords(JOB_ID, RecordType.COMMUNITY_INSIGHT)).isEqualTo(1);
        assertThat(store.countRecords(JOB_ID, RecordType.SEARCH_TREND)).isEqualTo(1);
        assertThat(store.findRawResults(JOB_ID, 5)).hasSize(1);
    }

    @Test
    @DisplayName("프로필 스냅샷은 (플랫폼, 핸들)당 하나로 갱신된다")
    void upsertProfileSnapshot() {
        // given
        store.upsertProfileSnapshot(snapshot(1000L));

        // when
        store.upsertProfileSnapshot(snapshot(1500L));

        // then
        assertThat(store.countRecords(JOB_ID, RecordType.SOCIAL_PROFILE)).isEqualTo(1);
    }

    private static DiscoveredCompetitor competitor(String handle, double score) {
        return DiscoveredCompetitor.builder()
                .researchJobId(JOB_ID)
                .platform("instagram")
                .handle(handle)
                .relevanceScore(score)
                .competitorType(CompetitorType.DISCOVERED)
                .discoveryLayer(DiscoveryLayer.KEYWORD_SEARCH)
                .build();
    }

    private static SocialProfileSnapshot snapshot(long followers) {
        return SocialProfileSnapshot.builder()
                .researchJobId(JOB_ID)
                .platform("instagram")
                .handle("acme_coffee")
                .followers(followers)
                .target(true)
                .build();
    }
}

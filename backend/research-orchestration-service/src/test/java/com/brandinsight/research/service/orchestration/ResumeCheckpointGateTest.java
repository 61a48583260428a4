package com.brandinsight.research.service.orchestration;

import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.store.RecordType;
import com.brandinsight.research.store.ResearchStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * ResumeCheckpointGate 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class ResumeCheckpointGateTest {

    private static final String JOB_ID = "rj_resume";

    @Mock
    private ResearchStore store;

    private ResearchProperties properties;
    private ExecutorService executor;
    private ResumeCheckpointGate gate;

    @BeforeEach
    void setUp() {
        properties = new ResearchProperties();
        executor = Executors.newFixedThreadPool(3);
        gate = new ResumeCheckpointGate(store, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("임계값 이상 저장된 단계만 완료로 판정한다")
    void doneWhenCountReachesThreshold() {
        // given
        properties.getCheckpoint().setDiscovery(3);
        when(store.countRecords(JOB_ID, RecordType.COMPETITOR)).thenReturn(10L);
        when(store.countRecords(JOB_ID, RecordType.ANALYSIS_ANSWER)).thenReturn(9L);
        when(store.countRecords(JOB_ID, RecordType.COMMUNITY_INSIGHT)).thenReturn(1L);

        // when
        CheckpointSnapshot snapshot = gate.evaluate(JOB_ID);

        // then
        assertThat(snapshot.isDone(ResearchStep.DISCOVERY)).isTrue();
        assertThat(snapshot.isDone(ResearchStep.ANALYSIS)).isFalse();
        assertThat(snapshot.isDone(ResearchStep.COMMUNITY)).isTrue();
        assertThat(snapshot.isDone(ResearchStep.BRAND_CONTEXT)).isFalse();
        assertThat(snapshot.countOf(ResearchStep.DISCOVERY)).isEqualTo(10L);
        assertThat(snapshot.thresholds().get(ResearchStep.ANALYSIS)).isEqualTo(10);
    }

    @Test
    @DisplayName("모든 단계의 레코드 수를 한 번씩 조회한다")
    void countsEveryStepOnce() {
        // when
        gate.evaluate(JOB_ID);

        // then
        for (RecordType type : RecordType.values()) {
            verify(store, times(1)).countRecords(JOB_ID, type);
        }
    }

    @Test
    @DisplayName("조회 실패한 단계는 미완료로 취급하고 나머지 판정은 유지한다")
    void failedCountIsNotDone() {
        // given
        when(store.countRecords(eq(JOB_ID), eq(RecordType.COMPETITOR)))
                .thenThrow(new IllegalStateException("connection reset"));
        when(store.countRecords(JOB_ID, RecordType.SEARCH_TREND)).thenReturn(4L);

        // when
        CheckpointSnapshot snapshot = gate.evaluate(JOB_ID);

        // then
        assertThat(snapshot.isDone(ResearchStep.DISCOVERY)).isFalse();
        assertThat(snapshot.countOf(ResearchStep.DISCOVERY)).isEqualTo(-1L);
        assertThat(snapshot.isDone(ResearchStep.SEARCH_TRENDS)).isTrue();
    }

    @Test
    @DisplayName("단계별 건너뛰기 태그 형식")
    void skipTagFormat() {
        assertThat(ResearchStep.DISCOVERY.skipTag()).isEqualTo("DISCOVERY_SKIPPED_RESUME");
        assertThat(ResearchStep.PROFILE_SCRAPING.skipTag()).isEqualTo("PROFILE_SCRAPING_SKIPPED_RESUME");
    }
}

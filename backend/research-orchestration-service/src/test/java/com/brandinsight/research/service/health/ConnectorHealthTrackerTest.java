package com.brandinsight.research.service.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ConnectorHealthTracker 단위 테스트
 */
class ConnectorHealthTrackerTest {

    private ConnectorHealthTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ConnectorHealthTracker();
    }

    @Test
    @DisplayName("마지막 기록이 우선한다")
    void lastWriteWins() {
        // given
        tracker.markDegraded("duckduckgo_search", "timeout");

        // when
        tracker.markOk("duckduckgo_search");

        // then
        List<ConnectorSnapshot> snapshot = tracker.snapshot();
        assertThat(snapshot).hasSize(1);
        assertThat(snapshot.get(0).status()).isEqualTo(ConnectorStatus.OK);
        assertThat(snapshot.get(0).reason()).isNull();
        assertThat(tracker.degradedNames()).isEmpty();
    }

    @Test
    @DisplayName("저하된 커넥터는 사유와 함께 이름순으로 보고된다")
    void degradedConnectorsSortedByName() {
        // given
        tracker.markDegraded("text_generation", "HTTP 500");
        tracker.markOk("duckduckgo_search");
        tracker.markDegraded("browser_agent", "connection refused");

        // when
        List<String> degraded = tracker.degradedNames();
        List<ConnectorSnapshot> snapshot = tracker.snapshot();

        // then
        assertThat(degraded).containsExactly("browser_agent", "text_generation");
        assertThat(snapshot).extracting(ConnectorSnapshot::name)
                .containsExactly("browser_agent", "duckduckgo_search", "text_generation");
        assertThat(snapshot.get(0).reason()).isEqualTo("connection refused");
        assertThat(snapshot.get(0).occurredAt()).isNotNull();
    }

    @Test
    @DisplayName("기록이 없는 커넥터는 스냅샷에 나타나지 않는다")
    void unknownConnectorsAbsent() {
        assertThat(tracker.snapshot()).isEmpty();
        assertThat(tracker.degradedNames()).isEmpty();
    }
}

package com.brandinsight.research.controller;

import com.brandinsight.research.dto.RunResult;
import com.brandinsight.research.dto.RunStatus;
import com.brandinsight.research.exception.ResearchJobNotFoundException;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.service.health.ConnectorSnapshot;
import com.brandinsight.research.service.health.ConnectorStatus;
import com.brandinsight.research.service.orchestration.ResearchOrchestrationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ResearchOrchestrationController 단위 테스트
 */
@WebFluxTest(ResearchOrchestrationController.class)
@ActiveProfiles("test")
class ResearchOrchestrationControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ResearchOrchestrationService orchestrationService;

    @MockBean
    private ConnectorHealthTracker healthTracker;

    @Autowired
    private ResearchOrchestrationController controller;

    @Test
    @DisplayName("POST /api/v1/research-jobs/{jobId}/orchestrate - 실행 결과 반환")
    void orchestrate() {
        // given
        RunResult result = RunResult.builder()
                .jobId("rj_1")
                .status(RunStatus.PARTIAL)
                .layersUsed(List.of("DISCOVERY_SKIPPED_RESUME"))
                .build();
        when(orchestrationService.orchestrate("rj_1")).thenReturn(result);

        // when / then
        webTestClient.post()
                .uri("/api/v1/research-jobs/rj_1/orchestrate")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("rj_1")
                .jsonPath("$.status").isEqualTo("PARTIAL")
                .jsonPath("$.layersUsed[0]").isEqualTo("DISCOVERY_SKIPPED_RESUME")
                .jsonPath("$.errors").isEmpty();
    }

    @Test
    @DisplayName("POST /api/v1/research-jobs/{jobId}/orchestrate - 없는 작업은 404")
    void orchestrateUnknownJob() {
        // given
        when(orchestrationService.orchestrate("rj_missing")).thenThrow(new ResearchJobNotFoundException("rj_missing"));

        // when / then
        webTestClient.post()
                .uri("/api/v1/research-jobs/rj_missing/orchestrate")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("JOB_NOT_FOUND")
                .jsonPath("$.jobId").isEqualTo("rj_missing");
    }

    @Test
    @DisplayName("GET /api/v1/connectors/health - 커넥터 상태 스냅샷")
    void connectorHealth() {
        // given
        when(healthTracker.snapshot()).thenReturn(List.of(
                new ConnectorSnapshot("browser_agent", ConnectorStatus.DEGRADED, "connection refused", LocalDateTime.now()),
                new ConnectorSnapshot("duckduckgo_search", ConnectorStatus.OK, null, LocalDateTime.now())));

        // when / then
        webTestClient.get()
                .uri("/api/v1/connectors/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].name").isEqualTo("browser_agent")
                .jsonPath("$[0].status").isEqualTo("DEGRADED")
                .jsonPath("$[1].status").isEqualTo("OK");
    }

    @Test
    @DisplayName("orchestrate Mono 는 구독 전까지 실행되지 않고 단일 결과를 낸다")
    void orchestrateIsLazy() {
        // given
        RunResult result = RunResult.builder().jobId("rj_2").status(RunStatus.COMPLETE).build();
        when(orchestrationService.orchestrate("rj_2")).thenReturn(result);

        // when
        Mono<ResponseEntity<RunResult>> response = controller.orchestrate("rj_2");

        // then
        verifyNoInteractions(orchestrationService);
        StepVerifier.create(response)
                .assertNext(entity -> {
                    assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(entity.getBody()).isSameAs(result);
                })
                .verifyComplete();
        verify(orchestrationService).orchestrate("rj_2");
    }

    @Test
    @DisplayName("orchestrate Mono 는 없는 작업 예외를 에러 신호로 전달한다")
    void orchestrateSignalsMissingJob() {
        // given
        when(orchestrationService.orchestrate("rj_gone")).thenThrow(new ResearchJobNotFoundException("rj_gone"));

        // when / then
        StepVerifier.create(controller.orchestrate("rj_gone"))
                .expectError(ResearchJobNotFoundException.class)
                .verify();
    }
}

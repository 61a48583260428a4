package com.brandinsight.research.controller;

import com.brandinsight.research.dto.RunResult;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.service.health.ConnectorSnapshot;
import com.brandinsight.research.service.orchestration.ResearchOrchestrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * 리서치 오케스트레이션 API
 *
 * - POST /api/v1/research-jobs/{jobId}/orchestrate : 작업 실행 (이미 완료된 단계는 건너뜀)
 * - GET  /api/v1/connectors/health                 : 커넥터 상태 스냅샷
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class ResearchOrchestrationController {

    private final ResearchOrchestrationService orchestrationService;
    private final ConnectorHealthTracker healthTracker;

    /**
     * Run the research pipeline for a job.
     * The run blocks on provider calls, so it is moved off the event loop.
     *
     * @param jobId research job ID
     * @return run result; 404 when the job does not exist
     */
    @PostMapping("/research-jobs/{jobId}/orchestrate")
    public Mono<ResponseEntity<RunResult>> orchestrate(@PathVariable String jobId) {
        log.info("Orchestration requested for job {}", jobId);
        return Mono.fromCallable(() -> orchestrationService.orchestrate(jobId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/connectors/health")
    public ResponseEntity<List<ConnectorSnapshot>> connectorHealth() {
        return ResponseEntity.ok(healthTracker.snapshot());
    }
}

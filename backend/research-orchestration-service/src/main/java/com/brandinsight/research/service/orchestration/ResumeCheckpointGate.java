package com.brandinsight.research.service.orchestration;

import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.store.ResearchStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 재개 체크포인트.
 *
 * 단계별 저장 레코드 수를 한 번에 병렬 조회하고, 모든 조회가 끝난 뒤
 * 임계값 이상인 단계를 완료로 판정합니다. 조회 실패는 "미완료"로 취급합니다.
 */
@Component
@Slf4j
public class ResumeCheckpointGate {

    private final ResearchStore store;
    private final ResearchProperties properties;
    private final Executor checkpointExecutor;

    public ResumeCheckpointGate(ResearchStore store,
                                ResearchProperties properties,
                                @Qualifier("checkpointExecutor") Executor checkpointExecutor) {
        this.store = store;
        this.properties = properties;
        this.checkpointExecutor = checkpointExecutor;
    }

    public CheckpointSnapshot evaluate(String jobId) {
        Map<ResearchStep, CompletableFuture<Long>> pending = new EnumMap<>(ResearchStep.class);
        for (ResearchStep step : ResearchStep.values()) {
            pending.put(step, CompletableFuture.supplyAsync(
                    () -> store.countRecords(jobId, step.getRecordType()), checkpointExecutor));
        }

        // fan-in: every count resolves before any decision
        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
                .exceptionally(ex -> null)
                .join();

        Map<ResearchStep, Long> counts = new EnumMap<>(ResearchStep.class);
        Map<ResearchStep, Integer> thresholds = new EnumMap<>(ResearchStep.class);
        Set<ResearchStep> done = EnumSet.noneOf(ResearchStep.class);

        for (Map.Entry<ResearchStep, CompletableFuture<Long>> entry : pending.entrySet()) {
            ResearchStep step = entry.getKey();
            int threshold = step.threshold(properties.getCheckpoint());
            thresholds.put(step, threshold);

            long count;
            try {
                count = entry.getValue().join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("[Checkpoint] Count failed for {} (job {}), treating as not done: {}",
                        step, jobId, cause.getMessage());
                count = -1L;
            }
            counts.put(step, count);
            if (count >= 0 && count >= threshold) {
                done.add(step);
            }
        }

        log.info("[Checkpoint] job {}: counts={}, done={}", jobId, counts, done);
        return new CheckpointSnapshot(
                Collections.unmodifiableMap(counts),
                Collections.unmodifiableMap(thresholds),
                Collections.unmodifiableSet(done));
    }
}

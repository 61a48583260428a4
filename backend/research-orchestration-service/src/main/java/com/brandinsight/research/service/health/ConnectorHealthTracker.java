package com.brandinsight.research.service.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 외부 커넥터별 마지막 상태 기록.
 *
 * 커넥터 이름당 하나의 스냅샷만 유지하며 마지막 기록이 우선합니다.
 * 프로세스 메모리에만 존재하고 재시작 시 초기화됩니다. 차단(circuit breaking)은 하지 않습니다.
 */
@Component
@Slf4j
public class ConnectorHealthTracker {

    private final Map<String, ConnectorSnapshot> snapshots = new ConcurrentHashMap<>();

    public void markOk(String name) {
        if (name == null) {
            return;
        }
        ConnectorSnapshot previous = snapshots.put(name,
                new ConnectorSnapshot(name, ConnectorStatus.OK, null, LocalDateTime.now()));
        if (previous != null && previous.isDegraded()) {
            log.info("[ConnectorHealth] {} recovered", name);
        }
    }

    public void markDegraded(String name, String reason) {
        if (name == null) {
            return;
        }
        snapshots.put(name, new ConnectorSnapshot(name, ConnectorStatus.DEGRADED, reason, LocalDateTime.now()));
        log.warn("[ConnectorHealth] {} degraded: {}", name, reason);
    }

    /**
     * @return all known connectors sorted by name
     */
    public List<ConnectorSnapshot> snapshot() {
        return snapshots.values().stream()
                .sorted(Comparator.comparing(ConnectorSnapshot::name))
                .toList();
    }

    public List<String> degradedNames() {
        return snapshots.values().stream()
                .filter(ConnectorSnapshot::isDegraded)
                .map(ConnectorSnapshot::name)
                .sorted()
                .toList();
    }
}

package com.brandinsight.research.service.health;

import java.time.LocalDateTime;

/**
 * Last known state of one connector. reason is null for OK.
 */
public record ConnectorSnapshot(
        String name,
        ConnectorStatus status,
        String reason,
        LocalDateTime occurredAt
) {
    public boolean isDegraded() {
        return status == ConnectorStatus.DEGRADED;
    }
}

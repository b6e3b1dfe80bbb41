package com.debtchecker.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialised copy of a run's progress. Enough to resume without re-querying
 * identifiers that already have an outcome.
 */
public record CheckpointSnapshot(
        String runId,
        Instant createdAt,
        int total,
        Map<String, LookupOutcome> completed,
        List<String> remaining,
        boolean partial
) {

    public CheckpointSnapshot {
        completed = completed == null ? Map.of() : new LinkedHashMap<>(completed);
        remaining = remaining == null ? List.of() : List.copyOf(remaining);
    }
}

package com.newsdesk.curation.admin;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory view of background runs so callers can poll them. Only the most recent
 * {@value #MAX_RUNS} runs are kept.
 */
@Component
public class RunRegistry {
    static final int MAX_RUNS = 200;

    public static class RunInfo {
        public String runId;
        public String type; // full_update
        public long userId;
        public String status; // running|completed|completed_with_errors|failed
        public int processed;
        public Instant startedAt;
        public Instant updatedAt;
        public Instant endedAt;
        public String message;
        public String resultPath;
        public Object result;
    }

    private final Map<String, RunInfo> runs = new ConcurrentHashMap<>();

    public void put(RunInfo info) {
        if (info != null && info.runId != null) {
            info.updatedAt = Instant.now();
            runs.put(info.runId, info);
            evict();
        }
    }

    public RunInfo get(String runId) {
        return runId == null ? null : runs.get(runId);
    }

    public RunInfo latestOfType(String type) {
        return runs.values().stream()
                .filter(r -> type == null || type.equals(r.type))
                .max(Comparator.comparing(r -> r.startedAt != null ? r.startedAt : r.updatedAt))
                .orElse(null);
    }

    private void evict() {
        int excess = runs.size() - MAX_RUNS;
        if (excess <= 0) return;
        runs.values().stream()
                .filter(r -> r.endedAt != null)
                .sorted(Comparator.comparing(r -> r.endedAt))
                .limit(excess)
                .map(r -> r.runId)
                .toList()
                .forEach(runs::remove);
    }
}

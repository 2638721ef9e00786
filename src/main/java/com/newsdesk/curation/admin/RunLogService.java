package com.newsdesk.curation.admin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run progress lines, streamed to admin clients over SSE. Late subscribers get the last
 * {@value #REPLAY_LINES} lines replayed.
 */
@Service
public class RunLogService {
    private static final Logger log = LoggerFactory.getLogger(RunLogService.class);
    static final int REPLAY_LINES = 500;

    private final Map<String, Sinks.Many<String>> runIdToSink = new ConcurrentHashMap<>();

    public void append(String runId, String line) {
        if (runId == null) return;
        sink(runId).tryEmitNext(line);
    }

    /** Completes the stream for a run; subscribers still get the replay. */
    public void complete(String runId) {
        if (runId == null) return;
        sink(runId).tryEmitComplete();
    }

    public Flux<ServerSentEvent<String>> stream(String runId) {
        Flux<String> lines = sink(runId).asFlux();
        Flux<String> heartbeat = Flux.interval(Duration.ofSeconds(10)).map(i -> "").takeUntilOther(lines.ignoreElements());
        return Flux.merge(lines, heartbeat)
                .map(s -> ServerSentEvent.builder(s).build())
                .doOnCancel(() -> log.debug("SSE client disconnected for runId={}", runId));
    }

    private Sinks.Many<String> sink(String runId) {
        return runIdToSink.computeIfAbsent(runId, k -> Sinks.many().replay().limit(REPLAY_LINES));
    }
}

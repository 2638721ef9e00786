package com.newsdesk.curation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdesk.curation.admin.RunLogService;
import com.newsdesk.curation.admin.RunRegistry;
import com.newsdesk.curation.config.AppProperties;
import com.newsdesk.curation.dto.ActionDtos;
import com.newsdesk.curation.service.enrichment.LlmProcessor;
import com.newsdesk.curation.util.TokenAccounting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the whole pipeline for one user: fetch, archive and clean up, LLM processing, embedding backfill,
 * duplicate detection, newspaper regeneration.
 *
 * <p>A failing stage is recorded in the report and the later stages still run; nothing already committed
 * is rolled back. A second trigger for a user whose update is still running joins that run instead of
 * starting another one.
 */
@Service
public class FullUpdateService {
    private static final Logger log = LoggerFactory.getLogger(FullUpdateService.class);
    public static final String RUN_TYPE = "full_update";

    /** A started (or joined) full update. {@code result} is cached, so every subscriber sees the same report. */
    public record RunHandle(String runId, boolean joined, Mono<ActionDtos.FullUpdateReport> result) {}

    private final ArticleIngestService ingest;
    private final ArticleCleanupService cleanup;
    private final LlmProcessor processor;
    private final DuplicateDetector detector;
    private final NewspaperGenerator generator;
    private final RunRegistry runRegistry;
    private final RunLogService runLogs;
    private final AppProperties props;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<Long, RunHandle> inFlight = new ConcurrentHashMap<>();

    public FullUpdateService(ArticleIngestService ingest, ArticleCleanupService cleanup, LlmProcessor processor,
                             DuplicateDetector detector, NewspaperGenerator generator, RunRegistry runRegistry,
                             RunLogService runLogs, AppProperties props, ObjectMapper objectMapper, Clock clock) {
        this.ingest = ingest;
        this.cleanup = cleanup;
        this.processor = processor;
        this.detector = detector;
        this.generator = generator;
        this.runRegistry = runRegistry;
        this.runLogs = runLogs;
        this.props = props;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Starts a full update in the background, or joins the one already running for this user.
     */
    public RunHandle start(long userId) {
        AtomicBoolean created = new AtomicBoolean();
        RunHandle handle = inFlight.computeIfAbsent(userId, id -> {
            created.set(true);
            return newRun(id);
        });
        if (!created.get()) {
            log.info("Full update for user {} already running as {}; joining", userId, handle.runId());
            return new RunHandle(handle.runId(), true, handle.result());
        }
        handle.result().subscribe(
                r -> log.info("Full update {} finished with status {}", r.getRun_id(), r.getStatus()),
                e -> log.error("Full update {} crashed: {}", handle.runId(), e.toString()));
        return handle;
    }

    boolean isRunning(long userId) {
        return inFlight.containsKey(userId);
    }

    private RunHandle newRun(long userId) {
        String runId = UUID.randomUUID().toString();
        RunRegistry.RunInfo info = new RunRegistry.RunInfo();
        info.runId = runId;
        info.type = RUN_TYPE;
        info.userId = userId;
        info.status = "running";
        info.startedAt = clock.instant();
        runRegistry.put(info);

        ActionDtos.FullUpdateReport report = new ActionDtos.FullUpdateReport();
        report.setRun_id(runId);
        report.setUser_id(userId);
        report.setStarted_at(info.startedAt.toString());
        TokenAccounting accounting = new TokenAccounting();
        AtomicBoolean fatal = new AtomicBoolean();

        Mono<ActionDtos.FullUpdateReport> result = stages(userId, runId, report, accounting, fatal)
                .timeout(props.getFullUpdateTimeout())
                .onErrorResume(TimeoutException.class, e -> {
                    fatal.set(true);
                    recordError(runId, report, "timeout", "full update exceeded " + props.getFullUpdateTimeout());
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    fatal.set(true);
                    recordError(runId, report, "run", e.toString());
                    return Mono.empty();
                })
                .then(Mono.fromSupplier(() -> finish(info, report, accounting, fatal.get())))
                .doOnSubscribe(s -> runLogs.append(runId, "Full update started for user " + userId))
                .doOnTerminate(() -> {
                    inFlight.computeIfPresent(userId, (k, v) -> v.runId().equals(runId) ? null : v);
                    runLogs.complete(runId);
                })
                .cache();
        return new RunHandle(runId, false, result);
    }

    private Mono<Void> stages(long userId, String runId, ActionDtos.FullUpdateReport report,
                              TokenAccounting accounting, AtomicBoolean fatal) {
        Mono<Void> fetch = Mono.defer(() -> ingest.ingestNew(userId))
                .doOnNext(n -> {
                    report.setNew_articles(n);
                    runLogs.append(runId, "Fetched " + n + " new articles");
                })
                .then()
                .onErrorResume(e -> stageFailed(runId, report, "fetch", e));

        Mono<Void> clean = Mono.defer(() -> cleanup.archiveAndCleanup(userId))
                .doOnNext(r -> {
                    report.setArchived_articles((int) r.archived());
                    report.setDeleted_articles((int) r.deleted());
                    runLogs.append(runId, "Archived " + r.archived() + ", deleted " + r.deleted());
                })
                .then()
                .onErrorResume(e -> stageFailed(runId, report, "cleanup", e));

        Mono<Void> process = Mono.defer(() -> processor.processPending(userId, accounting))
                .doOnNext(r -> {
                    report.setProcessed_articles(r.getProcessed());
                    report.setMalformed_articles(r.getMalformed());
                    report.setFailed_articles(r.getFailed());
                    runLogs.append(runId, "Processed " + r.getProcessed() + ", malformed " + r.getMalformed()
                            + ", failed " + r.getFailed());
                    if (r.isAborted()) {
                        fatal.set(true);
                        recordError(runId, report, "process", "aborted: " + r.getFatal_error());
                    }
                })
                .then()
                .onErrorResume(e -> stageFailed(runId, report, "process", e));

        // No point hitting the provider again after it refused us.
        Mono<Void> backfill = Mono.defer(() -> fatal.get()
                ? Mono.<Void>empty()
                : processor.backfillEmbeddings(userId, accounting)
                        .doOnNext(n -> {
                            report.setEmbeddings_backfilled(n);
                            if (n > 0) runLogs.append(runId, "Backfilled " + n + " embeddings");
                        })
                        .then()
                        .onErrorResume(e -> stageFailed(runId, report, "backfill", e)));

        Mono<Void> dedupe = Mono.defer(() -> detector.detect(userId))
                .doOnNext(r -> {
                    report.setDuplicates_marked(r.getDuplicates_marked());
                    runLogs.append(runId, "Checked " + r.getChecked() + " for duplicates, marked " + r.getDuplicates_marked());
                })
                .then()
                .onErrorResume(e -> stageFailed(runId, report, "dedupe", e));

        Mono<Void> regenerate = Mono.defer(() -> generator.regenerate(userId, generator.today()))
                .doOnNext(r -> {
                    report.setToday_count(r.getToday_count());
                    report.setCategory_count(r.getCategory_count());
                    runLogs.append(runId, "Newspaper: today=" + r.getToday_count() + " categories=" + r.getCategory_count());
                })
                .then()
                .onErrorResume(e -> stageFailed(runId, report, "regenerate", e));

        return fetch.then(clean).then(process).then(backfill).then(dedupe).then(regenerate);
    }

    private Mono<Void> stageFailed(String runId, ActionDtos.FullUpdateReport report, String stage, Throwable e) {
        log.warn("Full update {} stage {} failed: {}", runId, stage, e.toString());
        recordError(runId, report, stage, e.getMessage() != null ? e.getMessage() : e.toString());
        return Mono.empty();
    }

    private void recordError(String runId, ActionDtos.FullUpdateReport report, String stage, String message) {
        String line = stage + ": " + message;
        synchronized (report) {
            report.getErrors().add(line);
        }
        runLogs.append(runId, "ERROR " + line);
    }

    private ActionDtos.FullUpdateReport finish(RunRegistry.RunInfo info, ActionDtos.FullUpdateReport report,
                                               TokenAccounting accounting, boolean fatal) {
        Instant ended = clock.instant();
        report.setEnded_at(ended.toString());
        report.setAi_usage_per_model(accounting.toReport());
        report.setAi_cost_total_usd(TokenAccounting.totalCostUsd(accounting.snapshotWithCosts()));
        if (fatal) {
            report.setStatus("failed");
        } else if (!report.getErrors().isEmpty()) {
            report.setStatus("completed_with_errors");
        } else {
            report.setStatus("completed");
        }

        info.status = report.getStatus();
        info.processed = report.getProcessed_articles();
        info.endedAt = ended;
        info.result = report;
        if (!report.getErrors().isEmpty()) {
            info.message = String.join("; ", report.getErrors());
        }
        try {
            info.resultPath = persistRunResult(info.runId, report);
        } catch (Exception ex) {
            info.message = (info.message == null ? "" : info.message + "; ") + ("persist failed: " + ex);
        }
        runRegistry.put(info);

        long took = Duration.between(Instant.parse(report.getStarted_at()), ended).toMillis();
        log.info("Full update {} for user {}: status={} new={} processed={} duplicates={} today={} in {} ms",
                info.runId, report.getUser_id(), report.getStatus(), report.getNew_articles(),
                report.getProcessed_articles(), report.getDuplicates_marked(), report.getToday_count(), took);
        runLogs.append(info.runId, "Completed with status " + report.getStatus());
        return report;
    }

    private String persistRunResult(String runId, Object payload) throws Exception {
        String baseDir = props.getRunHistoryDir();
        if (baseDir == null || baseDir.isBlank()) return null;
        Path dir = Paths.get(baseDir);
        Files.createDirectories(dir);
        Path out = dir.resolve(runId + ".json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), payload);
        return out.toAbsolutePath().toString();
    }
}

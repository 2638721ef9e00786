package com.newsdesk.curation.controller;

import com.newsdesk.curation.admin.RunLogService;
import com.newsdesk.curation.admin.RunRegistry;
import com.newsdesk.curation.dto.ActionDtos;
import com.newsdesk.curation.service.DuplicateDetector;
import com.newsdesk.curation.service.FullUpdateService;
import com.newsdesk.curation.service.enrichment.LlmProcessor;
import com.newsdesk.curation.util.TokenAccounting;
import com.newsdesk.curation.util.TokenBucketRateLimiter;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/actions")
public class ActionsController {
    private final FullUpdateService fullUpdates;
    private final LlmProcessor processor;
    private final DuplicateDetector detector;
    private final TokenBucketRateLimiter limiter;
    private final RunRegistry runRegistry;
    private final RunLogService runLogs;
    private final AdminAccess access;

    public ActionsController(FullUpdateService fullUpdates, LlmProcessor processor, DuplicateDetector detector,
                             TokenBucketRateLimiter limiter, RunRegistry runRegistry, RunLogService runLogs,
                             AdminAccess access) {
        this.fullUpdates = fullUpdates;
        this.processor = processor;
        this.detector = detector;
        this.limiter = limiter;
        this.runRegistry = runRegistry;
        this.runLogs = runLogs;
        this.access = access;
    }

    @PostMapping(path = "/run-full-update", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> runFullUpdate(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestHeader(value = "x-user-id", required = false) Long userId) {
        if (!access.isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        FullUpdateService.RunHandle handle = fullUpdates.start(access.resolveUser(userId));
        RunRegistry.RunInfo info = runRegistry.get(handle.runId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", handle.runId());
        body.put("type", FullUpdateService.RUN_TYPE);
        body.put("status", info != null ? info.status : "running");
        body.put("joined", handle.joined());
        return Mono.just(ResponseEntity.accepted().body(body));
    }

    @GetMapping(path = "/runs/latest", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> latest(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestParam(value = "type", required = false) String type) {
        if (!access.isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        RunRegistry.RunInfo r = runRegistry.latestOfType(type);
        if (r == null) return Mono.just(ResponseEntity.ok(Map.of()));
        return Mono.just(ResponseEntity.ok(toMap(r)));
    }

    @GetMapping(path = "/runs/{runId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> run(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable String runId) {
        if (!access.isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        RunRegistry.RunInfo r = runRegistry.get(runId);
        if (r == null) return Mono.just(ResponseEntity.notFound().build());
        return Mono.just(ResponseEntity.ok(toMap(r)));
    }

    @GetMapping(path = "/runs/{runId}/logs/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> logs(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable String runId) {
        if (!access.isAdmin(adminKey)) {
            return Flux.error(new UnauthorizedException());
        }
        return runLogs.stream(runId);
    }

    @PostMapping(path = "/process-articles", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ActionDtos.ProcessingReport>> processArticles(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestHeader(value = "x-user-id", required = false) Long userId,
            @Valid @RequestBody ActionDtos.ProcessArticlesRequest body) {
        if (!access.isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return processor.processArticles(access.resolveUser(userId), body.getArticle_ids(), new TokenAccounting())
                .map(ResponseEntity::ok);
    }

    @PostMapping(path = "/reprocess-article/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ActionDtos.ProcessingReport>> reprocess(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable long id) {
        if (!access.isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return processor.reprocess(id, new TokenAccounting()).map(ResponseEntity::ok);
    }

    @PostMapping(path = "/detect-duplicates", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ActionDtos.DedupReport>> detectDuplicates(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestHeader(value = "x-user-id", required = false) Long userId) {
        if (!access.isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return detector.detect(access.resolveUser(userId)).map(ResponseEntity::ok);
    }

    @GetMapping(path = "/rate-budget", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<TokenBucketRateLimiter.RateBudgetSnapshot>> rateBudget(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey) {
        if (!access.isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.just(ResponseEntity.ok(limiter.snapshot()));
    }

    private static Map<String, Object> toMap(RunRegistry.RunInfo r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("runId", r.runId);
        m.put("type", r.type);
        m.put("userId", r.userId);
        m.put("status", r.status);
        m.put("processed", r.processed);
        m.put("startedAt", r.startedAt != null ? r.startedAt.toString() : null);
        m.put("updatedAt", r.updatedAt != null ? r.updatedAt.toString() : null);
        m.put("endedAt", r.endedAt != null ? r.endedAt.toString() : null);
        m.put("message", r.message);
        m.put("resultPath", r.resultPath);
        m.put("result", r.result);
        return m;
    }
}

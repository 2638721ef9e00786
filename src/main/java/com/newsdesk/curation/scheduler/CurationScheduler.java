package com.newsdesk.curation.scheduler;

import com.newsdesk.curation.config.AppProperties;
import com.newsdesk.curation.dto.ActionDtos;
import com.newsdesk.curation.service.FullUpdateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Recurring full update for the configured user. Uses a fixed delay, so a slow run pushes the next one back
 * instead of overlapping it.
 */
@Component
@ConditionalOnProperty(prefix = "app", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class CurationScheduler {
    private static final Logger log = LoggerFactory.getLogger(CurationScheduler.class);

    private final FullUpdateService fullUpdates;
    private final AppProperties props;

    public CurationScheduler(FullUpdateService fullUpdates, AppProperties props) {
        this.fullUpdates = fullUpdates;
        this.props = props;
    }

    @Scheduled(fixedDelayString = "${app.fetch-interval-ms:3600000}",
            initialDelayString = "${app.fetch-initial-delay-ms:60000}")
    public void runScheduledUpdate() {
        long userId = props.getDefaultUserId();
        FullUpdateService.RunHandle handle = fullUpdates.start(userId);
        log.info("Scheduled full update {} for user {}{}", handle.runId(), userId, handle.joined() ? " (joined)" : "");
        try {
            // the run enforces its own timeout; the margin only guards against a stuck pipeline
            ActionDtos.FullUpdateReport report = handle.result()
                    .block(props.getFullUpdateTimeout().plus(Duration.ofMinutes(1)));
            if (report != null && "failed".equals(report.getStatus())) {
                log.error("Scheduled full update {} failed: {}", handle.runId(), report.getErrors());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled full update {} did not finish: {}", handle.runId(), e.toString());
        }
    }
}

package com.newsdesk.curation.exception;

import java.time.Duration;

/**
 * Provider answered 429 for throughput. Handled by pausing the shared limiter and retrying; never surfaced.
 */
public class RateLimitedException extends CurationException {
    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}

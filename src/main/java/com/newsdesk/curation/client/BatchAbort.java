package com.newsdesk.curation.client;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Abort state shared by the calls of one batch. {@link GatedLlmClient} trips it on a fatal provider error
 * while the failing call still holds its permit, so no queued call of the same batch is sent after it.
 */
public final class BatchAbort {
    private final AtomicReference<String> reason = new AtomicReference<>();

    /** @return true for the call that tripped it first */
    public boolean trip(String why) {
        return reason.compareAndSet(null, why != null ? why : "fatal provider error");
    }

    public boolean isTripped() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}

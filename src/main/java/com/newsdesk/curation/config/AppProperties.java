package com.newsdesk.curation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    private String adminKey;
    /**
     * User whose pipeline the recurring scheduler runs. Single-tenant deployments use one user.
     */
    private long defaultUserId = 1L;
    private boolean schedulerEnabled = true;
    private long fetchIntervalMs = 3_600_000L;
    private long fetchInitialDelayMs = 60_000L;
    // Lifecycle
    private int archiveAfterDays = 7;
    private int retentionDays = 8;
    /**
     * Upper bound for one full update. Runs happen in the background and are polled.
     */
    private Duration fullUpdateTimeout = Duration.ofMinutes(30);
    /**
     * Directory where full-update reports are saved as JSON files. Reports are not saved when unset.
     */
    private String runHistoryDir;

    public String getAdminKey() {
        return adminKey;
    }

    public void setAdminKey(String adminKey) {
        this.adminKey = adminKey;
    }

    public long getDefaultUserId() {
        return defaultUserId;
    }

    public void setDefaultUserId(long defaultUserId) {
        this.defaultUserId = defaultUserId;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public long getFetchIntervalMs() {
        return fetchIntervalMs;
    }

    public void setFetchIntervalMs(long fetchIntervalMs) {
        this.fetchIntervalMs = fetchIntervalMs;
    }

    public long getFetchInitialDelayMs() {
        return fetchInitialDelayMs;
    }

    public void setFetchInitialDelayMs(long fetchInitialDelayMs) {
        this.fetchInitialDelayMs = fetchInitialDelayMs;
    }

    public int getArchiveAfterDays() {
        return archiveAfterDays;
    }

    public void setArchiveAfterDays(int archiveAfterDays) {
        this.archiveAfterDays = archiveAfterDays;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public Duration getFullUpdateTimeout() {
        return fullUpdateTimeout;
    }

    public void setFullUpdateTimeout(Duration fullUpdateTimeout) {
        this.fullUpdateTimeout = fullUpdateTimeout;
    }

    public String getRunHistoryDir() {
        return runHistoryDir;
    }

    public void setRunHistoryDir(String runHistoryDir) {
        this.runHistoryDir = runHistoryDir;
    }
}

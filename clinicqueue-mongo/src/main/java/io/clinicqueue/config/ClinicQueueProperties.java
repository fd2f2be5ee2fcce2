package io.clinicqueue.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the job queue, the appointment lifecycle and notification delivery.
 */
@ConfigurationProperties(prefix = "clinicqueue")
public class ClinicQueueProperties {
    private boolean enabled = true;
    private int maxConcurrency = 20; // global
    private int defaultConcurrency = 5; // per job type
    private int lockLimit = 0; // claimed-but-unfinished jobs per worker, 0 = unbounded
    private int batchSize = 5;
    private int maxRetryCount = 3;
    private Duration retryBackoffBase = Duration.ofSeconds(10);
    private Duration retryBackoffMax = Duration.ofMinutes(10);
    private Duration lockLifetime = Duration.ofMinutes(10);
    private Duration lockWaitTimeout = Duration.ofSeconds(30);
    private Duration storeTimeout = Duration.ofSeconds(5);
    private Duration processEvery = Duration.ofSeconds(5);
    private String workerId;
    private String zone;
    private int errorMessageMaxLength = 1000;
    private boolean ensureIndexesOnStartup = false;
    private boolean distributedLocks = false;

    private final NoShow noShow = new NoShow();
    private final Notifications notifications = new Notifications();
    private final Scheduling scheduling = new Scheduling();

    /**
     * Clinic time zone; defaults to the JVM zone.
     */
    public ZoneId resolveZone() {
        return (zone == null || zone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public void setDefaultConcurrency(int defaultConcurrency) {
        this.defaultConcurrency = defaultConcurrency;
    }

    public int getLockLimit() {
        return lockLimit;
    }

    public void setLockLimit(int lockLimit) {
        this.lockLimit = lockLimit;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public void setMaxRetryCount(int maxRetryCount) {
        this.maxRetryCount = maxRetryCount;
    }

    public Duration getRetryBackoffBase() {
        return retryBackoffBase;
    }

    public void setRetryBackoffBase(Duration retryBackoffBase) {
        this.retryBackoffBase = retryBackoffBase;
    }

    public Duration getRetryBackoffMax() {
        return retryBackoffMax;
    }

    public void setRetryBackoffMax(Duration retryBackoffMax) {
        this.retryBackoffMax = retryBackoffMax;
    }

    public Duration getLockLifetime() {
        return lockLifetime;
    }

    public void setLockLifetime(Duration lockLifetime) {
        this.lockLifetime = lockLifetime;
    }

    public Duration getLockWaitTimeout() {
        return lockWaitTimeout;
    }

    public void setLockWaitTimeout(Duration lockWaitTimeout) {
        this.lockWaitTimeout = lockWaitTimeout;
    }

    public Duration getStoreTimeout() {
        return storeTimeout;
    }

    public void setStoreTimeout(Duration storeTimeout) {
        this.storeTimeout = storeTimeout;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public int getErrorMessageMaxLength() {
        return errorMessageMaxLength;
    }

    public void setErrorMessageMaxLength(int errorMessageMaxLength) {
        this.errorMessageMaxLength = errorMessageMaxLength;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isDistributedLocks() {
        return distributedLocks;
    }

    public void setDistributedLocks(boolean distributedLocks) {
        this.distributedLocks = distributedLocks;
    }

    public NoShow getNoShow() {
        return noShow;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public Scheduling getScheduling() {
        return scheduling;
    }

    public static class NoShow {
        private boolean enabled = true;
        private String interval = "10 minutes";
        private int graceMinutes = 20;
        private int batchLimit = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }

        public int getGraceMinutes() {
            return graceMinutes;
        }

        public void setGraceMinutes(int graceMinutes) {
            this.graceMinutes = graceMinutes;
        }

        public int getBatchLimit() {
            return batchLimit;
        }

        public void setBatchLimit(int batchLimit) {
            this.batchLimit = batchLimit;
        }
    }

    public static class Notifications {
        private int maxRetries = 3;
        private boolean etaUpdateNotifications = false;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public boolean isEtaUpdateNotifications() {
            return etaUpdateNotifications;
        }

        public void setEtaUpdateNotifications(boolean etaUpdateNotifications) {
            this.etaUpdateNotifications = etaUpdateNotifications;
        }
    }

    public static class Scheduling {
        private int defaultDurationMinutes = 30;
        private boolean rejectOverlaps = false;

        public int getDefaultDurationMinutes() {
            return defaultDurationMinutes;
        }

        public void setDefaultDurationMinutes(int defaultDurationMinutes) {
            this.defaultDurationMinutes = defaultDurationMinutes;
        }

        public boolean isRejectOverlaps() {
            return rejectOverlaps;
        }

        public void setRejectOverlaps(boolean rejectOverlaps) {
            this.rejectOverlaps = rejectOverlaps;
        }
    }
}

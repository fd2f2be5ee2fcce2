package io.clinicqueue.core;

/**
 * CancelQuery describes how to match jobs to cancel.
 *
 * <p>This is an API-layer object (NOT a database query). The store layer translates it
 * into an actual query. Only jobs that are still PENDING are ever cancelled.
 */
public final class CancelQuery {

    private final JobType type;
    private final String uniqueKey;
    private final String lockKey;

    private CancelQuery(JobType type, String uniqueKey, String lockKey) {
        this.type = type;
        this.uniqueKey = (uniqueKey == null || uniqueKey.isBlank()) ? null : uniqueKey;
        this.lockKey = (lockKey == null || lockKey.isBlank()) ? null : lockKey;
    }

    public JobType type() {
        return type;
    }

    /**
     * Coalescing key, e.g. "doctor-7|2026-10-18|1" for a recalculation.
     */
    public String uniqueKey() {
        return uniqueKey;
    }

    /**
     * Serialization key, e.g. "doctor-7|2026-10-18". Matches every job of that doctor/day.
     */
    public String lockKey() {
        return lockKey;
    }

    public boolean isEmpty() {
        return type == null && uniqueKey == null && lockKey == null;
    }

    /**
     * In-memory evaluation, used by stores that cannot push the filter down.
     */
    public boolean matches(Job job) {
        if (type != null && job.type() != type) {
            return false;
        }
        if (uniqueKey != null && !uniqueKey.equals(job.uniqueKey())) {
            return false;
        }
        return lockKey == null || lockKey.equals(job.lockKey());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private JobType type;
        private String uniqueKey;
        private String lockKey;

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder uniqueKey(String uniqueKey) {
            this.uniqueKey = uniqueKey;
            return this;
        }

        public Builder lockKey(String lockKey) {
            this.lockKey = lockKey;
            return this;
        }

        public CancelQuery build() {
            CancelQuery query = new CancelQuery(type, uniqueKey, lockKey);
            if (query.isEmpty()) {
                throw new IllegalStateException(
                        "CancelQuery must contain at least one condition: type, uniqueKey, or lockKey"
                );
            }
            return query;
        }
    }
}

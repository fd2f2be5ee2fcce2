package io.clinicqueue.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Job counts per status, for operator dashboards.
 */
public record JobQueueStats(Map<JobStatus, Long> counts) {

    public JobQueueStats {
        EnumMap<JobStatus, Long> copy = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            copy.put(status, 0L);
        }
        if (counts != null) {
            copy.putAll(counts);
        }
        counts = Collections.unmodifiableMap(copy);
    }

    public long count(JobStatus status) {
        return counts.get(status);
    }

    public long pending() {
        return count(JobStatus.PENDING);
    }

    public long running() {
        return count(JobStatus.RUNNING);
    }

    public long failed() {
        return count(JobStatus.FAILED);
    }
}

package io.clinicqueue.core;

import io.clinicqueue.JobHandler;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class JobHandlerRegistry {

    private final Map<JobType, JobHandler<?>> handlersByType;

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        EnumMap<JobType, JobHandler<?>> byType = new EnumMap<>(JobType.class);
        for (JobHandler<?> handler : handlers) {
            JobHandler<?> previous = byType.putIfAbsent(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate JobHandler for type: " + handler.type());
            }
        }
        this.handlersByType = Collections.unmodifiableMap(byType);
    }

    public JobHandler<?> getRequired(JobType type) {
        JobHandler<?> handler = handlersByType.get(type);
        if (handler == null) {
            throw new IllegalStateException("No JobHandler registered for type: " + type);
        }
        return handler;
    }

    public boolean has(JobType type) {
        return handlersByType.containsKey(type);
    }
}

package io.clinicqueue.notification;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Delivery outcome counters, one per {@code result} tag value.
 */
public class NotificationMetrics {

    public static final String METRIC_DELIVERY_TOTAL = "clinicqueue.notification.delivery.total";

    public static final String RESULT_SENT = "sent";
    public static final String RESULT_RETRY = "retry";
    public static final String RESULT_FAILED = "failed";

    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();

    public NotificationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    }

    public void recordDeliveryResult(String result) {
        deliveryCounters
                .computeIfAbsent(result, ignored -> Counter.builder(METRIC_DELIVERY_TOTAL)
                        .description("Notification delivery outcomes")
                        .tags(Tags.of("result", result))
                        .register(meterRegistry))
                .increment();
    }
}

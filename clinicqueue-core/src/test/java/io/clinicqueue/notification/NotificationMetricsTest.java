package io.clinicqueue.notification;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationMetricsTest {

    @Test
    void shouldCountEachResultSeparately() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        NotificationMetrics metrics = new NotificationMetrics(registry);

        metrics.recordDeliveryResult(NotificationMetrics.RESULT_SENT);
        metrics.recordDeliveryResult(NotificationMetrics.RESULT_SENT);
        metrics.recordDeliveryResult(NotificationMetrics.RESULT_FAILED);

        assertThat(registry.get(NotificationMetrics.METRIC_DELIVERY_TOTAL).tag("result", "sent").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get(NotificationMetrics.METRIC_DELIVERY_TOTAL).tag("result", "failed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find(NotificationMetrics.METRIC_DELIVERY_TOTAL).tag("result", "retry").counter()).isNull();
    }
}

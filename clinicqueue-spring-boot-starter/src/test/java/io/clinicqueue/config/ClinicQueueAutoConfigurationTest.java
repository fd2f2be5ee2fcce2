package io.clinicqueue.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clinicqueue.JobQueue;
import io.clinicqueue.appointment.AppointmentLifecycle;
import io.clinicqueue.changefeed.ChangeFeedRecalculationBridge;
import io.clinicqueue.core.JobHandlerRegistry;
import io.clinicqueue.core.JobType;
import io.clinicqueue.core.KeyLock;
import io.clinicqueue.internal.memory.LocalKeyLock;
import io.clinicqueue.internal.mongo.MongoKeyLock;
import io.clinicqueue.notification.NotificationDispatcher;
import io.clinicqueue.notification.NotificationSender;
import io.clinicqueue.queue.DoctorDelayRecorder;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ClinicQueueAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ClinicQueueAutoConfiguration.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(MongoDatabaseFactory.class, () -> mock(MongoDatabaseFactory.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "clinicqueue.enabled=true",
                    "clinicqueue.worker-id=test-worker",
                    "clinicqueue.process-every=500ms",
                    "clinicqueue.lock-lifetime=5s",
                    "clinicqueue.no-show.enabled=false"
            );

    @Test
    void shouldAutoConfigureEngineBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(JobQueue.class);
            assertThat(context).hasSingleBean(ClinicQueueLifecycle.class);
            assertThat(context).hasSingleBean(ClinicQueueProperties.class);
            assertThat(context).hasSingleBean(AppointmentLifecycle.class);
            assertThat(context).hasSingleBean(NotificationDispatcher.class);
            assertThat(context).hasSingleBean(NotificationSender.class);
            assertThat(context).hasSingleBean(ChangeFeedRecalculationBridge.class);
            assertThat(context).hasSingleBean(DoctorDelayRecorder.class);
        });
    }

    @Test
    void shouldRegisterHandlerForEveryJobType() {
        contextRunner.run(context -> {
            JobHandlerRegistry registry = context.getBean(JobHandlerRegistry.class);
            for (JobType type : JobType.values()) {
                assertThat(registry.has(type)).as("handler for %s", type).isTrue();
            }
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "clinicqueue.zone=Europe/Berlin",
                        "clinicqueue.retry-backoff-base=2s",
                        "clinicqueue.notifications.max-retries=5",
                        "clinicqueue.scheduling.default-duration-minutes=20")
                .run(context -> {
                    ClinicQueueProperties props = context.getBean(ClinicQueueProperties.class);
                    assertThat(props.resolveZone()).isEqualTo(ZoneId.of("Europe/Berlin"));
                    assertThat(props.getRetryBackoffBase()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(props.getNotifications().getMaxRetries()).isEqualTo(5);
                    assertThat(props.getScheduling().getDefaultDurationMinutes()).isEqualTo(20);
                    assertThat(props.getNoShow().getGraceMinutes()).isEqualTo(20);
                });
    }

    @Test
    void shouldUseLocalKeyLockByDefault() {
        contextRunner.run(context ->
                assertThat(context.getBean(KeyLock.class)).isInstanceOf(LocalKeyLock.class));
    }

    @Test
    void shouldUseMongoKeyLockWhenDistributed() {
        contextRunner
                .withPropertyValues("clinicqueue.distributed-locks=true")
                .run(context ->
                        assertThat(context.getBean(KeyLock.class)).isInstanceOf(MongoKeyLock.class));
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("clinicqueue.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(JobQueue.class);
                    assertThat(context).doesNotHaveBean(AppointmentLifecycle.class);
                });
    }
}

package io.clinicqueue.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.TransactionOptions;
import io.clinicqueue.JobHandler;
import io.clinicqueue.JobQueue;
import io.clinicqueue.appointment.AppointmentLifecycle;
import io.clinicqueue.appointment.AppointmentStore;
import io.clinicqueue.changefeed.AppointmentChangeFeed;
import io.clinicqueue.changefeed.ChangeFeedRecalculationBridge;
import io.clinicqueue.core.JobHandlerRegistry;
import io.clinicqueue.core.JobStore;
import io.clinicqueue.core.KeyLock;
import io.clinicqueue.internal.DefaultJobQueue;
import io.clinicqueue.internal.memory.LocalKeyLock;
import io.clinicqueue.internal.mongo.MongoAppointmentChangeFeed;
import io.clinicqueue.internal.mongo.MongoAppointmentStore;
import io.clinicqueue.internal.mongo.MongoDoctorDelayStore;
import io.clinicqueue.internal.mongo.MongoJobStore;
import io.clinicqueue.internal.mongo.MongoKeyLock;
import io.clinicqueue.internal.mongo.MongoNotificationStore;
import io.clinicqueue.noshow.NoShowSweepHandler;
import io.clinicqueue.notification.AppointmentNotifier;
import io.clinicqueue.notification.LoggingNotificationSender;
import io.clinicqueue.notification.NotificationDeliveryHandler;
import io.clinicqueue.notification.NotificationDispatcher;
import io.clinicqueue.notification.NotificationMetrics;
import io.clinicqueue.notification.NotificationSender;
import io.clinicqueue.notification.NotificationStore;
import io.clinicqueue.queue.DoctorDelayRecorder;
import io.clinicqueue.queue.DoctorDelayStore;
import io.clinicqueue.queue.QueueRecalculationEngine;
import io.clinicqueue.queue.RecalculateQueueHandler;
import io.clinicqueue.queue.RecalculationScheduler;
import io.clinicqueue.queue.RecalculationTrigger;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Lazy;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Spring Boot auto-configuration entrypoint for the clinic queue engine.
 *
 * <p>The dispatcher and the recalculation scheduler take a lazy {@link JobQueue}: the queue
 * needs every handler up front, and some handlers enqueue work themselves.
 */
@AutoConfiguration
@ConditionalOnClass({JobQueue.class, MongoTemplate.class})
@EnableConfigurationProperties(ClinicQueueProperties.class)
@ConditionalOnProperty(prefix = "clinicqueue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ClinicQueueAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clinicQueueClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore mongoJobStore(MongoTemplate mongoTemplate, ClinicQueueProperties props) {
        return new MongoJobStore(mongoTemplate, props.getStoreTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public AppointmentStore mongoAppointmentStore(MongoTemplate mongoTemplate,
                                                  MongoDatabaseFactory databaseFactory,
                                                  ClinicQueueProperties props) {
        TransactionOptions options = TransactionOptions.builder()
                .maxCommitTime(props.getStoreTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();
        TransactionTemplate transactions = new TransactionTemplate(new MongoTransactionManager(databaseFactory, options));
        return new MongoAppointmentStore(mongoTemplate, transactions, props.getStoreTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationStore mongoNotificationStore(MongoTemplate mongoTemplate, ClinicQueueProperties props) {
        return new MongoNotificationStore(mongoTemplate, props.getStoreTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public DoctorDelayStore mongoDoctorDelayStore(MongoTemplate mongoTemplate, ClinicQueueProperties props) {
        return new MongoDoctorDelayStore(mongoTemplate, props.getStoreTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public AppointmentChangeFeed mongoAppointmentChangeFeed(MongoTemplate mongoTemplate) {
        return new MongoAppointmentChangeFeed(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected ClinicQueueMongoIndexConfig clinicQueueMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new ClinicQueueMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyLock clinicQueueKeyLock(MongoTemplate mongoTemplate, ClinicQueueProperties props, Clock clock) {
        if (props.isDistributedLocks()) {
            return new MongoKeyLock(mongoTemplate, props.getLockLifetime(), clock);
        }
        return new LocalKeyLock();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobQueue jobQueue(ClinicQueueProperties props,
                             JobStore jobStore,
                             JobHandlerRegistry registry,
                             ObjectProvider<ObjectMapper> objectMapper,
                             KeyLock keyLock,
                             Clock clock) {
        ObjectMapper om = objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules());
        return new DefaultJobQueue(props, jobStore, registry, om, keyLock, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecalculationScheduler recalculationScheduler(@Lazy JobQueue jobQueue) {
        return new RecalculationScheduler(jobQueue);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(NotificationStore store,
                                                         @Lazy JobQueue jobQueue,
                                                         Clock clock,
                                                         ClinicQueueProperties props) {
        return new NotificationDispatcher(store, jobQueue, clock, props.getNotifications().getMaxRetries());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationMetrics notificationMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new NotificationMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSender notificationSender() {
        return new LoggingNotificationSender();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueRecalculationEngine queueRecalculationEngine(AppointmentStore store, DoctorDelayStore delays, Clock clock) {
        return new QueueRecalculationEngine(store, delays, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DoctorDelayRecorder doctorDelayRecorder(DoctorDelayStore delays, RecalculationScheduler scheduler, Clock clock) {
        return new DoctorDelayRecorder(delays, scheduler, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AppointmentLifecycle appointmentLifecycle(AppointmentStore store,
                                                     Clock clock,
                                                     ClinicQueueProperties props,
                                                     RecalculationScheduler scheduler,
                                                     NotificationDispatcher dispatcher) {
        ClinicQueueProperties.Scheduling scheduling = props.getScheduling();
        AppointmentLifecycle lifecycle = new AppointmentLifecycle(store, clock, props.resolveZone(),
                scheduling.getDefaultDurationMinutes(), scheduling.isRejectOverlaps());
        lifecycle.addListener(new RecalculationTrigger(scheduler));
        lifecycle.addListener(new AppointmentNotifier(dispatcher, props.resolveZone()));
        return lifecycle;
    }

    @Bean
    @ConditionalOnMissingBean
    public RecalculateQueueHandler recalculateQueueHandler(QueueRecalculationEngine engine,
                                                           NotificationDispatcher dispatcher,
                                                           ClinicQueueProperties props) {
        return new RecalculateQueueHandler(engine, dispatcher,
                props.getNotifications().isEtaUpdateNotifications(), props.resolveZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDeliveryHandler notificationDeliveryHandler(NotificationStore store,
                                                                   NotificationSender sender,
                                                                   NotificationMetrics metrics,
                                                                   Clock clock) {
        return new NotificationDeliveryHandler(store, sender, metrics, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public NoShowSweepHandler noShowSweepHandler(AppointmentStore store,
                                                 AppointmentLifecycle lifecycle,
                                                 Clock clock,
                                                 ClinicQueueProperties props) {
        return new NoShowSweepHandler(store, lifecycle, clock, props.getNoShow().getBatchLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChangeFeedRecalculationBridge changeFeedRecalculationBridge(AppointmentChangeFeed feed,
                                                                       RecalculationScheduler scheduler) {
        return new ChangeFeedRecalculationBridge(feed, scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClinicQueueLifecycle clinicQueueLifecycle(JobQueue jobQueue,
                                                     ChangeFeedRecalculationBridge changeFeedBridge,
                                                     ClinicQueueProperties props) {
        return new ClinicQueueLifecycle(jobQueue, changeFeedBridge, props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "clinicqueue", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton clinicQueueIndexesInitializer(ClinicQueueMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

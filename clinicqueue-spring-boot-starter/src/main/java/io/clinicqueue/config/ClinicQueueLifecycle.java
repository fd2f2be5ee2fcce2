package io.clinicqueue.config;

import io.clinicqueue.JobBuilder;
import io.clinicqueue.JobQueue;
import io.clinicqueue.changefeed.ChangeFeedRecalculationBridge;
import io.clinicqueue.core.JobType;
import io.clinicqueue.noshow.NoShowSweepPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts and stops the job queue with the Spring container, and registers the recurring
 * no-show sweep once the queue is running.
 */
public class ClinicQueueLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ClinicQueueLifecycle.class);

    private final JobQueue jobQueue;
    private final ChangeFeedRecalculationBridge changeFeedBridge;
    private final ClinicQueueProperties props;
    private volatile boolean running = false;

    public ClinicQueueLifecycle(JobQueue jobQueue, ChangeFeedRecalculationBridge changeFeedBridge, ClinicQueueProperties props) {
        this.jobQueue = jobQueue;
        this.changeFeedBridge = changeFeedBridge;
        this.props = props;
    }

    @Override
    public void start() {
        jobQueue.start();
        ClinicQueueProperties.NoShow noShow = props.getNoShow();
        if (noShow.isEnabled()) {
            jobQueue.every(JobType.NO_SHOW_SWEEP, noShow.getInterval(),
                    new NoShowSweepPayload(noShow.getGraceMinutes()),
                    new JobBuilder.RepeatOptions(true, props.resolveZone().getId()));
            log.info("clinicqueue no-show sweep registered interval={} graceMinutes={}", noShow.getInterval(), noShow.getGraceMinutes());
        }
        running = true;
    }

    @Override
    public void stop() {
        changeFeedBridge.close();
        jobQueue.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}

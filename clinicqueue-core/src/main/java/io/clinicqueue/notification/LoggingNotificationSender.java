package io.clinicqueue.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sender that only writes the notification to the log. Used when no real channel is wired.
 */
public class LoggingNotificationSender implements NotificationSender {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public void send(NotificationRecord notification) {
        log.info("notification delivered id={} type={} recipientId={} title={}",
                notification.id(), notification.type(), notification.recipientId(), notification.title());
    }
}

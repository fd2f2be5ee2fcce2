package io.clinicqueue.changefeed;

/**
 * Push notifications of appointment changes made by anyone, including writers outside this
 * process.
 */
public interface AppointmentChangeFeed {

    /**
     * Delivers changes of the given doctor's appointments until the subscription is closed.
     * Listeners run on the feed's thread and must not block for long.
     */
    Subscription subscribe(String doctorId, AppointmentChangeListener listener);

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}

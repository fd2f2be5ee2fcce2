package io.clinicqueue.internal.mongo;

import io.clinicqueue.error.TransientStoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.util.function.Supplier;

/**
 * Maps Spring data-access failures onto {@link TransientStoreException} so callers see one
 * retryable error type whatever the driver raised.
 */
final class MongoStoreSupport {

    private MongoStoreSupport() {
    }

    static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            throw new TransientStoreException(operation + " failed: " + e.getMessage(), e);
        }
    }

    static void run(String operation, Runnable action) {
        translate(operation, () -> {
            action.run();
            return null;
        });
    }
}

package io.clinicqueue.internal.memory;

import io.clinicqueue.core.KeyLock;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * In-process {@link KeyLock} backed by one fair semaphore per key. Waiters are served in
 * arrival order.
 *
 * <p>A key's semaphore lives only while someone holds or waits for it, so the map stays as
 * small as the set of busy queues.
 */
public class LocalKeyLock implements KeyLock {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> owners = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String key, String owner, Duration maxWait) throws InterruptedException {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        Entry entry = entries.compute(key, (k, e) -> {
            Entry current = e == null ? new Entry() : e;
            current.users++;
            return current;
        });
        boolean acquired = false;
        try {
            acquired = entry.semaphore.tryAcquire(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            if (!acquired) {
                leave(key);
            }
        }
        if (!acquired) {
            return false;
        }
        owners.put(key, owner);
        return true;
    }

    @Override
    public void release(String key, String owner) {
        if (owners.remove(key, owner)) {
            entries.get(key).semaphore.release();
            leave(key);
        }
    }

    public boolean isHeld(String key) {
        return owners.containsKey(key);
    }

    /**
     * Keys currently held or waited for.
     */
    int trackedKeys() {
        return entries.size();
    }

    private void leave(String key) {
        entries.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }

    private static final class Entry {
        private final Semaphore semaphore = new Semaphore(1, true);
        // holders plus waiters; guarded by the map's per-key compute
        private int users;
    }
}

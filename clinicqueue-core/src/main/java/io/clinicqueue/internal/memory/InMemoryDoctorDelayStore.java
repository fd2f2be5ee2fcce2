package io.clinicqueue.internal.memory;

import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.queue.DoctorDelay;
import io.clinicqueue.queue.DoctorDelayStore;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Heap-backed {@link DoctorDelayStore} for tests and single-process setups.
 */
public class InMemoryDoctorDelayStore implements DoctorDelayStore {

    private final ConcurrentMap<DoctorDay, DoctorDelay> delays = new ConcurrentHashMap<>();

    @Override
    public DoctorDelay add(DoctorDay doctorDay, int minutes, Instant updatedAt) {
        return delays.merge(doctorDay, new DoctorDelay(doctorDay, minutes, updatedAt),
                (old, added) -> new DoctorDelay(doctorDay, old.minutes() + minutes, updatedAt));
    }

    @Override
    public Optional<DoctorDelay> find(DoctorDay doctorDay) {
        return Optional.ofNullable(delays.get(doctorDay));
    }

    @Override
    public boolean clear(DoctorDay doctorDay) {
        return delays.remove(doctorDay) != null;
    }
}

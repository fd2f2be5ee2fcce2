package io.clinicqueue.queue;

import io.clinicqueue.appointment.DoctorDay;

import java.util.List;

/**
 * @param activeCount number of active appointments in the queue
 * @param written     slots whose queue fields were written, in queue order
 */
public record RecalculationResult(DoctorDay doctorDay, int activeCount, List<QueueSlot> written) {

    public static RecalculationResult empty(DoctorDay doctorDay) {
        return new RecalculationResult(doctorDay, 0, List.of());
    }

    public List<QueueSlot> etaChanges() {
        return written.stream().filter(QueueSlot::etaChanged).toList();
    }
}

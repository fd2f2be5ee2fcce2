package io.clinicqueue.queue;

import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.AppointmentStatus;
import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.error.TransientStoreException;
import io.clinicqueue.internal.memory.InMemoryAppointmentStore;
import io.clinicqueue.internal.memory.InMemoryDoctorDelayStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;

import static io.clinicqueue.queue.QueueCalculatorTest.at;
import static io.clinicqueue.queue.QueueCalculatorTest.scheduled;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueRecalculationEngineTest {

    private static final DoctorDay DOC_DAY = new DoctorDay("doc-1", LocalDate.of(2026, 3, 2));
    private static final Instant NOW = Instant.parse("2026-03-02T07:00:00Z");

    private InMemoryAppointmentStore store;
    private InMemoryDoctorDelayStore delays;
    private QueueRecalculationEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryAppointmentStore();
        delays = new InMemoryDoctorDelayStore();
        engine = new QueueRecalculationEngine(store, delays, Clock.fixed(NOW, ZoneOffset.UTC));
        store.put(scheduled("a", "09:00", 30));
        store.put(scheduled("b", "09:15", 30));
        store.put(scheduled("c", "09:45", 30));
    }

    @Test
    void recalculateShouldWritePositionsAndEtas() {
        RecalculationResult result = engine.recalculate(DOC_DAY);

        assertEquals(3, result.activeCount());
        assertEquals(3, result.written().size());
        assertSlot("a", 1, "09:00", 0);
        assertSlot("b", 2, "09:30", 15);
        assertSlot("c", 3, "10:00", 15);
        assertEquals(NOW, store.findById("b").orElseThrow().updatedAt());
    }

    @Test
    void secondRunShouldWriteNothing() {
        engine.recalculate(DOC_DAY);
        List<Appointment> before = store.findAll();

        RecalculationResult again = engine.recalculate(DOC_DAY);

        assertTrue(again.written().isEmpty());
        assertEquals(before, store.findAll());
    }

    @Test
    void onlyChangedRowsShouldBeWritten() {
        engine.recalculate(DOC_DAY);
        store.put(scheduled("d", "11:00", 30));

        RecalculationResult result = engine.recalculate(DOC_DAY);

        assertEquals(List.of("d"), result.written().stream().map(s -> s.appointment().id()).toList());
        assertSlot("d", 4, "11:00", 0);
    }

    @Test
    void cancellationShouldCompactPositions() {
        engine.recalculate(DOC_DAY);
        Appointment b = store.findById("b").orElseThrow();
        store.put(b.toBuilder().status(AppointmentStatus.CANCELLED).clearQueueFields().version(b.version() + 1).build());

        engine.recalculate(DOC_DAY);

        assertSlot("a", 1, "09:00", 0);
        assertSlot("c", 2, "09:45", 0);
        assertNull(store.findById("b").orElseThrow().queuePosition());
    }

    @Test
    void otherDoctorsAndDaysShouldBeUntouched() {
        store.put(scheduled("x", "09:00", 30).toBuilder().doctorId("doc-2").build());
        store.put(scheduled("y", "09:00", 30).toBuilder().serviceDay(LocalDate.of(2026, 3, 3))
                .scheduledAt(Instant.parse("2026-03-03T09:00:00Z")).build());

        engine.recalculate(DOC_DAY);

        assertNull(store.findById("x").orElseThrow().queuePosition());
        assertNull(store.findById("y").orElseThrow().queuePosition());
    }

    @Test
    void reportedDelayShouldPushWaitingAppointmentsBack() {
        engine.recalculate(DOC_DAY);
        delays.add(DOC_DAY, 20, NOW);
        delays.add(new DoctorDay("doc-2", DOC_DAY.serviceDay()), 90, NOW);

        RecalculationResult result = engine.recalculate(DOC_DAY);

        assertEquals(3, result.written().size());
        assertSlot("a", 1, "09:20", 20);
        assertSlot("b", 2, "09:50", 35);
        assertSlot("c", 3, "10:20", 35);

        delays.clear(DOC_DAY);
        engine.recalculate(DOC_DAY);

        assertSlot("a", 1, "09:00", 0);
        assertSlot("c", 3, "10:00", 15);
    }

    @Test
    void emptyQueueShouldBeNoOp() {
        RecalculationResult result = engine.recalculate(new DoctorDay("doc-9", LocalDate.of(2026, 3, 2)));

        assertEquals(0, result.activeCount());
        assertTrue(result.written().isEmpty());
    }

    @Test
    void concurrentLifecycleWriteShouldAbortWholeBatch() {
        InMemoryAppointmentStore racing = new InMemoryAppointmentStore() {
            @Override
            public synchronized List<Appointment> findByDoctorDay(DoctorDay doctorDay, Collection<AppointmentStatus> statuses) {
                List<Appointment> read = super.findByDoctorDay(doctorDay, statuses);
                Appointment c = findById("c").orElseThrow();
                put(c.toBuilder().notes("edited").version(c.version() + 1).build());
                return read;
            }
        };
        racing.put(scheduled("a", "09:00", 30));
        racing.put(scheduled("b", "09:15", 30));
        racing.put(scheduled("c", "09:45", 30));
        QueueRecalculationEngine racingEngine = new QueueRecalculationEngine(racing, new InMemoryDoctorDelayStore(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThrows(TransientStoreException.class, () -> racingEngine.recalculate(DOC_DAY));

        for (Appointment a : racing.findAll()) {
            assertNull(a.queuePosition(), "no partial write for " + a.id());
        }
    }

    private void assertSlot(String id, int position, String eta, int delay) {
        Appointment a = store.findById(id).orElseThrow();
        assertEquals(position, a.queuePosition(), "position of " + id);
        assertEquals(at(eta), a.estimatedStartTime(), "eta of " + id);
        assertEquals(delay, a.delayMinutes(), "delay of " + id);
    }
}

package io.clinicqueue.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalParserTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void sweepIntervalInWordsShouldParse() {
        assertEquals(Duration.ofMinutes(10), IntervalParser.parseDuration("10 minutes", "UTC", T0));
        assertEquals(Duration.ofMinutes(90), IntervalParser.parseDuration("1 hour 30 minutes", "UTC", T0));
    }

    @Test
    void compactAndNumericSpecsShouldParse() {
        assertEquals(Duration.ofMinutes(15), IntervalParser.parseHumanDuration("15m"));
        assertEquals(Duration.ofSeconds(600), IntervalParser.parseDuration("600", "UTC", T0));
    }

    @Test
    void unknownUnitShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("10 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("0 minutes"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("5 minutes 2 minutes"));
    }

    @Test
    void fiveFieldCronShouldMeasureToNextFire() {
        Duration duration = IntervalParser.parseDuration("*/5 * * * *", "UTC", Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Duration.ofMinutes(4), duration);
    }

    @Test
    void nextRunShouldStartFromLaterOfPreviousAndFinished() {
        Instant next = IntervalParser.computeNextRunAt(
                "*/5 * * * *",
                "UTC",
                Instant.parse("2026-01-01T00:05:00Z"),
                Instant.parse("2026-01-01T00:06:00Z"));

        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void atSpecShouldRollToNextDay() {
        Instant next = IntervalParser.computeNextRunAt("AT 10:00", "UTC",
                Instant.parse("2026-01-01T10:00:00Z"), Instant.parse("2026-01-01T10:01:00Z"));

        assertEquals(Instant.parse("2026-01-02T10:00:00Z"), next);
    }

    @Test
    void blankSpecMeansOneTimeJob() {
        assertNull(IntervalParser.computeNextRunAt(" ", "UTC", T0, T0));
    }

    @Test
    void looksLikeCronShouldRecognizeSixFieldSpec() {
        assertTrue(IntervalParser.looksLikeCron("0 */10 * * * *"));
    }
}

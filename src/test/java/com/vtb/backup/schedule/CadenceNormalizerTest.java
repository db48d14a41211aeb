package com.vtb.backup.schedule;

import com.vtb.backup.config.AuditConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CadenceNormalizerTest {

    private final CadenceNormalizer normalizer = new CadenceNormalizer(AuditConfig.defaults().getCadence());

    @Test
    void snapsToCanonicalHoursWithinTolerance() {
        for (int hours : List.of(1, 2, 3, 4, 6, 8, 12, 24)) {
            long exact = hours * 3_600L;
            for (long jitter : List.of(-1_200L, -600L, 0L, 599L, 1_200L)) {
                Cadence cadence = normalizer.normalize(exact + jitter).orElseThrow();
                assertEquals(hours, cadence.getHours(), 0.0);
                assertEquals(hours == 1 ? "Every 1 hour" : "Every " + hours + " hours", cadence.getText());
            }
        }
    }

    @Test
    void roundsToNearestHourWithinTolerance() {
        Cadence cadence = normalizer.normalize(5 * 3_600L + 900L).orElseThrow();

        assertEquals(5.0, cadence.getHours(), 0.0);
        assertEquals("Every 5 hours", cadence.getText());
    }

    @Test
    void fallsBackToFractionalHoursMinutesOrSeconds() {
        Cadence fractional = normalizer.normalize(5 * 3_600L + 1_800L).orElseThrow();
        assertEquals(5.5, fractional.getHours(), 0.0);
        assertEquals("Every 5.5 hours", fractional.getText());

        Cadence minutes = normalizer.normalize(15 * 60L).orElseThrow();
        assertEquals(Cadence.Unit.MINUTES, minutes.getUnit());
        assertEquals("Every 15 minutes", minutes.getText());
        assertEquals(0.25, minutes.getHours(), 0.0);

        Cadence seconds = normalizer.normalize(30L).orElseThrow();
        assertEquals("Every 30 seconds", seconds.getText());
    }

    @Test
    void nonPositiveDurationHasNoCadence() {
        assertTrue(normalizer.normalize(0L).isEmpty());
        assertTrue(normalizer.normalize((IsoDuration) null).isEmpty());
    }
}

package com.vtb.backup.schedule;

import com.vtb.backup.config.AuditConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Привязка зашумленных длительностей к каноническим значениям в часах.
 *
 * Порядок: каноническое значение в пределах допуска, затем ближайший целый час
 * в пределах допуска, затем часы, минуты или секунды с округлением до двух знаков.
 */
public class CadenceNormalizer {

    private final long toleranceSeconds;
    private final List<Integer> canonicalHours;

    public CadenceNormalizer(AuditConfig.Cadence settings) {
        this(settings.getToleranceMinutes(), settings.getCanonicalHours());
    }

    public CadenceNormalizer(int toleranceMinutes, List<Integer> canonicalHours) {
        this.toleranceSeconds = toleranceMinutes * 60L;
        this.canonicalHours = new ArrayList<>(canonicalHours);
    }

    public Optional<Cadence> normalize(IsoDuration duration) {
        return duration == null ? Optional.empty() : normalize(duration.toSeconds());
    }

    public Optional<Cadence> normalize(long seconds) {
        if (seconds <= 0) {
            return Optional.empty();
        }
        for (Integer canonical : canonicalHours) {
            if (Math.abs(seconds - canonical * 3_600L) <= toleranceSeconds) {
                return Optional.of(new Cadence(seconds, canonical, Cadence.Unit.HOURS));
            }
        }
        long nearestHour = Math.round(seconds / 3_600.0);
        if (nearestHour >= 1 && Math.abs(seconds - nearestHour * 3_600L) <= toleranceSeconds) {
            return Optional.of(new Cadence(seconds, nearestHour, Cadence.Unit.HOURS));
        }
        if (seconds >= 3_600L) {
            return Optional.of(new Cadence(seconds, Cadence.round2(seconds / 3_600.0), Cadence.Unit.HOURS));
        }
        if (seconds >= 60L) {
            return Optional.of(new Cadence(seconds, Cadence.round2(seconds / 60.0), Cadence.Unit.MINUTES));
        }
        return Optional.of(new Cadence(seconds, seconds, Cadence.Unit.SECONDS));
    }
}

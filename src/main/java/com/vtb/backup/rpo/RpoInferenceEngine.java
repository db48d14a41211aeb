package com.vtb.backup.rpo;

import com.vtb.backup.models.RpoSource;
import com.vtb.backup.models.WorkloadClass;
import com.vtb.backup.schedule.Cadence;
import com.vtb.backup.schedule.ScheduleInfo;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Оценка периодичности и наблюдаемого RPO.
 *
 * Путь A: периодичность из политики (источник Policy).
 * Путь B: эмпирически по точкам восстановления. Периодичность равна разрыву
 * между двумя последними точками, RPO равен времени с момента последней
 * подходящей точки. Для БД в ВМ берется самая свежая точка наиболее
 * приоритетного вида, для управляемых БД только непрерывные (PITR) точки.
 * Все интервалы округляются до сотых долей часа.
 */
@Slf4j
public class RpoInferenceEngine {

    private static final Comparator<RecoveryPoint> NEWEST_FIRST =
        Comparator.comparing(RecoveryPoint::getTimestamp).reversed();

    private final Clock clock;

    public RpoInferenceEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param schedule       расписание из политики, может быть null
     * @param workloadClass  класс нагрузки
     * @param lastBackupTime время последнего успешного копирования из самого ресурса, может быть null
     * @param points         поставщик точек восстановления
     */
    public RpoEstimate estimate(ScheduleInfo schedule,
                                WorkloadClass workloadClass,
                                Instant lastBackupTime,
                                RecoveryPointSource points) {
        Cadence configured = schedule != null ? schedule.getEffectiveCadence() : null;
        RecoveryPointSource source = points != null ? points : RecoveryPointSource.none();

        if (workloadClass == WorkloadClass.MANAGED_DATABASE) {
            return estimateContinuous(source);
        }
        if (workloadClass == WorkloadClass.VAULT_DATABASE) {
            return estimateWithPreference(configured, lastBackupTime, source);
        }
        return estimateSimple(configured, lastBackupTime, source);
    }

    private RpoEstimate estimateSimple(Cadence configured, Instant lastBackupTime, RecoveryPointSource source) {
        List<RecoveryPoint> sorted = sortNewestFirst(source.fetch(false));
        RecoveryPoint latest = sorted.isEmpty() ? null : sorted.get(0);
        Instant freshest = latestOf(latest != null ? latest.getTimestamp() : null, lastBackupTime);

        return RpoEstimate.builder()
            .configuredCadence(configured)
            .inferredCadenceHours(gapHours(sorted))
            .observedRpoHours(elapsedHours(freshest))
            .latestPoint(freshest)
            .latestPointKind(latest != null && latest.getTimestamp().equals(freshest) ? latest.getKind() : null)
            .source(resolveSource(configured, sorted, RpoSource.RECOVERY_POINTS))
            .pointsExamined(sorted.size())
            .build();
    }

    private RpoEstimate estimateWithPreference(Cadence configured, Instant lastBackupTime, RecoveryPointSource source) {
        List<RecoveryPoint> sorted = sortNewestFirst(source.fetch(true));
        RecoveryPoint preferred = selectPreferred(sorted);

        List<RecoveryPoint> sameKind = preferred == null ? sorted : sorted.stream()
            .filter(point -> point.getKind() == preferred.getKind())
            .collect(Collectors.toList());
        Double inferred = gapHours(sameKind.size() >= 2 ? sameKind : sorted);

        Instant reference = preferred != null ? preferred.getTimestamp() : lastBackupTime;
        return RpoEstimate.builder()
            .configuredCadence(configured)
            .inferredCadenceHours(inferred)
            .observedRpoHours(elapsedHours(reference))
            .latestPoint(reference)
            .latestPointKind(preferred != null ? preferred.getKind() : null)
            .source(resolveSource(configured, sorted, RpoSource.RECOVERY_POINTS))
            .pointsExamined(sorted.size())
            .build();
    }

    private RpoEstimate estimateContinuous(RecoveryPointSource source) {
        List<RecoveryPoint> continuous = sortNewestFirst(source.fetch(true)).stream()
            .filter(point -> point.getKind() == RecoveryPointKind.CONTINUOUS)
            .collect(Collectors.toList());
        RecoveryPoint latest = continuous.isEmpty() ? null : continuous.get(0);
        return RpoEstimate.builder()
            .inferredCadenceHours(gapHours(continuous))
            .observedRpoHours(latest != null ? elapsedHours(latest.getTimestamp()) : null)
            .latestPoint(latest != null ? latest.getTimestamp() : null)
            .latestPointKind(latest != null ? latest.getKind() : null)
            .source(continuous.size() >= 2 ? RpoSource.PITR : RpoSource.NONE)
            .pointsExamined(continuous.size())
            .build();
    }

    /**
     * Самая свежая точка наиболее приоритетного вида из присутствующих
     */
    RecoveryPoint selectPreferred(List<RecoveryPoint> newestFirst) {
        RecoveryPoint best = null;
        for (RecoveryPoint point : newestFirst) {
            if (best == null || point.getKind().getRank() < best.getKind().getRank()) {
                best = point;
            }
        }
        return best;
    }

    private RpoSource resolveSource(Cadence configured, List<RecoveryPoint> points, RpoSource empirical) {
        if (configured != null) {
            return RpoSource.POLICY;
        }
        return points.size() >= 2 ? empirical : RpoSource.NONE;
    }

    private List<RecoveryPoint> sortNewestFirst(List<RecoveryPoint> points) {
        if (points == null) {
            return List.of();
        }
        List<RecoveryPoint> sorted = new ArrayList<>();
        for (RecoveryPoint point : points) {
            if (point != null && point.getTimestamp() != null) {
                sorted.add(point);
            }
        }
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }

    private Double gapHours(List<RecoveryPoint> newestFirst) {
        if (newestFirst.size() < 2) {
            return null;
        }
        Duration gap = Duration.between(newestFirst.get(1).getTimestamp(), newestFirst.get(0).getTimestamp());
        return toHours(gap);
    }

    private Double elapsedHours(Instant since) {
        if (since == null) {
            return null;
        }
        Duration elapsed = Duration.between(since, clock.instant());
        if (elapsed.isNegative()) {
            log.debug("Точка восстановления в будущем ({}), RPO принят равным нулю", since);
            return 0.0;
        }
        return toHours(elapsed);
    }

    private static Instant latestOf(Instant first, Instant second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.isAfter(second) ? first : second;
    }

    static double toHours(Duration duration) {
        return BigDecimal.valueOf(duration.getSeconds() + duration.getNano() / 1_000_000_000.0)
            .divide(BigDecimal.valueOf(3_600L), 2, RoundingMode.HALF_UP)
            .doubleValue();
    }
}

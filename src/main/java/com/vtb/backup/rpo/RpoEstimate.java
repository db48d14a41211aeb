package com.vtb.backup.rpo;

import com.vtb.backup.models.RpoSource;
import com.vtb.backup.schedule.Cadence;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Результат оценки периодичности и наблюдаемого RPO
 */
@Value
@Builder
public class RpoEstimate {
    Cadence configuredCadence;
    Double inferredCadenceHours;
    Double observedRpoHours;
    Instant latestPoint;
    RecoveryPointKind latestPointKind;
    @Builder.Default
    RpoSource source = RpoSource.NONE;
    int pointsExamined;
}

package com.vtb.backup.schedule;

import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Расписание, извлеченное из политики: периодичность, окно и
 * периодичности по видам копирования для БД
 */
@Value
@Builder
public class ScheduleInfo {

    private static final List<BackupKind> PREFERENCE = List.of(
        BackupKind.LOG, BackupKind.DIFFERENTIAL, BackupKind.INCREMENTAL, BackupKind.FULL);

    PolicyShape shape;
    Cadence cadence;
    Double windowHours;
    @Builder.Default
    Map<BackupKind, Cadence> perKind = new EnumMap<>(BackupKind.class);

    /**
     * Периодичность, определяющая RPO: для БД самый частый настроенный вид (Log, затем Differential, затем Full)
     */
    public Cadence getEffectiveCadence() {
        for (BackupKind kind : PREFERENCE) {
            Cadence kindCadence = perKind.get(kind);
            if (kindCadence != null) {
                return kindCadence;
            }
        }
        return cadence;
    }

    public Cadence cadenceFor(BackupKind kind) {
        return perKind.get(kind);
    }

    public boolean isResolved() {
        return getEffectiveCadence() != null;
    }
}

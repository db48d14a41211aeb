package com.vtb.backup.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;

/**
 * Защищенный ресурс (ВМ или БД) в хранилище.
 * Ключ: нормализованный (lower-case) идентификатор исходного ресурса.
 * Поля периодичности и RPO заполняются после оценки через toBuilder.
 */
@Value
@Builder(toBuilder = true)
public class ProtectedItem {
    String itemId;
    String itemName;
    String vaultId;
    String vaultName;
    String sourceResourceId;
    String sourceResourceGroup;
    String sourceResourceType;
    String policyId;
    String policyName;
    Instant lastBackupTime;
    String lastBackupStatus;
    String protectionState;
    String workloadType;
    WorkloadClass workloadClass;
    String discoveredBy;

    Double configuredCadenceHours;
    String configuredCadence;
    Double backupWindowHours;
    String fullCadence;
    String differentialCadence;
    String logCadence;
    Double inferredCadenceHours;
    Double observedRpoHours;
    Instant latestRecoveryPoint;
    String latestRecoveryPointKind;
    @Builder.Default
    RpoSource rpoSource = RpoSource.NONE;

    public boolean isUnhealthy() {
        if (protectionState != null) {
            String state = protectionState.toLowerCase(Locale.ROOT);
            if (state.contains("stopped") || state.contains("error")) {
                return true;
            }
        }
        return lastBackupStatus != null && lastBackupStatus.equalsIgnoreCase("Failed");
    }
}

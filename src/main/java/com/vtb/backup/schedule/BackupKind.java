package com.vtb.backup.schedule;

import java.util.Locale;

/**
 * Вид резервного копирования в политике БД
 */
public enum BackupKind {
    LOG,
    DIFFERENTIAL,
    INCREMENTAL,
    FULL;

    /**
     * Вид по значению policyType/backupType; CopyOnly и неизвестные значения не имеют периодичности
     */
    public static BackupKind fromPolicyType(String type) {
        if (type == null) {
            return null;
        }
        String value = type.trim().toLowerCase(Locale.ROOT);
        if (value.contains("copyonly")) {
            return null;
        }
        return switch (value) {
            case "log", "transactionlog" -> LOG;
            case "differential", "diff" -> DIFFERENTIAL;
            case "incremental" -> INCREMENTAL;
            case "full", "snapshotfull" -> FULL;
            default -> null;
        };
    }
}

package com.vtb.backup.models;

import java.util.Locale;

/**
 * Состояние soft delete в едином словаре.
 * API разных поколений отдают On/Off, Enabled/Disabled и AlwaysON.
 */
public enum SoftDeleteState {
    ENABLED,
    ALWAYS_ON,
    DISABLED,
    UNKNOWN;

    public static SoftDeleteState normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
        return switch (value) {
            case "on", "enabled", "enable", "true" -> ENABLED;
            case "alwayson" -> ALWAYS_ON;
            case "off", "disabled", "disable", "false" -> DISABLED;
            default -> UNKNOWN;
        };
    }

    public boolean isResolved() {
        return this != UNKNOWN;
    }

    public boolean isProtective() {
        return this == ENABLED || this == ALWAYS_ON;
    }
}

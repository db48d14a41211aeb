package com.vtb.backup.models;

/**
 * Откуда получена периодичность резервного копирования
 */
public enum RpoSource {
    POLICY("Policy"),
    RECOVERY_POINTS("RecoveryPoints"),
    PITR("PITR"),
    NONE("None");

    private final String label;

    RpoSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

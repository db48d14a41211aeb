package com.vtb.backup.models;

import java.util.Locale;

/**
 * Семейство хранилищ резервных копий
 */
public enum VaultFamily {
    RECOVERY_SERVICES("Microsoft.RecoveryServices/vaults"),
    BACKUP_VAULT("Microsoft.DataProtection/backupVaults");

    private final String resourceType;

    VaultFamily(String resourceType) {
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }

    public static VaultFamily fromResourceType(String type) {
        if (type == null) {
            return null;
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        for (VaultFamily family : values()) {
            if (family.resourceType.toLowerCase(Locale.ROOT).equals(normalized)) {
                return family;
            }
        }
        return null;
    }
}

package com.vtb.backup.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Итоговое состояние защищенности хранилища (одна запись на хранилище).
 * securityLevel всегда вычисляется из остальных полей.
 */
@Value
@Builder
public class VaultPosture {
    String vaultId;
    String vaultName;
    String subscriptionId;
    String resourceGroup;
    String location;
    VaultFamily family;
    String storageRedundancy;
    Boolean crossRegionRestore;
    String crossSubscriptionRestore;
    @Builder.Default
    SoftDeleteState softDeleteState = SoftDeleteState.UNKNOWN;
    Integer softDeleteRetentionDays;
    Boolean hybridSecurityEnabled;
    Boolean multiUserAuthorization;
    String immutability;
    SecurityLevel securityLevel;
    @Builder.Default
    List<String> resolvedFrom = List.of();

    public static SecurityLevel deriveSecurityLevel(Boolean hybridSecurityEnabled,
                                                    Boolean multiUserAuthorization,
                                                    SoftDeleteState softDeleteState) {
        if (Boolean.TRUE.equals(hybridSecurityEnabled)
            || Boolean.TRUE.equals(multiUserAuthorization)
            || (softDeleteState != null && softDeleteState.isProtective())) {
            return SecurityLevel.ENHANCED;
        }
        return SecurityLevel.STANDARD;
    }
}

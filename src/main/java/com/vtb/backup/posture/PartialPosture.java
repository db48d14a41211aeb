package com.vtb.backup.posture;

import com.vtb.backup.models.SoftDeleteState;
import lombok.Data;

/**
 * Частично известное состояние хранилища из одного источника.
 * При слиянии более ранний (более авторитетный) источник выигрывает,
 * последующие только заполняют пробелы.
 */
@Data
public class PartialPosture {
    private String storageRedundancy;
    private Boolean crossRegionRestore;
    private String crossSubscriptionRestore;
    private SoftDeleteState softDeleteState = SoftDeleteState.UNKNOWN;
    private Integer softDeleteRetentionDays;
    private Boolean hybridSecurityEnabled;
    private Boolean multiUserAuthorization;
    private String immutability;

    /**
     * Заполнить только отсутствующие поля значениями из менее авторитетного источника
     */
    public void fillFrom(PartialPosture other) {
        if (other == null) {
            return;
        }
        if (storageRedundancy == null) {
            storageRedundancy = other.storageRedundancy;
        }
        if (crossRegionRestore == null) {
            crossRegionRestore = other.crossRegionRestore;
        }
        if (crossSubscriptionRestore == null) {
            crossSubscriptionRestore = other.crossSubscriptionRestore;
        }
        if (softDeleteState == null || !softDeleteState.isResolved()) {
            softDeleteState = other.softDeleteState != null ? other.softDeleteState : SoftDeleteState.UNKNOWN;
        }
        if (softDeleteRetentionDays == null) {
            softDeleteRetentionDays = other.softDeleteRetentionDays;
        }
        if (hybridSecurityEnabled == null) {
            hybridSecurityEnabled = other.hybridSecurityEnabled;
        }
        if (multiUserAuthorization == null) {
            multiUserAuthorization = other.multiUserAuthorization;
        }
        if (immutability == null) {
            immutability = other.immutability;
        }
    }

    /**
     * Все ключевые поля известны, дальнейшие источники не нужны
     */
    public boolean isComplete() {
        return softDeleteState != null && softDeleteState.isResolved()
            && softDeleteRetentionDays != null
            && storageRedundancy != null
            && crossSubscriptionRestore != null;
    }

    public boolean isEmpty() {
        return storageRedundancy == null
            && crossRegionRestore == null
            && crossSubscriptionRestore == null
            && (softDeleteState == null || !softDeleteState.isResolved())
            && softDeleteRetentionDays == null
            && hybridSecurityEnabled == null
            && multiUserAuthorization == null
            && immutability == null;
    }
}

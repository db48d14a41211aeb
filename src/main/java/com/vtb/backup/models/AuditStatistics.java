package com.vtb.backup.models;

import lombok.Builder;
import lombok.Data;

/**
 * Статистика прогона аудита
 */
@Data
@Builder
public class AuditStatistics {
    private int subscriptions;
    private int vaults;
    private int protectedItems;
    private int managedDatabasesWithPitr;
    private int inventoryResources;
    private int uncoveredResources;
    private int itemsWithPolicyCadence;
    private int itemsWithEmpiricalRpo;
    private int itemsWithUnknownRpo;
    private int totalFindings;
    private int highFindings;
    private int mediumFindings;
    private int lowFindings;
    private int infoFindings;
    private long auditDurationMs;
}

package com.vtb.backup.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.VaultFamily;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.models.WorkloadClass;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ProtectedItemNormalizerTest {

    private static final VaultReference RS_VAULT = VaultReference.builder()
        .id("/subscriptions/s1/resourceGroups/rg/providers/Microsoft.RecoveryServices/vaults/rsv")
        .name("rsv")
        .family(VaultFamily.RECOVERY_SERVICES)
        .build();

    private final ObjectMapper mapper = new ObjectMapper();
    private final ProtectedItemNormalizer normalizer = new ProtectedItemNormalizer();

    @Test
    void normalizesVmItem() throws Exception {
        ProtectedItem item = normalizer.normalize(mapper.readTree("""
            {"id":"/subscriptions/s1/resourceGroups/rg/providers/Microsoft.RecoveryServices/vaults/rsv/backupFabrics/Azure/protectionContainers/c1/protectedItems/vm1",
             "name":"VM;iaasvmcontainerv2;app;vm1",
             "properties":{"friendlyName":"vm1","protectedItemType":"Microsoft.Compute/virtualMachines",
               "virtualMachineId":"/subscriptions/S1/resourceGroups/App-RG/providers/Microsoft.Compute/virtualMachines/VM1",
               "policyId":"/subscriptions/s1/resourceGroups/rg/providers/Microsoft.RecoveryServices/vaults/rsv/backupPolicies/DefaultPolicy",
               "lastBackupStatus":"Completed","lastBackupTime":"2024-04-30T02:10:00Z",
               "protectionState":"Protected","workloadType":"VM"}}
            """), RS_VAULT, "ManagementType").orElseThrow();

        assertEquals("/subscriptions/s1/resourcegroups/app-rg/providers/microsoft.compute/virtualmachines/vm1",
            item.getSourceResourceId());
        assertEquals("App-RG", item.getSourceResourceGroup());
        assertEquals("DefaultPolicy", item.getPolicyName());
        assertEquals(Instant.parse("2024-04-30T02:10:00Z"), item.getLastBackupTime());
        assertEquals(WorkloadClass.VIRTUAL_MACHINE, item.getWorkloadClass());
        assertEquals("rsv", item.getVaultName());
        assertEquals("ManagementType", item.getDiscoveredBy());
        assertFalse(item.isUnhealthy());
    }

    @Test
    void normalizesSqlWorkloadItem() throws Exception {
        ProtectedItem item = normalizer.normalize(mapper.readTree("""
            {"id":"/x/protectedItems/SQLDataBase;mssqlserver;sales",
             "properties":{"friendlyName":"sales","workloadType":"SQLDataBase",
               "sourceResourceId":"/subscriptions/s1/resourceGroups/db-rg/providers/Microsoft.Compute/virtualMachines/sqlvm",
               "protectionState":"ProtectionStopped","lastBackupStatus":"Healthy"}}
            """), RS_VAULT, "RestFallback").orElseThrow();

        assertEquals(WorkloadClass.VAULT_DATABASE, item.getWorkloadClass());
        assertTrue(item.isUnhealthy());
    }

    @Test
    void normalizesBackupInstance() throws Exception {
        VaultReference backupVault = VaultReference.builder()
            .id("/subscriptions/s1/resourceGroups/rg/providers/Microsoft.DataProtection/backupVaults/bv")
            .name("bv")
            .family(VaultFamily.BACKUP_VAULT)
            .build();

        ProtectedItem item = normalizer.normalize(mapper.readTree("""
            {"id":"/subscriptions/s1/resourceGroups/rg/providers/Microsoft.DataProtection/backupVaults/bv/backupInstances/pg1",
             "name":"pg1",
             "properties":{"friendlyName":"pg1",
               "dataSourceInfo":{"resourceID":"/subscriptions/s1/resourceGroups/pg/providers/Microsoft.DBforPostgreSQL/flexibleServers/pg1",
                 "datasourceType":"Microsoft.DBforPostgreSQL/flexibleServers"},
               "policyInfo":{"policyId":"/subscriptions/s1/resourceGroups/rg/providers/Microsoft.DataProtection/backupVaults/bv/backupPolicies/daily"},
               "currentProtectionState":"ProtectionConfigured",
               "protectionStatus":{"status":"ProtectionConfigured"}}}
            """), backupVault, "ManagementType").orElseThrow();

        assertEquals("/subscriptions/s1/resourcegroups/pg/providers/microsoft.dbforpostgresql/flexibleservers/pg1",
            item.getSourceResourceId());
        assertEquals("daily", item.getPolicyName());
        assertEquals("ProtectionConfigured", item.getProtectionState());
        assertEquals(WorkloadClass.VAULT_DATABASE, item.getWorkloadClass());
    }

    @Test
    void itemWithoutSourceIsDropped() throws Exception {
        assertTrue(normalizer.normalize(mapper.readTree("{\"properties\":{\"friendlyName\":\"x\"}}"), RS_VAULT, "x").isEmpty());
    }
}

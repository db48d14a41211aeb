package com.vtb.backup.core;

import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.http.ArmStubServer;
import com.vtb.backup.models.AuditResult;
import com.vtb.backup.models.CoverageRecord;
import com.vtb.backup.models.Finding;
import com.vtb.backup.models.FindingCategory;
import com.vtb.backup.models.InventoryResource;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.RpoSource;
import com.vtb.backup.models.SecurityLevel;
import com.vtb.backup.models.Severity;
import com.vtb.backup.models.WorkloadClass;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackupAuditorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String VAULT_ID = "/subscriptions/sub1/resourceGroups/rg/providers/Microsoft.RecoveryServices/vaults/vault1";
    private static final String POLICY_ID = VAULT_ID + "/backupPolicies/DefaultPolicy";
    private static final String VM_PREFIX = "/subscriptions/sub1/resourceGroups/app/providers/Microsoft.Compute/virtualMachines/";

    private ArmStubServer server;
    private BackupAuditor auditor;

    @BeforeEach
    void setUp() throws Exception {
        server = new ArmStubServer();
        AuditConfig config = AuditConfig.defaults();
        config.setHttp(server.httpSettings());
        auditor = new BackupAuditor(config, server.client(), Clock.fixed(NOW, ZoneOffset.UTC));

        server.json("/subscriptions/sub1/providers/Microsoft.RecoveryServices/vaults",
            "{\"value\":[{\"id\":\"" + VAULT_ID + "\",\"name\":\"vault1\",\"location\":\"westeurope\"}]}");
        server.json(VAULT_ID, """
            {"id":"%s","name":"vault1","properties":{
              "redundancySettings":{"standardTierStorageRedundancy":"GeoRedundant","crossRegionRestore":"Enabled"},
              "restoreSettings":{"crossSubscriptionRestoreSettings":{"crossSubscriptionRestoreState":"Enabled"}},
              "securitySettings":{
                "softDeleteSettings":{"softDeleteState":"AlwaysON","softDeleteRetentionPeriodInDays":14},
                "immutabilitySettings":{"state":"Locked"}}}}
            """.formatted(VAULT_ID));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void emptyPolicyFallsBackToRecoveryPoints() {
        protectItems(item("vm1", null));
        server.json(itemId("vm1") + "/recoveryPoints", points("2024-04-30T10:00:00Z", "2024-05-01T10:00:00Z"));

        AuditResult result = auditor.audit(List.of("sub1"), List.of(
            inventory((VM_PREFIX + "vm1").toUpperCase()),
            inventory(VM_PREFIX + "vm2")));

        assertEquals(1, result.getVaultPostures().size());
        assertEquals(SecurityLevel.ENHANCED, result.getVaultPostures().get(0).getSecurityLevel());

        ProtectedItem item = result.getProtectedItems().get(0);
        assertNull(item.getConfiguredCadence());
        assertEquals(RpoSource.RECOVERY_POINTS, item.getRpoSource());
        assertEquals(2.0, item.getObservedRpoHours(), 0.0);
        assertEquals(24.0, item.getInferredCadenceHours(), 0.0);

        CoverageRecord covered = result.getCoverage().get(0);
        assertTrue(covered.isProtected());
        assertEquals("Vault:vault1", covered.getMethod());
        assertFalse(result.getCoverage().get(1).isProtected());

        assertTrue(result.getFindings().stream()
            .noneMatch(finding -> finding.getCategory() == FindingCategory.RPO_THRESHOLD_EXCEEDED));
        Finding unprotected = result.getFindings().get(0);
        assertEquals(FindingCategory.UNPROTECTED_RESOURCE, unprotected.getCategory());
        assertEquals(Severity.HIGH, unprotected.getSeverity());

        assertEquals(1, result.getStatistics().getVaults());
        assertEquals(1, result.getStatistics().getUncoveredResources());
        assertEquals(1, result.getStatistics().getItemsWithEmpiricalRpo());
        assertTrue(result.hasHighFindings());
    }

    @Test
    void policyIsFetchedOncePerRun() {
        protectItems(item("vm1", POLICY_ID), item("vm2", POLICY_ID));
        server.json(POLICY_ID, """
            {"id":"%s","properties":{"backupManagementType":"AzureIaasVM",
              "schedulePolicy":{"schedulePolicyType":"SimpleSchedulePolicy","scheduleRunFrequency":"Daily",
                "scheduleRunTimes":["2024-01-01T02:00:00Z","2024-01-01T14:00:00Z"]}}}
            """.formatted(POLICY_ID));
        server.json(itemId("vm1") + "/recoveryPoints", points("2024-05-01T00:00:00Z", "2024-05-01T11:00:00Z"));
        server.json(itemId("vm2") + "/recoveryPoints", points("2024-04-29T00:00:00Z", "2024-04-29T12:00:00Z"));

        AuditResult result = auditor.audit(List.of("sub1"), List.of());

        assertEquals(1, server.hits(POLICY_ID));
        assertEquals(2, result.getProtectedItems().size());
        for (ProtectedItem item : result.getProtectedItems()) {
            assertEquals(RpoSource.POLICY, item.getRpoSource());
            assertEquals("Every 12 hours", item.getConfiguredCadence());
            assertEquals(12.0, item.getConfiguredCadenceHours(), 0.0);
        }
        ProtectedItem stale = result.getProtectedItems().get(1);
        assertEquals(48.0, stale.getObservedRpoHours(), 0.0);
        assertTrue(result.getFindings().stream().anyMatch(finding ->
            finding.getCategory() == FindingCategory.RPO_THRESHOLD_EXCEEDED
                && finding.getSeverity() == Severity.HIGH
                && finding.getSubject().equals(stale.getSourceResourceId())));
    }

    @Test
    void failingRecoveryPointsStillProduceRow() {
        protectItems(item("vm1", null));
        server.sequence(itemId("vm1") + "/recoveryPoints", ArmStubServer.StubResponse.status(503));

        AuditResult result = auditor.audit(List.of("sub1"), List.of());

        assertEquals(5, server.hits(itemId("vm1") + "/recoveryPoints"));
        ProtectedItem item = result.getProtectedItems().get(0);
        assertNull(item.getObservedRpoHours());
        assertEquals(RpoSource.NONE, item.getRpoSource());
        assertTrue(result.getFindings().stream()
            .anyMatch(finding -> finding.getCategory() == FindingCategory.RPO_UNKNOWN));
        assertEquals(1, result.getStatistics().getItemsWithUnknownRpo());
        assertTrue(result.getTelemetry().getRetries() > 0);
    }

    @Test
    void managedDatabaseWithContinuousPointsIsProtectedByPitr() {
        String database = "/subscriptions/sub1/resourceGroups/data/providers/Microsoft.Sql/servers/sql1/databases/orders";
        server.json(database + "/restorePoints", """
            {"value":[
              {"properties":{"restorePointType":"CONTINUOUS","restorePointCreationDate":"2024-05-01T11:00:00Z"}},
              {"properties":{"restorePointType":"CONTINUOUS","restorePointCreationDate":"2024-05-01T10:00:00Z"}}]}
            """);
        InventoryResource resource = InventoryResource.builder()
            .id(database)
            .name("orders")
            .resourceGroup("data")
            .workloadClass(WorkloadClass.MANAGED_DATABASE)
            .build();

        AuditResult result = auditor.audit(List.of(), List.of(resource));

        ProtectedItem item = result.getProtectedItems().get(0);
        assertEquals(RpoSource.PITR, item.getRpoSource());
        assertEquals(1.0, item.getObservedRpoHours(), 0.0);
        assertEquals(BackupAuditor.METHOD_PITR, result.getCoverage().get(0).getMethod());
        assertEquals(1, result.getStatistics().getManagedDatabasesWithPitr());
        assertTrue(result.getFindings().isEmpty());
    }

    @Test
    void continuousRestorePointWithoutCreationDateStillCoversDatabase() {
        String database = "/subscriptions/sub1/resourceGroups/data/providers/Microsoft.Sql/servers/sql1/databases/billing";
        server.json(database + "/restorePoints", """
            {"value":[{"id":"%s/restorePoints/continuous","name":"continuous",
              "properties":{"restorePointType":"CONTINUOUS","earliestRestoreDate":"2024-04-24T12:00:00Z"}}]}
            """.formatted(database));
        InventoryResource resource = InventoryResource.builder()
            .id(database)
            .name("billing")
            .workloadClass(WorkloadClass.MANAGED_DATABASE)
            .build();

        AuditResult result = auditor.audit(List.of(), List.of(resource));

        CoverageRecord record = result.getCoverage().get(0);
        assertTrue(record.isProtected());
        assertEquals(BackupAuditor.METHOD_PITR, record.getMethod());

        ProtectedItem item = result.getProtectedItems().get(0);
        assertNull(item.getObservedRpoHours());
        assertEquals(RpoSource.NONE, item.getRpoSource());

        assertEquals(1, result.getFindings().size());
        assertEquals(FindingCategory.RPO_UNKNOWN, result.getFindings().get(0).getCategory());
        assertEquals(Severity.INFO, result.getFindings().get(0).getSeverity());
    }

    @Test
    void databaseWithoutContinuousPointsIsUncovered() {
        String database = "/subscriptions/sub1/resourceGroups/data/providers/Microsoft.Sql/servers/sql1/databases/archive";
        server.json(database + "/restorePoints", """
            {"value":[{"properties":{"restorePointType":"DISCRETE","restorePointCreationDate":"2024-05-01T06:00:00Z"}}]}
            """);
        InventoryResource resource = InventoryResource.builder()
            .id(database)
            .name("archive")
            .workloadClass(WorkloadClass.MANAGED_DATABASE)
            .build();

        AuditResult result = auditor.audit(List.of(), List.of(resource));

        assertTrue(result.getProtectedItems().isEmpty());
        assertFalse(result.getCoverage().get(0).isProtected());
        assertEquals(FindingCategory.UNPROTECTED_RESOURCE, result.getFindings().get(0).getCategory());
    }

    private void protectItems(String... items) {
        String page = "{\"value\":[" + String.join(",", items) + "]}";
        server.route(VAULT_ID + "/backupProtectedItems", query ->
            query.getOrDefault("$filter", "").contains("AzureIaasVM")
                ? ArmStubServer.StubResponse.json(page)
                : ArmStubServer.StubResponse.json("{\"value\":[]}"));
    }

    private static String itemId(String vm) {
        return VAULT_ID + "/backupFabrics/Azure/protectionContainers/c1/protectedItems/" + vm;
    }

    private static String item(String vm, String policyId) {
        return """
            {"id":"%s","name":"%s","properties":{"friendlyName":"%s","workloadType":"VM",
              "protectionState":"Protected","sourceResourceId":"%s"%s}}
            """.formatted(itemId(vm), vm, vm, VM_PREFIX + vm,
            policyId != null ? ",\"policyId\":\"" + policyId + "\"" : "");
    }

    private static String points(String older, String newer) {
        return """
            {"value":[
              {"properties":{"recoveryPointType":"AppConsistent","recoveryPointTime":"%s"}},
              {"properties":{"recoveryPointType":"CrashConsistent","recoveryPointTime":"%s"}}]}
            """.formatted(newer, older);
    }

    private static InventoryResource inventory(String id) {
        return InventoryResource.builder()
            .id(id)
            .name(id.substring(id.lastIndexOf('/') + 1))
            .powerState("VM running")
            .build();
    }
}

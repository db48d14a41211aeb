package com.vtb.backup.config;

import com.vtb.backup.models.WorkloadClass;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditConfigTest {

    @Test
    void classpathConfigMatchesDefaults() {
        AuditConfig config = AuditConfig.load();

        assertEquals("https://management.azure.com", config.getHttp().getBaseUrl());
        assertEquals(4, config.getHttp().getMaxRetries());
        assertEquals(List.of(429, 500, 502, 503, 504), config.getHttp().getRetryableStatuses());
        assertEquals("$skiptoken", config.getHttp().getContinuationQueryParam());
        assertEquals(List.of("2023-02-01", "2021-12-01", "2019-05-13"), config.getApiVersions().getProtectedItems());
        assertEquals(20, config.getCadence().getToleranceMinutes());
    }

    @Test
    void partialFileKeepsDefaultsForMissingSections() throws Exception {
        String yaml = """
            thresholds:
              virtualMachine:
                warningHours: 12
            unknownSection: true
            """;

        AuditConfig config = AuditConfig.read(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        AuditConfig.Threshold vm = config.getThresholds().forClass(WorkloadClass.VIRTUAL_MACHINE);
        assertEquals(12.0, vm.getWarningHours(), 0.0);
        assertEquals(48.0, vm.getCriticalHours(), 0.0);
        assertEquals(26.0, config.getThresholds().forClass(WorkloadClass.VAULT_DATABASE).getCriticalHours(), 0.0);
        assertEquals(14, config.getPosture().getMinimumRetentionDays());
        assertNotNull(config.getHttp());
    }

    @Test
    void defaultsWithoutFile() {
        AuditConfig config = AuditConfig.defaults();

        assertEquals(2.0, config.getThresholds().forClass(WorkloadClass.MANAGED_DATABASE).getWarningHours(), 0.0);
        assertEquals(List.of(1, 2, 3, 4, 6, 8, 12, 24), config.getCadence().getCanonicalHours());
    }
}

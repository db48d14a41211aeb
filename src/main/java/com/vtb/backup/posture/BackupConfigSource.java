package com.vtb.backup.posture;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.http.ArmResponse;
import com.vtb.backup.http.ResilientGetClient;
import com.vtb.backup.models.SoftDeleteState;
import com.vtb.backup.models.VaultFamily;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.util.JsonFields;

import java.util.Optional;

/**
 * Конфигурация резервного копирования Recovery Services vault (backupconfig).
 * Опрашивается отдельно для текущего и устаревшего поколения API.
 */
public class BackupConfigSource implements PostureSource {

    private final ResilientGetClient client;
    private final String apiVersion;
    private final String label;

    public BackupConfigSource(ResilientGetClient client, String apiVersion, String label) {
        this.client = client;
        this.apiVersion = apiVersion;
        this.label = label;
    }

    @Override
    public String name() {
        return "backupconfig(" + label + ")";
    }

    @Override
    public Optional<PartialPosture> attempt(VaultReference vault) {
        if (vault.getFamily() != VaultFamily.RECOVERY_SERVICES) {
            return Optional.empty();
        }
        return client.get(vault.getId() + "/backupconfig/vaultconfig?api-version=" + apiVersion)
            .map(ArmResponse::getBody)
            .map(BackupConfigSource::parse);
    }

    static PartialPosture parse(JsonNode body) {
        JsonNode properties = JsonFields.properties(body);
        PartialPosture posture = new PartialPosture();
        posture.setSoftDeleteState(SoftDeleteState.normalize(JsonFields.text(properties, "softDeleteFeatureState")));
        posture.setSoftDeleteRetentionDays(JsonFields.integer(properties, "softDeleteRetentionPeriodInDays"));
        String enhancedSecurity = JsonFields.text(properties, "enhancedSecurityState");
        if (enhancedSecurity != null) {
            posture.setHybridSecurityEnabled(enhancedSecurity.equalsIgnoreCase("Enabled"));
        }
        JsonNode resourceGuard = JsonFields.field(properties, "resourceGuardOperationRequests");
        if (resourceGuard != null && resourceGuard.isArray() && resourceGuard.size() > 0) {
            posture.setMultiUserAuthorization(Boolean.TRUE);
        }
        return posture;
    }
}

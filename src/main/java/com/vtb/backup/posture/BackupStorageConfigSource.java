package com.vtb.backup.posture;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.http.ArmResponse;
import com.vtb.backup.http.ResilientGetClient;
import com.vtb.backup.models.VaultFamily;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.util.JsonFields;

import java.util.Optional;

/**
 * Конфигурация хранения Recovery Services vault (backupstorageconfig):
 * тип избыточности и флаг восстановления в другом регионе.
 */
public class BackupStorageConfigSource implements PostureSource {

    private final ResilientGetClient client;
    private final AuditConfig.ApiVersions apiVersions;

    public BackupStorageConfigSource(ResilientGetClient client, AuditConfig.ApiVersions apiVersions) {
        this.client = client;
        this.apiVersions = apiVersions;
    }

    @Override
    public String name() {
        return "backupstorageconfig";
    }

    @Override
    public Optional<PartialPosture> attempt(VaultReference vault) {
        if (vault.getFamily() != VaultFamily.RECOVERY_SERVICES) {
            return Optional.empty();
        }
        return client.get(vault.getId() + "/backupstorageconfig/vaultstorageconfig?api-version="
                + apiVersions.getBackupStorageConfig())
            .map(ArmResponse::getBody)
            .map(BackupStorageConfigSource::parse);
    }

    static PartialPosture parse(JsonNode body) {
        JsonNode properties = JsonFields.properties(body);
        PartialPosture posture = new PartialPosture();
        posture.setStorageRedundancy(JsonFields.text(JsonFields.firstField(properties,
            "storageModelType", "storageType")));
        posture.setCrossRegionRestore(JsonFields.bool(properties, "crossRegionRestoreFlag"));
        return posture;
    }
}

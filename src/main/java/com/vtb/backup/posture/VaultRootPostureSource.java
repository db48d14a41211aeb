package com.vtb.backup.posture;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.http.ArmResponse;
import com.vtb.backup.http.ResilientGetClient;
import com.vtb.backup.models.SoftDeleteState;
import com.vtb.backup.models.VaultFamily;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.util.JsonFields;

import java.util.Optional;

/**
 * Корневые свойства хранилища: самая новая и полная форма, высший приоритет.
 * Понимает оба семейства (Recovery Services и Backup vault).
 */
public class VaultRootPostureSource implements PostureSource {

    private final ResilientGetClient client;
    private final AuditConfig.ApiVersions apiVersions;

    public VaultRootPostureSource(ResilientGetClient client, AuditConfig.ApiVersions apiVersions) {
        this.client = client;
        this.apiVersions = apiVersions;
    }

    @Override
    public String name() {
        return "vault";
    }

    @Override
    public Optional<PartialPosture> attempt(VaultReference vault) {
        String apiVersion = vault.getFamily() == VaultFamily.BACKUP_VAULT
            ? apiVersions.getBackupVaults()
            : apiVersions.getRecoveryServicesVaults();
        return client.get(vault.getId() + "?api-version=" + apiVersion)
            .map(ArmResponse::getBody)
            .map(VaultRootPostureSource::parse);
    }

    static PartialPosture parse(JsonNode vault) {
        JsonNode properties = JsonFields.properties(vault);
        PartialPosture posture = new PartialPosture();

        posture.setStorageRedundancy(firstText(properties,
            new String[]{"redundancySettings", "standardTierStorageRedundancy"},
            new String[]{"storageSettings", "0", "type"}));
        posture.setCrossRegionRestore(firstBool(properties,
            new String[]{"redundancySettings", "crossRegionRestore"},
            new String[]{"featureSettings", "crossRegionRestoreSettings", "state"}));
        posture.setCrossSubscriptionRestore(firstText(properties,
            new String[]{"restoreSettings", "crossSubscriptionRestoreSettings", "crossSubscriptionRestoreState"},
            new String[]{"featureSettings", "crossSubscriptionRestoreSettings", "state"}));

        JsonNode softDelete = JsonFields.path(properties, "securitySettings", "softDeleteSettings");
        posture.setSoftDeleteState(SoftDeleteState.normalize(
            JsonFields.text(JsonFields.firstField(softDelete, "softDeleteState", "state"))));
        posture.setSoftDeleteRetentionDays(integerOf(
            JsonFields.firstField(softDelete, "softDeleteRetentionPeriodInDays", "retentionDurationInDays")));

        String enhancedSecurity = JsonFields.text(softDelete, "enhancedSecurityState");
        if (enhancedSecurity != null) {
            posture.setHybridSecurityEnabled(enhancedSecurity.equalsIgnoreCase("Enabled"));
        }

        Boolean mua = JsonFields.bool(properties, "securitySettings", "multiUserAuthorization");
        JsonNode guardRequests = JsonFields.field(properties, "resourceGuardOperationRequests");
        if (guardRequests != null && guardRequests.isArray() && guardRequests.size() > 0) {
            mua = Boolean.TRUE;
        }
        posture.setMultiUserAuthorization(mua);

        posture.setImmutability(JsonFields.text(properties, "securitySettings", "immutabilitySettings", "state"));
        return posture;
    }

    private static String firstText(JsonNode node, String[]... paths) {
        for (String[] path : paths) {
            String value = JsonFields.text(resolve(node, path));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Boolean firstBool(JsonNode node, String[]... paths) {
        for (String[] path : paths) {
            JsonNode value = resolve(node, path);
            Boolean result = value != null ? JsonFields.bool(value) : null;
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /**
     * Путь с поддержкой числовых индексов массивов
     */
    private static JsonNode resolve(JsonNode node, String[] path) {
        JsonNode current = node;
        for (String segment : path) {
            if (current == null) {
                return null;
            }
            if (current.isArray() && segment.chars().allMatch(Character::isDigit)) {
                current = current.get(Integer.parseInt(segment));
            } else {
                current = JsonFields.field(current, segment);
            }
        }
        return current;
    }

    private static Integer integerOf(JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        if (value.isNumber()) {
            return value.intValue();
        }
        try {
            return (int) Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

package com.vtb.backup.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.models.WorkloadClass;
import com.vtb.backup.util.JsonFields;
import com.vtb.backup.util.ResourceIds;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Optional;

/**
 * Приведение защищенного ресурса к общей форме независимо от стратегии,
 * которой он найден, и семейства хранилища.
 */
@Slf4j
public class ProtectedItemNormalizer {

    private static final String[] SOURCE_ID_FIELDS = {"sourceResourceId", "virtualMachineId"};
    private static final String[] LAST_BACKUP_FIELDS = {"lastBackupTime", "lastRecoveryPoint"};
    private static final String[] STATE_FIELDS = {"protectionState", "currentProtectionState", "protectionStatus"};

    public Optional<ProtectedItem> normalize(JsonNode resource, VaultReference vault, String discoveredBy) {
        if (resource == null || !resource.isObject()) {
            return Optional.empty();
        }
        JsonNode properties = JsonFields.properties(resource);

        String rawSourceId = JsonFields.text(JsonFields.firstField(properties, SOURCE_ID_FIELDS));
        if (rawSourceId == null) {
            rawSourceId = JsonFields.text(properties, "dataSourceInfo", "resourceID");
        }
        if (rawSourceId == null) {
            log.debug("Защищенный ресурс без исходного идентификатора: {}", JsonFields.text(resource, "id"));
            return Optional.empty();
        }

        Optional<ResourceIds.ResourceId> parsed = ResourceIds.parse(rawSourceId);
        String sourceId = parsed.map(ResourceIds.ResourceId::normalized).orElse(ResourceIds.normalize(rawSourceId));

        String policyId = JsonFields.text(properties, "policyId");
        if (policyId == null) {
            policyId = JsonFields.text(properties, "policyInfo", "policyId");
        }
        String policyName = JsonFields.text(properties, "policyName");
        if (policyName == null && policyId != null) {
            policyName = ResourceIds.lastSegment(policyId);
        }

        String workloadType = JsonFields.text(JsonFields.firstField(properties, "workloadType", "protectedItemType"));
        if (workloadType == null) {
            workloadType = JsonFields.text(properties, "dataSourceInfo", "datasourceType");
        }

        String itemName = JsonFields.text(properties, "friendlyName");
        if (itemName == null) {
            itemName = JsonFields.text(resource, "name");
        }

        return Optional.of(ProtectedItem.builder()
            .itemId(JsonFields.text(resource, "id"))
            .itemName(itemName)
            .vaultId(vault.getId())
            .vaultName(vault.getName())
            .sourceResourceId(sourceId)
            .sourceResourceGroup(parsed.map(ResourceIds.ResourceId::resourceGroup).orElse(null))
            .sourceResourceType(parsed.map(ResourceIds.ResourceId::providerType).orElse(null))
            .policyId(policyId)
            .policyName(policyName)
            .lastBackupTime(JsonFields.instant(JsonFields.text(JsonFields.firstField(properties, LAST_BACKUP_FIELDS))))
            .lastBackupStatus(JsonFields.text(properties, "lastBackupStatus"))
            .protectionState(protectionState(properties))
            .workloadType(workloadType)
            .workloadClass(classify(workloadType))
            .discoveredBy(discoveredBy)
            .build());
    }

    private String protectionState(JsonNode properties) {
        JsonNode state = JsonFields.firstField(properties, STATE_FIELDS);
        if (state == null) {
            return null;
        }
        if (state.isObject()) {
            return JsonFields.text(state, "status");
        }
        return JsonFields.text(state);
    }

    static WorkloadClass classify(String workloadType) {
        if (workloadType == null) {
            return WorkloadClass.VIRTUAL_MACHINE;
        }
        String value = workloadType.toLowerCase(Locale.ROOT);
        if (value.contains("sql") || value.contains("hana") || value.contains("database")
            || value.contains("dbfor")) {
            return WorkloadClass.VAULT_DATABASE;
        }
        return WorkloadClass.VIRTUAL_MACHINE;
    }
}

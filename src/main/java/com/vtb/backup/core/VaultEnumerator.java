package com.vtb.backup.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.models.VaultFamily;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.pagination.PageWalker;
import com.vtb.backup.util.JsonFields;
import com.vtb.backup.util.ResourceIds;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Перечисление хранилищ обоих семейств в подписке
 */
@Slf4j
public class VaultEnumerator {

    private final PageWalker walker;
    private final AuditConfig.ApiVersions apiVersions;

    public VaultEnumerator(PageWalker walker, AuditConfig.ApiVersions apiVersions) {
        this.walker = walker;
        this.apiVersions = apiVersions;
    }

    public List<VaultReference> enumerate(String subscriptionId) {
        List<VaultReference> vaults = new ArrayList<>();
        vaults.addAll(list(subscriptionId, VaultFamily.RECOVERY_SERVICES, apiVersions.getRecoveryServicesVaults()));
        vaults.addAll(list(subscriptionId, VaultFamily.BACKUP_VAULT, apiVersions.getBackupVaults()));
        return vaults;
    }

    private List<VaultReference> list(String subscriptionId, VaultFamily family, String apiVersion) {
        String url = "/subscriptions/" + subscriptionId + "/providers/" + family.getResourceType()
            + "?api-version=" + apiVersion;
        List<VaultReference> vaults = new ArrayList<>();
        for (JsonNode resource : walker.walk(url)) {
            String id = JsonFields.text(resource, "id");
            if (id == null) {
                log.debug("Хранилище без идентификатора в подписке {}", subscriptionId);
                continue;
            }
            String name = JsonFields.text(resource, "name");
            vaults.add(VaultReference.builder()
                .id(id)
                .name(name != null ? name : ResourceIds.lastSegment(id))
                .subscriptionId(subscriptionId)
                .resourceGroup(ResourceIds.parse(id).map(ResourceIds.ResourceId::resourceGroup).orElse(null))
                .location(JsonFields.text(resource, "location"))
                .family(family)
                .build());
        }
        log.info("Подписка {}: {} хранилищ типа {}", subscriptionId, vaults.size(), family.getResourceType());
        return vaults;
    }
}

package com.vtb.backup.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.http.ResilientGetClient;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.VaultFamily;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.pagination.PageWalker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Стратегия 1: прямой список защищенных ресурсов по типу управления.
 * Для Backup vault это список backupInstances.
 */
@Slf4j
public class ManagementTypeListingStrategy extends VaultItemsStrategy {

    private final ResilientGetClient client;
    private final PageWalker walker;
    private final AuditConfig.ApiVersions apiVersions;
    private final List<String> managementTypes;

    public ManagementTypeListingStrategy(ResilientGetClient client,
                                         PageWalker walker,
                                         AuditConfig config,
                                         ProtectedItemNormalizer normalizer) {
        super(normalizer);
        this.client = client;
        this.walker = walker;
        this.apiVersions = config.getApiVersions();
        this.managementTypes = config.getDiscovery().getManagementTypes();
    }

    @Override
    public String name() {
        return "ManagementType";
    }

    @Override
    public Optional<List<ProtectedItem>> attempt(VaultReference vault) {
        if (vault.getFamily() == VaultFamily.BACKUP_VAULT) {
            String url = client.withQuery(vault.getId() + "/backupInstances",
                query(apiVersions.getBackupInstances(), null));
            return Optional.of(normalizeAll(walker.walk(url), vault));
        }

        List<JsonNode> resources = new ArrayList<>();
        for (String managementType : managementTypes) {
            String url = client.withQuery(vault.getId() + "/backupProtectedItems",
                query(apiVersions.getProtectedItems().get(0), "backupManagementType eq '" + managementType + "'"));
            List<JsonNode> page = walker.walk(url);
            log.debug("Хранилище {}: тип {} дал {} элементов", vault.getName(), managementType, page.size());
            resources.addAll(page);
        }
        return Optional.of(normalizeAll(resources, vault));
    }
}

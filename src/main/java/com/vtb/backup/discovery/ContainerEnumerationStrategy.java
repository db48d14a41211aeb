package com.vtb.backup.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.http.ResilientGetClient;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.VaultFamily;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.pagination.PageWalker;
import com.vtb.backup.util.JsonFields;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Стратегия 2: зарегистрированные контейнеры, затем защищенные ресурсы каждого контейнера
 */
@Slf4j
public class ContainerEnumerationStrategy extends VaultItemsStrategy {

    private final ResilientGetClient client;
    private final PageWalker walker;
    private final AuditConfig.ApiVersions apiVersions;
    private final List<String> managementTypes;

    public ContainerEnumerationStrategy(ResilientGetClient client,
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
        return "Containers";
    }

    @Override
    public Optional<List<ProtectedItem>> attempt(VaultReference vault) {
        if (vault.getFamily() != VaultFamily.RECOVERY_SERVICES) {
            return Optional.empty();
        }
        List<JsonNode> resources = new ArrayList<>();
        for (String managementType : managementTypes) {
            String containersUrl = client.withQuery(vault.getId() + "/backupProtectionContainers",
                query(apiVersions.getContainers(), "backupManagementType eq '" + managementType + "'"));
            for (JsonNode container : walker.walk(containersUrl)) {
                String containerId = JsonFields.text(container, "id");
                if (containerId == null) {
                    continue;
                }
                String itemsUrl = client.withQuery(containerId + "/protectedItems",
                    query(apiVersions.getContainers(), null));
                resources.addAll(walker.walk(itemsUrl));
            }
        }
        log.debug("Хранилище {}: через контейнеры найдено {} элементов", vault.getName(), resources.size());
        return Optional.of(normalizeAll(resources, vault));
    }
}

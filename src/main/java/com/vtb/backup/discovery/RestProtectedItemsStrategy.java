package com.vtb.backup.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.http.ResilientGetClient;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.VaultFamily;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.pagination.PageWalker;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Стратегия 3: перебор версий API и фильтров для backupProtectedItems.
 * Первая комбинация, давшая непустой список, завершает перебор.
 */
@Slf4j
public class RestProtectedItemsStrategy extends VaultItemsStrategy {

    private final ResilientGetClient client;
    private final PageWalker walker;
    private final List<String> apiVersions;
    private final List<String> filters;

    public RestProtectedItemsStrategy(ResilientGetClient client,
                                      PageWalker walker,
                                      AuditConfig config,
                                      ProtectedItemNormalizer normalizer) {
        super(normalizer);
        this.client = client;
        this.walker = walker;
        this.apiVersions = config.getApiVersions().getProtectedItems();
        this.filters = config.getDiscovery().getProtectedItemFilters();
    }

    @Override
    public String name() {
        return "RestFallback";
    }

    @Override
    public Optional<List<ProtectedItem>> attempt(VaultReference vault) {
        if (vault.getFamily() != VaultFamily.RECOVERY_SERVICES) {
            return Optional.empty();
        }
        for (String apiVersion : apiVersions) {
            for (String filter : filters) {
                String url = client.withQuery(vault.getId() + "/backupProtectedItems", query(apiVersion, filter));
                List<JsonNode> resources = walker.walk(url);
                if (!resources.isEmpty()) {
                    log.debug("Хранилище {}: api-version={}, фильтр '{}' дал {} элементов",
                        vault.getName(), apiVersion, filter, resources.size());
                    return Optional.of(normalizeAll(resources, vault));
                }
            }
        }
        return Optional.empty();
    }
}

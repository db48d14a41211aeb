package com.vtb.backup.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.VaultReference;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Общая часть стратегий: нормализация элементов и сборка адресов
 */
abstract class VaultItemsStrategy implements DiscoveryStrategy {

    protected final ProtectedItemNormalizer normalizer;

    protected VaultItemsStrategy(ProtectedItemNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    protected List<ProtectedItem> normalizeAll(List<JsonNode> resources, VaultReference vault) {
        List<ProtectedItem> items = new ArrayList<>();
        for (JsonNode resource : resources) {
            normalizer.normalize(resource, vault, name()).ifPresent(items::add);
        }
        return items;
    }

    protected static Map<String, String> query(String apiVersion, String filter) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("api-version", apiVersion);
        parameters.put("$filter", filter);
        return parameters;
    }
}

package com.vtb.backup.discovery;

import com.vtb.backup.http.AuthenticationException;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.VaultReference;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Поиск защищенных ресурсов хранилища цепочкой стратегий.
 * Стратегии пробуются по порядку до первого непустого результата; ошибка
 * стратегии переводит к следующей. Найденные ресурсы добавляются в общее множество.
 */
@Slf4j
public class ProtectedResourceSetBuilder {

    private final List<DiscoveryStrategy> strategies;

    public ProtectedResourceSetBuilder(List<DiscoveryStrategy> strategies) {
        this.strategies = new ArrayList<>(strategies);
    }

    /**
     * @return защищенные ресурсы хранилища без дублей (по исходному ресурсу)
     */
    public List<ProtectedItem> discover(VaultReference vault, ProtectedResourceSet protectedSet) {
        for (DiscoveryStrategy strategy : strategies) {
            Optional<List<ProtectedItem>> found = attempt(strategy, vault);
            if (found.isEmpty() || found.get().isEmpty()) {
                log.debug("Стратегия {} для хранилища {} ничего не нашла", strategy.name(), vault.getName());
                continue;
            }
            List<ProtectedItem> items = deduplicate(found.get());
            for (ProtectedItem item : items) {
                protectedSet.add(item.getSourceResourceId(), "Vault:" + vault.getName());
            }
            log.info("Хранилище {}: {} защищенных ресурсов (стратегия {})", vault.getName(), items.size(), strategy.name());
            return items;
        }
        log.info("Хранилище {}: защищенные ресурсы не найдены", vault.getName());
        return List.of();
    }

    private Optional<List<ProtectedItem>> attempt(DiscoveryStrategy strategy, VaultReference vault) {
        try {
            return strategy.attempt(vault);
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Стратегия {} для хранилища {} завершилась ошибкой: {}", strategy.name(), vault.getName(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    private List<ProtectedItem> deduplicate(List<ProtectedItem> items) {
        Map<String, ProtectedItem> unique = new LinkedHashMap<>();
        for (ProtectedItem item : items) {
            unique.putIfAbsent(item.getSourceResourceId(), item);
        }
        return new ArrayList<>(unique.values());
    }
}

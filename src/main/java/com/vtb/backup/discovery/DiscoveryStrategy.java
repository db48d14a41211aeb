package com.vtb.backup.discovery;

import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.VaultReference;

import java.util.List;
import java.util.Optional;

/**
 * Способ получения защищенных ресурсов хранилища
 */
public interface DiscoveryStrategy {

    String name();

    /**
     * @return найденные ресурсы; пусто или пустой список означает переход к следующей стратегии
     */
    Optional<List<ProtectedItem>> attempt(VaultReference vault);
}

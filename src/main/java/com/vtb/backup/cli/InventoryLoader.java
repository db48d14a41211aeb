package com.vtb.backup.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.backup.models.InventoryResource;
import com.vtb.backup.models.WorkloadClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Чтение инвентаря из JSON массива записей {id, name, resourceGroup, location, powerState}
 */
@Slf4j
class InventoryLoader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    List<InventoryResource> load(Path path) throws IOException {
        if (path == null) {
            return new ArrayList<>();
        }
        List<InventoryResource> resources = objectMapper.readValue(path.toFile(),
            new TypeReference<List<InventoryResource>>() { });
        List<InventoryResource> result = new ArrayList<>();
        for (InventoryResource resource : resources) {
            if (resource == null || resource.getId() == null) {
                continue;
            }
            if (isManagedDatabase(resource.getId())) {
                resource.setWorkloadClass(WorkloadClass.MANAGED_DATABASE);
            }
            result.add(resource);
        }
        log.info("Загружен инвентарь: {} ресурсов из {}", result.size(), path);
        return result;
    }

    static boolean isManagedDatabase(String resourceId) {
        String id = resourceId.toLowerCase(Locale.ROOT);
        return id.contains("/providers/microsoft.sql/servers/") && id.contains("/databases/");
    }
}

package com.vtb.backup.discovery;

import com.vtb.backup.util.ResourceIds;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Множество идентификаторов защищенных ресурсов без учета регистра.
 * Единственный общий накопитель прогона; безопасен для записи из нескольких потоков.
 * Для каждого ресурса запоминается способ защиты, первый записанный выигрывает.
 */
public class ProtectedResourceSet {

    private final Map<String, String> methods = new ConcurrentHashMap<>();

    /**
     * @return true, если ресурс добавлен впервые
     */
    public boolean add(String resourceId, String method) {
        String key = ResourceIds.normalize(resourceId);
        if (key == null || key.isEmpty()) {
            return false;
        }
        return methods.putIfAbsent(key, method != null ? method : "Unknown") == null;
    }

    public boolean contains(String resourceId) {
        String key = ResourceIds.normalize(resourceId);
        return key != null && methods.containsKey(key);
    }

    public String methodFor(String resourceId) {
        String key = ResourceIds.normalize(resourceId);
        return key != null ? methods.get(key) : null;
    }

    public int size() {
        return methods.size();
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(methods.keySet());
    }
}

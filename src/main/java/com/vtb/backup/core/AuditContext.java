package com.vtb.backup.core;

import com.vtb.backup.discovery.ProtectedResourceSet;
import com.vtb.backup.models.Finding;
import com.vtb.backup.schedule.ScheduleInfo;
import com.vtb.backup.util.ResourceIds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Состояние одного прогона: множество защищенных ресурсов, находки и кэш политик.
 * Передается явно, глобального состояния нет.
 */
public class AuditContext {

    private final ProtectedResourceSet protectedSet = new ProtectedResourceSet();
    private final List<Finding> findings = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Optional<ScheduleInfo>> policyCache = new ConcurrentHashMap<>();

    public ProtectedResourceSet getProtectedSet() {
        return protectedSet;
    }

    public void addFinding(Finding finding) {
        if (finding != null) {
            findings.add(finding);
        }
    }

    public void addFindings(List<Finding> additional) {
        additional.forEach(this::addFinding);
    }

    public List<Finding> sortedFindings() {
        List<Finding> copy;
        synchronized (findings) {
            copy = new ArrayList<>(findings);
        }
        copy.sort(Finding.ORDER);
        return copy;
    }

    /**
     * Расписание политики; загрузка выполняется один раз на идентификатор,
     * неудачная загрузка тоже кэшируется
     */
    public Optional<ScheduleInfo> policySchedule(String policyId, Function<String, Optional<ScheduleInfo>> loader) {
        String key = ResourceIds.normalize(policyId);
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        return policyCache.computeIfAbsent(key, id -> loader.apply(policyId));
    }

    public int cachedPolicies() {
        return policyCache.size();
    }
}

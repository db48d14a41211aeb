package com.vtb.backup.coverage;

import com.vtb.backup.discovery.ProtectedResourceSet;
import com.vtb.backup.models.CoverageRecord;
import com.vtb.backup.models.Finding;
import com.vtb.backup.models.FindingCategory;
import com.vtb.backup.models.InventoryResource;
import com.vtb.backup.models.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Покрытие инвентаря резервным копированием: разность множеств без учета регистра
 */
public class CoverageEvaluator {

    public static final String METHOD_NONE = "None";

    public List<CoverageRecord> evaluate(List<InventoryResource> inventory, ProtectedResourceSet protectedSet) {
        List<CoverageRecord> records = new ArrayList<>();
        if (inventory == null) {
            return records;
        }
        for (InventoryResource resource : inventory) {
            boolean covered = protectedSet.contains(resource.getId());
            records.add(CoverageRecord.builder()
                .resourceId(resource.getId())
                .resourceName(resource.getName())
                .resourceGroup(resource.getResourceGroup())
                .location(resource.getLocation())
                .powerState(resource.getPowerState())
                .workloadClass(resource.getWorkloadClass())
                .isProtected(covered)
                .method(covered ? protectedSet.methodFor(resource.getId()) : METHOD_NONE)
                .build());
        }
        return records;
    }

    public List<InventoryResource> uncovered(List<InventoryResource> inventory, ProtectedResourceSet protectedSet) {
        List<InventoryResource> result = new ArrayList<>();
        if (inventory == null) {
            return result;
        }
        for (InventoryResource resource : inventory) {
            if (!protectedSet.contains(resource.getId())) {
                result.add(resource);
            }
        }
        return result;
    }

    public List<Finding> findings(List<InventoryResource> inventory, ProtectedResourceSet protectedSet) {
        List<Finding> findings = new ArrayList<>();
        for (InventoryResource resource : uncovered(inventory, protectedSet)) {
            findings.add(Finding.builder()
                .id(Finding.idFor(FindingCategory.UNPROTECTED_RESOURCE, resource.getId()))
                .severity(resource.isRunning() ? Severity.HIGH : Severity.MEDIUM)
                .category(FindingCategory.UNPROTECTED_RESOURCE)
                .subject(resource.getId())
                .subjectName(resource.getName())
                .detail("Ресурс не защищен резервным копированием")
                .evidence("powerState=" + resource.getPowerState() + "; workloadClass=" + resource.getWorkloadClass())
                .build());
        }
        return findings;
    }
}

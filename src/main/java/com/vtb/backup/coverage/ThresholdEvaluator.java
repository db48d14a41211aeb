package com.vtb.backup.coverage;

import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.models.Finding;
import com.vtb.backup.models.FindingCategory;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.Severity;
import com.vtb.backup.models.WorkloadClass;

import java.util.Locale;
import java.util.Optional;

/**
 * Сравнение наблюдаемого RPO с порогами класса нагрузки.
 * Обе границы включительные: RPO, равный критическому порогу, дает HIGH.
 */
public class ThresholdEvaluator {

    private final AuditConfig.Thresholds thresholds;

    public ThresholdEvaluator(AuditConfig.Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Optional<Severity> classify(double observedRpoHours, WorkloadClass workloadClass) {
        AuditConfig.Threshold threshold = thresholds.forClass(workloadClass);
        if (observedRpoHours >= threshold.getCriticalHours()) {
            return Optional.of(Severity.HIGH);
        }
        if (observedRpoHours >= threshold.getWarningHours()) {
            return Optional.of(Severity.MEDIUM);
        }
        return Optional.empty();
    }

    public Optional<Finding> evaluate(ProtectedItem item) {
        if (item.getObservedRpoHours() == null) {
            return Optional.empty();
        }
        double observed = item.getObservedRpoHours();
        AuditConfig.Threshold threshold = thresholds.forClass(item.getWorkloadClass());
        return classify(observed, item.getWorkloadClass()).map(severity -> Finding.builder()
            .id(Finding.idFor(FindingCategory.RPO_THRESHOLD_EXCEEDED, item.getSourceResourceId()))
            .severity(severity)
            .category(FindingCategory.RPO_THRESHOLD_EXCEEDED)
            .subject(item.getSourceResourceId())
            .subjectName(item.getItemName())
            .detail(String.format(Locale.ROOT, "Наблюдаемый RPO %.2f ч превышает порог %s (%.2f ч)",
                observed,
                severity == Severity.HIGH ? "критический" : "предупреждения",
                severity == Severity.HIGH ? threshold.getCriticalHours() : threshold.getWarningHours()))
            .evidence(String.format(Locale.ROOT, "latestRecoveryPoint=%s; source=%s; warning=%.2f; critical=%.2f",
                item.getLatestRecoveryPoint(), item.getRpoSource().getLabel(),
                threshold.getWarningHours(), threshold.getCriticalHours()))
            .build());
    }
}

package com.vtb.backup.models;

import com.vtb.backup.http.TelemetrySummary;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Результат аудита: строки для внешнего экспорта и находки
 */
@Data
@Builder
public class AuditResult {
    private Instant startedAt;
    private Instant finishedAt;

    @Builder.Default
    private List<String> subscriptions = new ArrayList<>();

    @Builder.Default
    private List<VaultPosture> vaultPostures = new ArrayList<>();

    @Builder.Default
    private List<ProtectedItem> protectedItems = new ArrayList<>();

    @Builder.Default
    private List<CoverageRecord> coverage = new ArrayList<>();

    @Builder.Default
    private List<Finding> findings = new ArrayList<>();

    private AuditStatistics statistics;
    private TelemetrySummary telemetry;

    /**
     * Количество находок заданной критичности
     */
    public int getFindingCountBySeverity(Severity severity) {
        return (int) findings.stream()
            .filter(f -> f.getSeverity() == severity)
            .count();
    }

    /**
     * Есть ли находки высокой критичности
     */
    public boolean hasHighFindings() {
        return findings.stream().anyMatch(f -> f.getSeverity() == Severity.HIGH);
    }
}

package com.vtb.backup.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.coverage.CoverageEvaluator;
import com.vtb.backup.coverage.PostureEvaluator;
import com.vtb.backup.coverage.ThresholdEvaluator;
import com.vtb.backup.discovery.ContainerEnumerationStrategy;
import com.vtb.backup.discovery.ManagementTypeListingStrategy;
import com.vtb.backup.discovery.ProtectedItemNormalizer;
import com.vtb.backup.discovery.ProtectedResourceSetBuilder;
import com.vtb.backup.discovery.RestProtectedItemsStrategy;
import com.vtb.backup.http.ArmResponse;
import com.vtb.backup.http.ResilientGetClient;
import com.vtb.backup.models.AuditResult;
import com.vtb.backup.models.AuditStatistics;
import com.vtb.backup.models.CoverageRecord;
import com.vtb.backup.models.Finding;
import com.vtb.backup.models.FindingCategory;
import com.vtb.backup.models.InventoryResource;
import com.vtb.backup.models.ProtectedItem;
import com.vtb.backup.models.RpoSource;
import com.vtb.backup.models.Severity;
import com.vtb.backup.models.VaultFamily;
import com.vtb.backup.models.VaultPosture;
import com.vtb.backup.models.VaultReference;
import com.vtb.backup.models.WorkloadClass;
import com.vtb.backup.pagination.NextLinkPaginationWalker;
import com.vtb.backup.pagination.PageWalker;
import com.vtb.backup.pagination.TokenPaginationWalker;
import com.vtb.backup.posture.VaultPostureResolver;
import com.vtb.backup.rpo.RecoveryPoint;
import com.vtb.backup.rpo.RecoveryPointKind;
import com.vtb.backup.rpo.RecoveryPointParser;
import com.vtb.backup.rpo.RecoveryPointSource;
import com.vtb.backup.rpo.RpoEstimate;
import com.vtb.backup.rpo.RpoInferenceEngine;
import com.vtb.backup.schedule.BackupKind;
import com.vtb.backup.schedule.Cadence;
import com.vtb.backup.schedule.CadenceNormalizer;
import com.vtb.backup.schedule.PolicyScheduleExtractor;
import com.vtb.backup.schedule.ScheduleInfo;
import com.vtb.backup.util.ResourceIds;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Главный движок аудита резервного копирования.
 *
 * Подписка, затем хранилище: состояние хранилища и поиск защищенных ресурсов.
 * Для каждого ресурса расписание политики, при его отсутствии эмпирическая оценка
 * по точкам восстановления, затем сравнение с порогами. В конце покрытие инвентаря.
 * Выполнение однопоточное: ограничения частоты запросов действуют на подписку.
 */
@Slf4j
public class BackupAuditor {

    public static final String METHOD_PITR = "PITR";

    private final AuditConfig config;
    private final ResilientGetClient client;
    private final Clock clock;
    private final PageWalker linkWalker;
    private final PageWalker tokenWalker;
    private final VaultEnumerator vaultEnumerator;
    private final VaultPostureResolver postureResolver;
    private final ProtectedResourceSetBuilder setBuilder;
    private final PolicyScheduleExtractor scheduleExtractor;
    private final RpoInferenceEngine rpoEngine;
    private final PostureEvaluator postureEvaluator;
    private final ThresholdEvaluator thresholdEvaluator;
    private final CoverageEvaluator coverageEvaluator = new CoverageEvaluator();

    public BackupAuditor(AuditConfig config, ResilientGetClient client, Clock clock) {
        this.config = config;
        this.client = client;
        this.clock = clock;

        AuditConfig.Http http = config.getHttp();
        this.linkWalker = new NextLinkPaginationWalker(client, http.getMaxPages());
        this.tokenWalker = new TokenPaginationWalker(client, http.getContinuationHeader(),
            http.getContinuationQueryParam(), http.getMaxPages());

        this.vaultEnumerator = new VaultEnumerator(linkWalker, config.getApiVersions());
        this.postureResolver = VaultPostureResolver.standard(client, config.getApiVersions());

        ProtectedItemNormalizer normalizer = new ProtectedItemNormalizer();
        this.setBuilder = new ProtectedResourceSetBuilder(List.of(
            new ManagementTypeListingStrategy(client, linkWalker, config, normalizer),
            new ContainerEnumerationStrategy(client, linkWalker, config, normalizer),
            new RestProtectedItemsStrategy(client, linkWalker, config, normalizer)
        ));

        this.scheduleExtractor = new PolicyScheduleExtractor(new CadenceNormalizer(config.getCadence()));
        this.rpoEngine = new RpoInferenceEngine(clock);
        this.postureEvaluator = new PostureEvaluator(config.getPosture());
        this.thresholdEvaluator = new ThresholdEvaluator(config.getThresholds());
    }

    /**
     * Запустить полный аудит
     *
     * @param subscriptions идентификаторы подписок (уже отфильтрованные)
     * @param inventory     полный инвентарь ВМ и управляемых БД
     */
    public AuditResult audit(List<String> subscriptions, List<InventoryResource> inventory) {
        log.info("=== Начало аудита резервного копирования ===");
        Instant startedAt = clock.instant();
        long startTime = System.currentTimeMillis();

        List<String> subscriptionIds = subscriptions != null ? subscriptions : List.of();
        List<InventoryResource> resources = inventory != null ? inventory : List.of();
        AuditContext context = new AuditContext();

        List<VaultPosture> postures = new ArrayList<>();
        List<ProtectedItem> items = new ArrayList<>();

        for (String subscriptionId : subscriptionIds) {
            log.info("Подписка: {}", subscriptionId);
            for (VaultReference vault : vaultEnumerator.enumerate(subscriptionId)) {
                auditVault(vault, context, postures, items);
            }
        }

        int pitrDatabases = 0;
        for (InventoryResource resource : resources) {
            if (resource.getWorkloadClass() == WorkloadClass.MANAGED_DATABASE) {
                Optional<ProtectedItem> row = assessManagedDatabase(resource, context);
                if (row.isPresent()) {
                    items.add(row.get());
                    pitrDatabases++;
                }
            }
        }

        List<CoverageRecord> coverage = coverageEvaluator.evaluate(resources, context.getProtectedSet());
        context.addFindings(coverageEvaluator.findings(resources, context.getProtectedSet()));

        List<Finding> findings = context.sortedFindings();
        long duration = System.currentTimeMillis() - startTime;

        AuditStatistics statistics = AuditStatistics.builder()
            .subscriptions(subscriptionIds.size())
            .vaults(postures.size())
            .protectedItems(items.size())
            .managedDatabasesWithPitr(pitrDatabases)
            .inventoryResources(resources.size())
            .uncoveredResources((int) coverage.stream().filter(record -> !record.isProtected()).count())
            .itemsWithPolicyCadence(countBySource(items, RpoSource.POLICY))
            .itemsWithEmpiricalRpo(countBySource(items, RpoSource.RECOVERY_POINTS) + countBySource(items, RpoSource.PITR))
            .itemsWithUnknownRpo((int) items.stream().filter(item -> item.getObservedRpoHours() == null).count())
            .totalFindings(findings.size())
            .highFindings(count(findings, Severity.HIGH))
            .mediumFindings(count(findings, Severity.MEDIUM))
            .lowFindings(count(findings, Severity.LOW))
            .infoFindings(count(findings, Severity.INFO))
            .auditDurationMs(duration)
            .build();

        log.info("=== Аудит завершен за {} мс ===", duration);
        log.info("Хранилищ: {}, защищенных ресурсов: {}, без покрытия: {}, находок: {}",
            statistics.getVaults(), statistics.getProtectedItems(),
            statistics.getUncoveredResources(), statistics.getTotalFindings());
        log.debug("Политик в кэше: {}", context.cachedPolicies());

        return AuditResult.builder()
            .startedAt(startedAt)
            .finishedAt(clock.instant())
            .subscriptions(new ArrayList<>(subscriptionIds))
            .vaultPostures(postures)
            .protectedItems(items)
            .coverage(coverage)
            .findings(findings)
            .statistics(statistics)
            .telemetry(client.getTelemetry().summarize())
            .build();
    }

    private void auditVault(VaultReference vault, AuditContext context,
                            List<VaultPosture> postures, List<ProtectedItem> items) {
        log.info("Хранилище: {} ({})", vault.getName(), vault.getFamily());

        VaultPosture posture = postureResolver.resolve(vault);
        postures.add(posture);
        context.addFindings(postureEvaluator.evaluate(posture));

        for (ProtectedItem item : setBuilder.discover(vault, context.getProtectedSet())) {
            ProtectedItem assessed = assessItem(item, vault, context);
            items.add(assessed);
            evaluateItem(assessed, context);
        }
    }

    ProtectedItem assessItem(ProtectedItem item, VaultReference vault, AuditContext context) {
        ScheduleInfo schedule = item.getPolicyId() != null
            ? context.policySchedule(item.getPolicyId(), this::loadPolicy).orElse(null)
            : null;

        RecoveryPointSource points = recoveryPointsFor(item, vault);
        RpoEstimate estimate = rpoEngine.estimate(schedule, item.getWorkloadClass(), item.getLastBackupTime(), points);
        return applyEstimate(item, schedule, estimate);
    }

    private RecoveryPointSource recoveryPointsFor(ProtectedItem item, VaultReference vault) {
        if (item.getItemId() == null) {
            return RecoveryPointSource.none();
        }
        if (vault.getFamily() == VaultFamily.BACKUP_VAULT) {
            return new ArmRecoveryPointSource(linkWalker,
                item.getItemId() + "/recoveryPoints?api-version=" + config.getApiVersions().getBackupInstances());
        }
        return new ArmRecoveryPointSource(tokenWalker,
            item.getItemId() + "/recoveryPoints?api-version=" + config.getApiVersions().getRecoveryPoints());
    }

    private Optional<ScheduleInfo> loadPolicy(String policyId) {
        String apiVersion = policyId.toLowerCase(Locale.ROOT).contains("microsoft.dataprotection")
            ? config.getApiVersions().getBackupInstances()
            : config.getApiVersions().getPolicies();
        Optional<JsonNode> policy = client.get(policyId + "?api-version=" + apiVersion).map(ArmResponse::getBody);
        if (policy.isEmpty()) {
            log.debug("Политика {} недоступна", policyId);
            return Optional.empty();
        }
        return scheduleExtractor.extract(policy.get());
    }

    private ProtectedItem applyEstimate(ProtectedItem item, ScheduleInfo schedule, RpoEstimate estimate) {
        Cadence configured = estimate.getConfiguredCadence();
        ProtectedItem.ProtectedItemBuilder builder = item.toBuilder()
            .configuredCadenceHours(configured != null ? configured.getHours() : null)
            .configuredCadence(configured != null ? configured.getText() : null)
            .inferredCadenceHours(estimate.getInferredCadenceHours())
            .observedRpoHours(estimate.getObservedRpoHours())
            .latestRecoveryPoint(estimate.getLatestPoint())
            .latestRecoveryPointKind(estimate.getLatestPointKind() != null ? estimate.getLatestPointKind().name() : null)
            .rpoSource(estimate.getSource());
        if (schedule != null) {
            builder.backupWindowHours(schedule.getWindowHours())
                .fullCadence(text(schedule.cadenceFor(BackupKind.FULL)))
                .differentialCadence(text(schedule.cadenceFor(BackupKind.DIFFERENTIAL)))
                .logCadence(text(schedule.cadenceFor(BackupKind.LOG)));
        }
        return builder.build();
    }

    /**
     * Управляемая БД: защищена, если есть хотя бы одна непрерывная точка восстановления
     */
    Optional<ProtectedItem> assessManagedDatabase(InventoryResource resource, AuditContext context) {
        if (resource.getId() == null) {
            return Optional.empty();
        }
        List<JsonNode> restorePoints = linkWalker.walk(
            resource.getId() + "/restorePoints?api-version=" + config.getApiVersions().getSqlRestorePoints());
        // непрерывная точка защищает БД даже без отметки времени; RPO считается только по точкам с отметкой
        boolean hasContinuous = restorePoints.stream()
            .anyMatch(point -> RecoveryPointParser.kindOf(point) == RecoveryPointKind.CONTINUOUS);
        List<RecoveryPoint> points = new ArrayList<>();
        for (JsonNode restorePoint : restorePoints) {
            RecoveryPointParser.parse(restorePoint).ifPresent(points::add);
        }
        if (!hasContinuous) {
            log.debug("Управляемая БД {} без непрерывных точек восстановления", resource.getName());
            return Optional.empty();
        }
        context.getProtectedSet().add(resource.getId(), METHOD_PITR);

        RpoEstimate estimate = rpoEngine.estimate(null, WorkloadClass.MANAGED_DATABASE, null, fullHistory -> points);
        Optional<ResourceIds.ResourceId> parsed = ResourceIds.parse(resource.getId());
        ProtectedItem item = applyEstimate(ProtectedItem.builder()
            .itemId(resource.getId())
            .itemName(resource.getName())
            .sourceResourceId(parsed.map(ResourceIds.ResourceId::normalized).orElse(ResourceIds.normalize(resource.getId())))
            .sourceResourceGroup(resource.getResourceGroup())
            .sourceResourceType(parsed.map(ResourceIds.ResourceId::providerType).orElse(null))
            .workloadClass(WorkloadClass.MANAGED_DATABASE)
            .discoveredBy(METHOD_PITR)
            .build(), null, estimate);
        evaluateItem(item, context);
        return Optional.of(item);
    }

    private void evaluateItem(ProtectedItem item, AuditContext context) {
        thresholdEvaluator.evaluate(item).ifPresent(context::addFinding);

        if (item.isUnhealthy()) {
            context.addFinding(Finding.builder()
                .id(Finding.idFor(FindingCategory.PROTECTION_UNHEALTHY, item.getSourceResourceId()))
                .severity(Severity.MEDIUM)
                .category(FindingCategory.PROTECTION_UNHEALTHY)
                .subject(item.getSourceResourceId())
                .subjectName(item.getItemName())
                .detail("Защита ресурса остановлена или последнее копирование завершилось ошибкой")
                .evidence("protectionState=" + item.getProtectionState() + "; lastBackupStatus=" + item.getLastBackupStatus())
                .build());
        }

        if (item.getObservedRpoHours() == null) {
            context.addFinding(Finding.builder()
                .id(Finding.idFor(FindingCategory.RPO_UNKNOWN, item.getSourceResourceId()))
                .severity(Severity.INFO)
                .category(FindingCategory.RPO_UNKNOWN)
                .subject(item.getSourceResourceId())
                .subjectName(item.getItemName())
                .detail("Наблюдаемый RPO определить не удалось")
                .evidence("rpoSource=" + item.getRpoSource().getLabel())
                .build());
        }
    }

    private static String text(Cadence cadence) {
        return cadence != null ? cadence.getText() : null;
    }

    private static int countBySource(List<ProtectedItem> items, RpoSource source) {
        return (int) items.stream().filter(item -> item.getRpoSource() == source).count();
    }

    private static int count(List<Finding> findings, Severity severity) {
        return (int) findings.stream().filter(f -> f.getSeverity() == severity).count();
    }
}

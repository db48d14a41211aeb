package com.vtb.backup.schedule;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.util.JsonFields;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Извлечение расписания из политики резервного копирования.
 *
 * Форма политики определяется по фиксированному списку имен полей
 * (без учета регистра), затем обрабатывается адаптером своего варианта.
 * Нераспознанная форма дает пустой результат, а не ошибку.
 */
@Slf4j
public class PolicyScheduleExtractor {

    /**
     * Признаки формы политики в порядке приоритета
     */
    private static final List<Map.Entry<String, PolicyShape>> SHAPE_MARKERS = List.of(
        Map.entry("subProtectionPolicy", PolicyShape.WORKLOAD_SUB_POLICIES),
        Map.entry("policyRules", PolicyShape.RULE_BASED),
        Map.entry("schedulePolicy", PolicyShape.SIMPLE_SCHEDULE)
    );

    private static final String[] ENHANCED_MARKERS = {"hourlySchedule", "dailySchedule", "weeklySchedule"};

    private final CadenceNormalizer normalizer;
    private final SchedulePolicyReader reader = new SchedulePolicyReader();

    public PolicyScheduleExtractor(CadenceNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * @param policy ресурс политики (с "properties" или без)
     */
    public Optional<ScheduleInfo> extract(JsonNode policy) {
        if (policy == null || policy.isNull() || policy.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode properties = JsonFields.properties(policy);
        Optional<PolicyShape> shape = detectShape(properties);
        if (shape.isEmpty()) {
            log.debug("Форма политики не распознана: {}", JsonFields.text(policy, "id"));
            return Optional.empty();
        }
        Optional<ScheduleInfo> info = switch (shape.get()) {
            case SIMPLE_SCHEDULE, ENHANCED_SCHEDULE -> fromSchedulePolicy(shape.get(), properties);
            case WORKLOAD_SUB_POLICIES -> fromSubPolicies(properties);
            case RULE_BASED -> fromPolicyRules(properties);
        };
        return info.filter(ScheduleInfo::isResolved);
    }

    public Optional<PolicyShape> detectShape(JsonNode properties) {
        if (properties == null || !properties.isObject()) {
            return Optional.empty();
        }
        for (Map.Entry<String, PolicyShape> marker : SHAPE_MARKERS) {
            JsonNode value = JsonFields.field(properties, marker.getKey());
            if (value == null || value.isNull()) {
                continue;
            }
            if (marker.getValue() == PolicyShape.SIMPLE_SCHEDULE) {
                return Optional.of(isEnhanced(value) ? PolicyShape.ENHANCED_SCHEDULE : PolicyShape.SIMPLE_SCHEDULE);
            }
            return Optional.of(marker.getValue());
        }
        return Optional.empty();
    }

    private boolean isEnhanced(JsonNode schedulePolicy) {
        String type = JsonFields.text(schedulePolicy, "schedulePolicyType");
        if (type != null && type.toUpperCase(Locale.ROOT).endsWith("V2")) {
            return true;
        }
        return JsonFields.firstField(schedulePolicy, ENHANCED_MARKERS) != null;
    }

    /**
     * ВМ: одна периодичность из schedulePolicy
     */
    private Optional<ScheduleInfo> fromSchedulePolicy(PolicyShape shape, JsonNode properties) {
        JsonNode schedule = JsonFields.field(properties, "schedulePolicy");
        Optional<Cadence> cadence = reader.cadenceSeconds(schedule).flatMap(normalizer::normalize);
        return Optional.of(ScheduleInfo.builder()
            .shape(shape)
            .cadence(cadence.orElse(null))
            .windowHours(reader.windowHours(schedule).orElse(null))
            .build());
    }

    /**
     * БД в ВМ: subProtectionPolicy с видами Full/Differential/Log
     */
    private Optional<ScheduleInfo> fromSubPolicies(JsonNode properties) {
        JsonNode subPolicies = JsonFields.field(properties, "subProtectionPolicy");
        if (subPolicies == null || !subPolicies.isArray()) {
            return Optional.empty();
        }
        Map<BackupKind, Cadence> perKind = new EnumMap<>(BackupKind.class);
        Double window = null;
        for (JsonNode subPolicy : subPolicies) {
            BackupKind kind = BackupKind.fromPolicyType(JsonFields.text(subPolicy, "policyType"));
            if (kind == null) {
                continue;
            }
            JsonNode schedule = JsonFields.field(subPolicy, "schedulePolicy");
            reader.cadenceSeconds(schedule)
                .flatMap(normalizer::normalize)
                .ifPresent(cadence -> perKind.putIfAbsent(kind, cadence));
            if (window == null) {
                window = reader.windowHours(schedule).orElse(null);
            }
        }
        return Optional.of(ScheduleInfo.builder()
            .shape(PolicyShape.WORKLOAD_SUB_POLICIES)
            .cadence(perKind.get(BackupKind.FULL))
            .windowHours(window)
            .perKind(perKind)
            .build());
    }

    /**
     * Backup vault: правила с trigger.schedule.repeatingTimeIntervals
     */
    private Optional<ScheduleInfo> fromPolicyRules(JsonNode properties) {
        JsonNode rules = JsonFields.field(properties, "policyRules");
        if (rules == null || !rules.isArray()) {
            return Optional.empty();
        }
        Map<BackupKind, Cadence> perKind = new EnumMap<>(BackupKind.class);
        Cadence single = null;
        Double window = null;
        for (JsonNode rule : rules) {
            JsonNode schedule = JsonFields.path(rule, "trigger", "schedule");
            if (schedule == null) {
                continue;
            }
            Optional<Cadence> cadence = reader.cadenceSeconds(schedule).flatMap(normalizer::normalize);
            if (cadence.isEmpty()) {
                continue;
            }
            BackupKind kind = BackupKind.fromPolicyType(JsonFields.text(rule, "backupParameters", "backupType"));
            if (kind != null) {
                perKind.putIfAbsent(kind, cadence.get());
            } else if (single == null) {
                single = cadence.get();
            }
            if (window == null) {
                window = reader.windowHours(schedule).orElse(null);
            }
        }
        return Optional.of(ScheduleInfo.builder()
            .shape(PolicyShape.RULE_BASED)
            .cadence(single != null ? single : perKind.get(BackupKind.FULL))
            .windowHours(window)
            .perKind(perKind)
            .build());
    }
}

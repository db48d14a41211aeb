package com.vtb.backup.rpo;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.util.JsonFields;

import java.time.Instant;
import java.util.Optional;

/**
 * Разбор точек восстановления разных семейств:
 * Recovery Services (ВМ и БД в ВМ), Backup vault и restore points управляемых БД.
 */
public final class RecoveryPointParser {

    private static final String[] TIMESTAMP_FIELDS = {
        "recoveryPointTimeInUTC", "recoveryPointTime", "restorePointCreationDate"
    };

    private static final String[] KIND_FIELDS = {
        "type", "recoveryPointType", "restorePointType", "objectType"
    };

    private RecoveryPointParser() {
    }

    public static Optional<RecoveryPoint> parse(JsonNode resource) {
        if (resource == null || !resource.isObject()) {
            return Optional.empty();
        }
        JsonNode properties = JsonFields.properties(resource);
        Instant timestamp = timestamp(properties);
        if (timestamp == null) {
            return Optional.empty();
        }
        return Optional.of(new RecoveryPoint(timestamp, kind(properties)));
    }

    /**
     * Вид точки без требования к отметке времени: непрерывная точка управляемой БД
     * приходит только с earliestRestoreDate
     */
    public static RecoveryPointKind kindOf(JsonNode resource) {
        if (resource == null || !resource.isObject()) {
            return RecoveryPointKind.OTHER;
        }
        return kind(JsonFields.properties(resource));
    }

    public static boolean hasTimestamp(JsonNode resource) {
        return resource != null && timestamp(JsonFields.properties(resource)) != null;
    }

    private static Instant timestamp(JsonNode properties) {
        JsonNode value = JsonFields.firstField(properties, TIMESTAMP_FIELDS);
        if (value != null && value.isTextual()) {
            return JsonFields.instant(value.asText());
        }
        // точка во времени: конец последнего непрерывного диапазона журналов
        JsonNode ranges = JsonFields.field(properties, "timeRanges");
        if (ranges != null && ranges.isArray() && ranges.size() > 0) {
            Instant latest = null;
            for (JsonNode range : ranges) {
                Instant end = JsonFields.instant(JsonFields.text(range, "endTime"));
                if (end != null && (latest == null || end.isAfter(latest))) {
                    latest = end;
                }
            }
            return latest;
        }
        return null;
    }

    private static RecoveryPointKind kind(JsonNode properties) {
        for (String field : KIND_FIELDS) {
            String text = JsonFields.text(properties, field);
            if (text == null) {
                continue;
            }
            RecoveryPointKind kind = RecoveryPointKind.fromText(text);
            if (kind != RecoveryPointKind.OTHER) {
                return kind;
            }
        }
        return RecoveryPointKind.OTHER;
    }
}

package com.vtb.backup.models;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.Locale;

/**
 * Находка аудита. Идентификатор детерминирован: категория + объект,
 * поэтому повторный прогон на тех же данных дает те же находки.
 */
@Value
@Builder
public class Finding {

    public static final Comparator<Finding> ORDER = Comparator
        .comparing((Finding f) -> -f.getSeverity().getPriority())
        .thenComparing(f -> f.getCategory().name())
        .thenComparing(f -> f.getSubject() != null ? f.getSubject() : "");

    String id;
    Severity severity;
    FindingCategory category;
    String subject;
    String subjectName;
    String detail;
    String evidence;

    public static String idFor(FindingCategory category, String subject) {
        return category.name() + ":" + (subject != null ? subject.toLowerCase(Locale.ROOT) : "-");
    }
}

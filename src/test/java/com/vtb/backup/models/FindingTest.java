package com.vtb.backup.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FindingTest {

    @Test
    void idIsStableAcrossCase() {
        assertEquals(Finding.idFor(FindingCategory.RPO_UNKNOWN, "/subscriptions/S1/VM"),
            Finding.idFor(FindingCategory.RPO_UNKNOWN, "/subscriptions/s1/vm"));
    }

    @Test
    void missingSubjectGetsPlaceholder() {
        assertEquals("RPO_UNKNOWN:-", Finding.idFor(FindingCategory.RPO_UNKNOWN, null));
    }

    @Test
    void orderIsSeverityThenCategoryThenSubject() {
        List<Finding> findings = new ArrayList<>(List.of(
            finding(Severity.LOW, FindingCategory.IMMUTABILITY_DISABLED, "b"),
            finding(Severity.HIGH, FindingCategory.UNPROTECTED_RESOURCE, "z"),
            finding(Severity.HIGH, FindingCategory.RPO_THRESHOLD_EXCEEDED, "a"),
            finding(Severity.HIGH, FindingCategory.UNPROTECTED_RESOURCE, "a")));

        findings.sort(Finding.ORDER);

        assertEquals(FindingCategory.RPO_THRESHOLD_EXCEEDED, findings.get(0).getCategory());
        assertEquals("a", findings.get(1).getSubject());
        assertEquals("z", findings.get(2).getSubject());
        assertEquals(Severity.LOW, findings.get(3).getSeverity());
    }

    private static Finding finding(Severity severity, FindingCategory category, String subject) {
        return Finding.builder()
            .id(Finding.idFor(category, subject))
            .severity(severity)
            .category(category)
            .subject(subject)
            .build();
    }
}

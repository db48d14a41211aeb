package com.vtb.backup.coverage;

import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.models.Finding;
import com.vtb.backup.models.FindingCategory;
import com.vtb.backup.models.SecurityLevel;
import com.vtb.backup.models.Severity;
import com.vtb.backup.models.SoftDeleteState;
import com.vtb.backup.models.VaultPosture;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Правила оценки состояния хранилища
 */
public class PostureEvaluator {

    private final AuditConfig.Posture settings;

    public PostureEvaluator(AuditConfig.Posture settings) {
        this.settings = settings;
    }

    public List<Finding> evaluate(VaultPosture posture) {
        List<Finding> findings = new ArrayList<>();

        SoftDeleteState softDelete = posture.getSoftDeleteState();
        if (softDelete == SoftDeleteState.DISABLED) {
            findings.add(finding(posture, FindingCategory.SOFT_DELETE_DISABLED, Severity.HIGH,
                "Soft delete отключен: удаленные резервные копии не восстанавливаются",
                "softDeleteState=DISABLED"));
        } else if (softDelete == null || !softDelete.isResolved()) {
            findings.add(finding(posture, FindingCategory.POSTURE_UNKNOWN, Severity.LOW,
                "Состояние soft delete определить не удалось",
                "resolvedFrom=" + posture.getResolvedFrom()));
        }

        Integer retention = posture.getSoftDeleteRetentionDays();
        if (retention != null && retention < settings.getMinimumRetentionDays()) {
            findings.add(finding(posture, FindingCategory.SHORT_SOFT_DELETE_RETENTION, Severity.MEDIUM,
                "Срок хранения удаленных копий " + retention + " дн. меньше минимума "
                    + settings.getMinimumRetentionDays() + " дн.",
                "softDeleteRetentionDays=" + retention));
        }

        String redundancy = posture.getStorageRedundancy();
        if (redundancy != null) {
            String normalized = redundancy.toLowerCase(Locale.ROOT);
            if (normalized.startsWith("locally")) {
                findings.add(finding(posture, FindingCategory.LOCAL_REDUNDANCY_ONLY, Severity.MEDIUM,
                    "Хранилище использует только локальную избыточность",
                    "storageRedundancy=" + redundancy));
            } else if (normalized.startsWith("geo") && !Boolean.TRUE.equals(posture.getCrossRegionRestore())) {
                findings.add(finding(posture, FindingCategory.CROSS_REGION_RESTORE_DISABLED, Severity.LOW,
                    "Геоизбыточное хранилище без восстановления в другом регионе",
                    "storageRedundancy=" + redundancy + "; crossRegionRestore=" + posture.getCrossRegionRestore()));
            }
        }

        if (!isImmutable(posture.getImmutability())) {
            findings.add(finding(posture, FindingCategory.IMMUTABILITY_DISABLED, Severity.LOW,
                "Неизменяемость хранилища не включена",
                "immutability=" + posture.getImmutability()));
        }

        if (posture.getSecurityLevel() == SecurityLevel.STANDARD) {
            findings.add(finding(posture, FindingCategory.STANDARD_SECURITY_LEVEL, Severity.INFO,
                "Уровень безопасности хранилища стандартный",
                "hybridSecurity=" + posture.getHybridSecurityEnabled()
                    + "; mua=" + posture.getMultiUserAuthorization()
                    + "; softDelete=" + softDelete));
        }
        return findings;
    }

    private boolean isImmutable(String immutability) {
        if (immutability == null) {
            return false;
        }
        String value = immutability.toLowerCase(Locale.ROOT);
        return value.equals("unlocked") || value.equals("locked") || value.equals("enabled");
    }

    private Finding finding(VaultPosture posture, FindingCategory category, Severity severity,
                            String detail, String evidence) {
        return Finding.builder()
            .id(Finding.idFor(category, posture.getVaultId()))
            .severity(severity)
            .category(category)
            .subject(posture.getVaultId())
            .subjectName(posture.getVaultName())
            .detail(detail)
            .evidence(evidence)
            .build();
    }
}

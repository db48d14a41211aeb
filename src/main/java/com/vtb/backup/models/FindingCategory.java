package com.vtb.backup.models;

public enum FindingCategory {
    RPO_THRESHOLD_EXCEEDED,
    RPO_UNKNOWN,
    UNPROTECTED_RESOURCE,
    PROTECTION_UNHEALTHY,
    SOFT_DELETE_DISABLED,
    SHORT_SOFT_DELETE_RETENTION,
    LOCAL_REDUNDANCY_ONLY,
    CROSS_REGION_RESTORE_DISABLED,
    IMMUTABILITY_DISABLED,
    STANDARD_SECURITY_LEVEL,
    POSTURE_UNKNOWN
}

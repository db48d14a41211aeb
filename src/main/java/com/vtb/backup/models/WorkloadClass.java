package com.vtb.backup.models;

/**
 * Класс нагрузки, для которого задаются пороги RPO
 */
public enum WorkloadClass {
    VIRTUAL_MACHINE,
    VAULT_DATABASE,
    MANAGED_DATABASE
}

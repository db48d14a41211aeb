package com.vtb.backup.schedule;

/**
 * Варианты формы политики резервного копирования.
 * Классическая/расширенная форма x одна периодичность (ВМ) / несколько (БД).
 */
public enum PolicyShape {
    /** Классическая политика ВМ: SimpleSchedulePolicy */
    SIMPLE_SCHEDULE,
    /** Расширенная политика ВМ: SimpleSchedulePolicyV2 с hourly/daily/weekly расписанием */
    ENHANCED_SCHEDULE,
    /** Классическая политика БД: набор subProtectionPolicy Full/Differential/Log */
    WORKLOAD_SUB_POLICIES,
    /** Расширенная политика Backup vault: policyRules с repeatingTimeIntervals */
    RULE_BASED
}

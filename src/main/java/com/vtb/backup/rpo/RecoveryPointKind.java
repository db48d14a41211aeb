package com.vtb.backup.rpo;

import java.util.Locale;

/**
 * Вид точки восстановления. Меньший ранг важнее: для БД именно журнальная
 * точка показывает реальную свежесть данных.
 */
public enum RecoveryPointKind {
    LOG(0),
    DIFFERENTIAL(1),
    COPY_ONLY(2),
    FULL(3),
    APP_CONSISTENT(4),
    CRASH_CONSISTENT(5),
    CONTINUOUS(6),
    OTHER(7);

    private final int rank;

    RecoveryPointKind(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public static RecoveryPointKind fromText(String text) {
        if (text == null || text.isBlank()) {
            return OTHER;
        }
        String value = text.trim().toLowerCase(Locale.ROOT).replace("_", "");
        if (value.contains("pointintime") || value.equals("log") || value.contains("transactionlog")) {
            return LOG;
        }
        if (value.contains("copyonly")) {
            return COPY_ONLY;
        }
        if (value.contains("differential")) {
            return DIFFERENTIAL;
        }
        if (value.equals("continuous")) {
            return CONTINUOUS;
        }
        if (value.contains("appconsistent")) {
            return APP_CONSISTENT;
        }
        if (value.contains("crashconsistent") || value.contains("filesystemconsistent")) {
            return CRASH_CONSISTENT;
        }
        if (value.equals("full") || value.contains("snapshotfull")) {
            return FULL;
        }
        return OTHER;
    }
}

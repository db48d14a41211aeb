package com.vtb.backup.rpo;

import java.util.List;

/**
 * Поставщик точек восстановления одного защищенного ресурса
 */
@FunctionalInterface
public interface RecoveryPointSource {

    /**
     * @param fullHistory true - вся история; false - достаточно двух точек с отметкой времени
     */
    List<RecoveryPoint> fetch(boolean fullHistory);

    static RecoveryPointSource none() {
        return fullHistory -> List.of();
    }
}

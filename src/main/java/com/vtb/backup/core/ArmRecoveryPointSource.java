package com.vtb.backup.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.pagination.PageWalker;
import com.vtb.backup.rpo.RecoveryPoint;
import com.vtb.backup.rpo.RecoveryPointParser;
import com.vtb.backup.rpo.RecoveryPointSource;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Точки восстановления ресурса из management API.
 * Без полной истории обход останавливается, как только собраны две точки с отметкой времени.
 */
public class ArmRecoveryPointSource implements RecoveryPointSource {

    static final int CADENCE_FALLBACK_POINTS = 2;

    private final PageWalker walker;
    private final String url;

    public ArmRecoveryPointSource(PageWalker walker, String url) {
        this.walker = walker;
        this.url = url;
    }

    @Override
    public List<RecoveryPoint> fetch(boolean fullHistory) {
        Predicate<List<JsonNode>> sufficient = fullHistory
            ? items -> false
            : items -> items.stream().filter(RecoveryPointParser::hasTimestamp).count() >= CADENCE_FALLBACK_POINTS;
        List<RecoveryPoint> points = new ArrayList<>();
        for (JsonNode resource : walker.walk(url, sufficient)) {
            RecoveryPointParser.parse(resource).ifPresent(points::add);
        }
        return points;
    }
}

package com.vtb.backup.http;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Сводка HTTP-вызовов за прогон
 */
@Data
@Builder
public class TelemetrySummary {
    private int totalResponses;
    private int successResponses;
    private int throttledResponses;
    private int serverErrors;
    private int clientErrors;
    private int retries;
    private int terminalFailures;
    private int networkErrors;
    private long totalLatencyMs;
    @Builder.Default
    private List<String> notices = new ArrayList<>();
}

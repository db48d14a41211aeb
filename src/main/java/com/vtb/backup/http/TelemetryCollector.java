package com.vtb.backup.http;

import java.util.ArrayList;
import java.util.List;

/**
 * Учет каждой HTTP-попытки за прогон аудита
 */
public class TelemetryCollector {

    private final List<TelemetryEvent> events = new ArrayList<>();

    void recordResponse(String target, int statusCode, int attempt, long durationMs) {
        events.add(TelemetryEvent.builder()
            .type(TelemetryEventType.RESPONSE)
            .target(target)
            .statusCode(statusCode)
            .attempt(attempt)
            .durationMs(durationMs)
            .build());
    }

    void recordRetry(String target, int statusCode, int attempt) {
        events.add(TelemetryEvent.builder()
            .type(TelemetryEventType.RETRY)
            .target(target)
            .statusCode(statusCode)
            .attempt(attempt)
            .build());
    }

    void recordTerminalFailure(String target, int statusCode, int attempt) {
        events.add(TelemetryEvent.builder()
            .type(TelemetryEventType.TERMINAL_FAILURE)
            .target(target)
            .statusCode(statusCode)
            .attempt(attempt)
            .build());
    }

    void recordNetworkError(String target, int attempt, String message) {
        events.add(TelemetryEvent.builder()
            .type(TelemetryEventType.NETWORK_ERROR)
            .target(target)
            .attempt(attempt)
            .detail(message)
            .build());
    }

    public TelemetrySummary summarize() {
        int totalResponses = 0;
        int success = 0;
        int throttled = 0;
        int serverErrors = 0;
        int clientErrors = 0;
        int retries = 0;
        int terminal = 0;
        int networkErrors = 0;
        long totalLatency = 0;

        for (TelemetryEvent event : events) {
            switch (event.getType()) {
                case RESPONSE -> {
                    totalResponses++;
                    totalLatency += Math.max(0, event.getDurationMs());
                    int code = event.getStatusCode();
                    if (code >= 200 && code < 300) {
                        success++;
                    } else if (code == 429) {
                        throttled++;
                    } else if (code >= 500) {
                        serverErrors++;
                    } else if (code >= 400) {
                        clientErrors++;
                    }
                }
                case RETRY -> retries++;
                case TERMINAL_FAILURE -> terminal++;
                case NETWORK_ERROR -> networkErrors++;
            }
        }

        TelemetrySummary summary = TelemetrySummary.builder()
            .totalResponses(totalResponses)
            .successResponses(success)
            .throttledResponses(throttled)
            .serverErrors(serverErrors)
            .clientErrors(clientErrors)
            .retries(retries)
            .terminalFailures(terminal)
            .networkErrors(networkErrors)
            .totalLatencyMs(totalLatency)
            .build();
        summary.setNotices(buildNotices(summary));
        return summary;
    }

    public List<String> buildNotices() {
        return buildNotices(summarize());
    }

    private List<String> buildNotices(TelemetrySummary summary) {
        List<String> notices = new ArrayList<>();
        if (summary.getThrottledResponses() > 0) {
            notices.add("API ограничивало частоту запросов (429): " + summary.getThrottledResponses());
        }
        if (summary.getServerErrors() > 0) {
            notices.add("Сервер вернул " + summary.getServerErrors() + " ответов 5xx во время аудита");
        }
        if (summary.getNetworkErrors() > 0) {
            notices.add("Сетевые ошибки при обращении к API: " + summary.getNetworkErrors());
        }
        if (summary.getTerminalFailures() > 0) {
            notices.add("Запросов без результата (данные помечены как неизвестные): " + summary.getTerminalFailures());
        }
        return notices;
    }

    List<TelemetryEvent> getEvents() {
        return events;
    }
}

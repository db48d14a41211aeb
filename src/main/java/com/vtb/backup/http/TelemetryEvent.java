package com.vtb.backup.http;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
class TelemetryEvent {
    private TelemetryEventType type;
    private String target;
    private int statusCode;
    private int attempt;
    private long durationMs;
    private String detail;
}

package com.vtb.backup.http;

enum TelemetryEventType {
    RESPONSE,
    RETRY,
    TERMINAL_FAILURE,
    NETWORK_ERROR
}

package com.vtb.backup.http;

import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.http.ArmStubServer.StubResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResilientGetClientTest {

    private ArmStubServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new ArmStubServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void retriesRetryableStatusThenSucceeds() {
        server.sequence("/flaky",
            StubResponse.status(503),
            StubResponse.status(429),
            StubResponse.json("{\"ok\":true}"));
        ResilientGetClient client = server.client();

        Optional<ArmResponse> response = client.get("/flaky");

        assertTrue(response.isPresent());
        assertTrue(response.get().getBody().get("ok").asBoolean());
        assertEquals(3, server.hits("/flaky"));

        TelemetrySummary summary = client.getTelemetry().summarize();
        assertEquals(3, summary.getTotalResponses());
        assertEquals(1, summary.getSuccessResponses());
        assertEquals(1, summary.getThrottledResponses());
        assertEquals(1, summary.getServerErrors());
        assertEquals(2, summary.getRetries());
    }

    @Test
    void nonRetryableStatusIsTerminal() {
        server.sequence("/missing", StubResponse.status(404));

        Optional<ArmResponse> response = server.client().get("/missing");

        assertTrue(response.isEmpty());
        assertEquals(1, server.hits("/missing"));
    }

    @Test
    void forbiddenIsAbsenceNotAbort() {
        server.sequence("/rbac", StubResponse.status(403));

        assertTrue(server.client().get("/rbac").isEmpty());
        assertEquals(1, server.hits("/rbac"));
    }

    @Test
    void retryBudgetIsBounded() {
        server.sequence("/down", StubResponse.status(503));
        ResilientGetClient client = server.client();

        assertTrue(client.get("/down").isEmpty());
        assertEquals(5, server.hits("/down"));
        assertEquals(1, client.getTelemetry().summarize().getTerminalFailures());
        assertFalse(client.getTelemetry().buildNotices().isEmpty());
    }

    @Test
    void backoffDoublesPerAttempt() {
        server.sequence("/down", StubResponse.status(500));
        AuditConfig.Http settings = server.httpSettings();
        settings.setBackoffBaseSeconds(1L);
        List<Long> delays = new ArrayList<>();
        ResilientGetClient client = new ResilientGetClient(settings, () -> "t", new TelemetryCollector(), delays::add);

        assertTrue(client.get("/down").isEmpty());
        assertEquals(List.of(1_000L, 2_000L, 4_000L, 8_000L), delays);
    }

    @Test
    void unauthorizedAbortsRun() {
        server.sequence("/secret", StubResponse.status(401));

        assertThrows(AuthenticationException.class, () -> server.client().get("/secret"));
        assertEquals(1, server.hits("/secret"));
    }

    @Test
    void missingTokenAbortsRun() {
        ResilientGetClient client = new ResilientGetClient(server.httpSettings(),
            new StaticTokenProvider(" "), new TelemetryCollector());

        assertThrows(AuthenticationException.class, () -> client.get("/anything"));
        assertEquals(0, server.totalRequests());
    }

    @Test
    void networkFailureDegradesToAbsence() {
        String deadBase = server.baseUrl();
        server.close();
        AuditConfig.Http settings = new AuditConfig.Http();
        settings.setBaseUrl(deadBase);
        settings.setBackoffBaseSeconds(0L);
        settings.setMaxRetries(1);
        settings.ensureDefaults();
        ResilientGetClient client = new ResilientGetClient(settings, () -> "t", new TelemetryCollector());

        assertTrue(client.get("/vaults").isEmpty());
        assertEquals(2, client.getTelemetry().summarize().getNetworkErrors());
    }

    @Test
    void emptyBodyIsMissingNode() {
        server.sequence("/empty", new StubResponse(200, "", Map.of()));

        Optional<ArmResponse> response = server.client().get("/empty");

        assertTrue(response.isPresent());
        assertTrue(response.get().getBody().isMissingNode());
    }

    @Test
    void withQueryEncodesAndSkipsBlankValues() {
        ResilientGetClient client = server.client();
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("api-version", "2023-02-01");
        parameters.put("$filter", "backupManagementType eq 'AzureIaasVM'");
        parameters.put("$skiptoken", "");

        String url = client.withQuery("/subscriptions/s1/items", parameters);

        assertTrue(url.startsWith(server.baseUrl() + "/subscriptions/s1/items?api-version=2023-02-01"));
        assertTrue(url.contains("filter="));
        assertFalse(url.contains("skiptoken"));
        assertFalse(url.contains(" "));
    }

    @Test
    void resolveKeepsAbsoluteLinks() {
        ResilientGetClient client = server.client();

        assertEquals("https://management.azure.com/next?page=2",
            client.resolve("https://management.azure.com/next?page=2"));
        assertEquals(server.baseUrl() + "/a/b", client.resolve("a/b"));
        assertNull(client.resolve(" "));
    }
}

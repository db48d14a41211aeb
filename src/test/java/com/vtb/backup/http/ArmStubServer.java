package com.vtb.backup.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.vtb.backup.config.AuditConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Заглушка management API на локальном HttpServer.
 * Ответы задаются по пути запроса; незарегистрированный путь дает 404.
 */
public class ArmStubServer implements AutoCloseable {

    public static final class StubResponse {
        final int status;
        final String body;
        final Map<String, String> headers;

        public StubResponse(int status, String body, Map<String, String> headers) {
            this.status = status;
            this.body = body;
            this.headers = headers;
        }

        public static StubResponse json(String body) {
            return new StubResponse(200, body, Map.of());
        }

        public static StubResponse status(int status) {
            return new StubResponse(status, null, Map.of());
        }
    }

    private final HttpServer server;
    private boolean stopped;
    private final Map<String, Function<Map<String, String>, StubResponse>> routes = new ConcurrentHashMap<>();
    private final Map<String, Deque<StubResponse>> sequences = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
    private final List<String> requests = Collections.synchronizedList(new ArrayList<>());

    public ArmStubServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public String baseUrl() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    /**
     * Конфигурация HTTP без задержек между повторами
     */
    public AuditConfig.Http httpSettings() {
        AuditConfig.Http http = new AuditConfig.Http();
        http.setBaseUrl(baseUrl());
        http.setBackoffBaseSeconds(0L);
        http.setTimeoutSec(5);
        http.ensureDefaults();
        return http;
    }

    public ResilientGetClient client() {
        return new ResilientGetClient(httpSettings(), () -> "test-token", new TelemetryCollector());
    }

    public ArmStubServer json(String path, String body) {
        routes.put(path, query -> StubResponse.json(body));
        return this;
    }

    public ArmStubServer route(String path, Function<Map<String, String>, StubResponse> handler) {
        routes.put(path, handler);
        return this;
    }

    /**
     * Ответы по очереди; последний повторяется
     */
    public ArmStubServer sequence(String path, StubResponse... responses) {
        Deque<StubResponse> queue = new ArrayDeque<>(List.of(responses));
        sequences.put(path, queue);
        return this;
    }

    public int hits(String path) {
        AtomicInteger counter = hits.get(path);
        return counter != null ? counter.get() : 0;
    }

    public int totalRequests() {
        return requests.size();
    }

    public List<String> requests() {
        return new ArrayList<>(requests);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        requests.add(exchange.getRequestURI().toString());
        hits.computeIfAbsent(path, key -> new AtomicInteger()).incrementAndGet();

        StubResponse response;
        Deque<StubResponse> queue = sequences.get(path);
        if (queue != null) {
            synchronized (queue) {
                response = queue.size() > 1 ? queue.poll() : queue.peek();
            }
        } else if (routes.containsKey(path)) {
            response = routes.get(path).apply(query(exchange.getRequestURI().getQuery()));
        } else {
            response = StubResponse.status(404);
        }
        respond(exchange, response);
    }

    private void respond(HttpExchange exchange, StubResponse response) throws IOException {
        response.headers.forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
        if (response.body == null) {
            exchange.getResponseHeaders().add("Connection", "close");
            exchange.sendResponseHeaders(response.status, -1);
            exchange.close();
            return;
        }
        byte[] body = response.body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private static Map<String, String> query(String raw) {
        Map<String, String> parameters = new HashMap<>();
        if (raw == null || raw.isEmpty()) {
            return parameters;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                parameters.put(pair.substring(0, eq), pair.substring(eq + 1));
            } else {
                parameters.put(pair, "");
            }
        }
        return parameters;
    }

    @Override
    public synchronized void close() {
        if (!stopped) {
            stopped = true;
            server.stop(0);
        }
    }
}

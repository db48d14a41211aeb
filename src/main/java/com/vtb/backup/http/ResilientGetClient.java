package com.vtb.backup.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.vtb.backup.config.AuditConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * GET-клиент management API с ограниченным числом повторов.
 *
 * Статусы 429/500/502/503/504 и сетевые ошибки повторяются с задержкой
 * base * 2^attempt секунд. Любой другой неуспешный статус завершает вызов.
 * Вызывающий код видит только {@link Optional#empty()}, исключения наружу
 * выходят лишь при ошибке аутентификации.
 */
@Slf4j
public class ResilientGetClient {

    /**
     * Пауза между попытками; в тестах подменяется
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final AuditConfig.Http settings;
    private final AccessTokenProvider tokenProvider;
    private final TelemetryCollector telemetry;
    private final OkHttpClient httpClient;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Set<Integer> retryableStatuses;

    public ResilientGetClient(AuditConfig.Http settings,
                              AccessTokenProvider tokenProvider,
                              TelemetryCollector telemetry) {
        this(settings, tokenProvider, telemetry, Thread::sleep);
    }

    public ResilientGetClient(AuditConfig.Http settings,
                              AccessTokenProvider tokenProvider,
                              TelemetryCollector telemetry,
                              Sleeper sleeper) {
        this.settings = settings;
        this.tokenProvider = tokenProvider;
        this.telemetry = telemetry != null ? telemetry : new TelemetryCollector();
        this.sleeper = sleeper;
        this.retryableStatuses = new HashSet<>(settings.getRetryableStatuses());
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(settings.getTimeoutSec(), TimeUnit.SECONDS)
            .readTimeout(settings.getTimeoutSec(), TimeUnit.SECONDS)
            .callTimeout(settings.getTimeoutSec(), TimeUnit.SECONDS)
            .followRedirects(true)
            .retryOnConnectionFailure(false)
            .build();
    }

    /**
     * Выполнить GET.
     *
     * @param target абсолютный URL (например, nextLink) или путь относительно baseUrl
     * @return разобранный ответ или пусто, если ответа получить не удалось
     */
    public Optional<ArmResponse> get(String target) {
        String url = resolve(target);
        if (url == null) {
            log.debug("Некорректный адрес запроса: {}", target);
            return Optional.empty();
        }

        int maxRetries = settings.getMaxRetries();
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            Request request = new Request.Builder()
                .url(url)
                .addHeader("Authorization", "Bearer " + tokenProvider.getAccessToken())
                .addHeader("Accept", "application/json")
                .addHeader("User-Agent", "VTB-Backup-Posture-Scanner/1.0")
                .get()
                .build();

            long start = System.nanoTime();
            Integer retryStatus = null;
            try (Response response = httpClient.newCall(request).execute()) {
                long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                int code = response.code();
                telemetry.recordResponse(url, code, attempt, durationMs);

                if (response.isSuccessful()) {
                    return Optional.of(new ArmResponse(code, readBody(url, response.body()), collectHeaders(response)));
                }
                if (code == 401) {
                    telemetry.recordTerminalFailure(url, code, attempt);
                    throw new AuthenticationException("Management API отклонил токен (401): " + url);
                }
                if (!retryableStatuses.contains(code) || attempt == maxRetries) {
                    log.warn("GET {} завершился статусом {} (попытка {}/{}), результат неизвестен",
                        url, code, attempt + 1, maxRetries + 1);
                    telemetry.recordTerminalFailure(url, code, attempt);
                    return Optional.empty();
                }
                log.warn("GET {} вернул {} (попытка {}/{}), повтор", url, code, attempt + 1, maxRetries + 1);
                telemetry.recordRetry(url, code, attempt);
                retryStatus = code;
            } catch (IOException e) {
                log.warn("Сетевая ошибка GET {} (попытка {}/{}): {}", url, attempt + 1, maxRetries + 1, e.getMessage());
                telemetry.recordNetworkError(url, attempt, e.getMessage());
                if (attempt == maxRetries) {
                    telemetry.recordTerminalFailure(url, 0, attempt);
                    return Optional.empty();
                }
            }

            if (!pause(attempt)) {
                log.warn("Ожидание повтора прервано, GET {} (последний статус {})", url, retryStatus);
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public TelemetryCollector getTelemetry() {
        return telemetry;
    }

    private boolean pause(int attempt) {
        long delayMs = TimeUnit.SECONDS.toMillis(settings.getBackoffBaseSeconds()) * (1L << attempt);
        if (delayMs <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private JsonNode readBody(String url, ResponseBody body) {
        if (body == null) {
            return MissingNode.getInstance();
        }
        try {
            String text = body.string();
            if (text.isBlank()) {
                return MissingNode.getInstance();
            }
            return objectMapper.readTree(text);
        } catch (IOException e) {
            log.debug("Не удалось разобрать тело ответа {}: {}", url, e.getMessage());
            return MissingNode.getInstance();
        }
    }

    private Map<String, String> collectHeaders(Response response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : response.headers().names()) {
            headers.put(name, response.header(name));
        }
        return headers;
    }

    /**
     * Адрес с параметрами запроса; пустые значения параметров пропускаются
     */
    public String withQuery(String target, Map<String, String> parameters) {
        String resolved = resolve(target);
        HttpUrl url = resolved != null ? HttpUrl.parse(resolved) : null;
        if (url == null) {
            return null;
        }
        HttpUrl.Builder builder = url.newBuilder();
        for (Map.Entry<String, String> parameter : parameters.entrySet()) {
            if (parameter.getValue() != null && !parameter.getValue().isBlank()) {
                builder.setQueryParameter(parameter.getKey(), parameter.getValue());
            }
        }
        return builder.build().toString();
    }

    /**
     * Абсолютный URL для пути или ссылки; null, если адрес некорректен
     */
    public String resolve(String target) {
        if (target == null || target.isBlank()) {
            return null;
        }
        String trimmed = target.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return HttpUrl.parse(trimmed) != null ? trimmed : null;
        }
        String base = settings.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String path = trimmed.startsWith("/") ? trimmed : "/" + trimmed;
        HttpUrl resolved = HttpUrl.parse(base + path);
        return resolved != null ? resolved.toString() : null;
    }
}

package com.vtb.backup.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Успешный ответ management API: код, тело в виде дерева JSON и заголовки.
 * Поиск заголовков нечувствителен к регистру.
 */
public class ArmResponse {

    private final int statusCode;
    private final JsonNode body;
    private final Map<String, String> headers;

    public ArmResponse(int statusCode, JsonNode body, Map<String, String> headers) {
        this.statusCode = statusCode;
        this.body = body != null ? body : MissingNode.getInstance();
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public JsonNode getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Значение заголовка без учета регистра имени; пустое значение считается отсутствующим
     */
    public String header(String name) {
        if (name == null) {
            return null;
        }
        String value = headers.get(name);
        return value == null || value.isBlank() ? null : value;
    }
}

package com.vtb.backup.util;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;

/**
 * Доступ к полям JSON без учета регистра имен.
 * Разные версии API возвращают одни и те же поля в разном регистре.
 */
@Slf4j
public final class JsonFields {

    private JsonFields() {
    }

    /**
     * Поле объекта по имени без учета регистра; точное совпадение имеет приоритет
     */
    public static JsonNode field(JsonNode node, String name) {
        if (node == null || !node.isObject() || name == null) {
            return null;
        }
        JsonNode exact = node.get(name);
        if (exact != null) {
            return exact;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Первое присутствующее (не null) поле из списка имен в порядке приоритета
     */
    public static JsonNode firstField(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = field(node, name);
            if (value != null && !value.isNull() && !value.isMissingNode()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Вложенное поле по пути имен
     */
    public static JsonNode path(JsonNode node, String... names) {
        JsonNode current = node;
        for (String name : names) {
            current = field(current, name);
            if (current == null || current.isNull()) {
                return null;
            }
        }
        return current;
    }

    public static String text(JsonNode node, String... path) {
        JsonNode value = path(node, path);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text;
    }

    public static Integer integer(JsonNode node, String... path) {
        JsonNode value = path(node, path);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        if (value.isNumber()) {
            return value.intValue();
        }
        try {
            return Integer.parseInt(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Boolean bool(JsonNode node, String... path) {
        JsonNode value = path(node, path);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        String text = value.asText().trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("enabled") || text.equalsIgnoreCase("on")) {
            return Boolean.TRUE;
        }
        if (text.equalsIgnoreCase("false") || text.equalsIgnoreCase("disabled") || text.equalsIgnoreCase("off")) {
            return Boolean.FALSE;
        }
        return null;
    }

    /**
     * Свойства ресурса: объект "properties" или сам узел
     */
    public static JsonNode properties(JsonNode resource) {
        JsonNode properties = field(resource, "properties");
        return properties != null && properties.isObject() ? properties : resource;
    }

    /**
     * Разбор отметки времени ISO-8601; без смещения считается UTC
     */
    public static Instant instant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // ниже пробуем формат без смещения
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // ниже пробуем формат без зоны
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Не удалось разобрать время '{}': {}", text, e.getMessage());
            return null;
        }
    }
}

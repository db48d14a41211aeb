package com.vtb.backup.pagination;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

final class PageItems {

    private PageItems() {
    }

    /**
     * Элементы страницы: массив "value" или сам корень, если он массив
     */
    static void collect(JsonNode body, List<JsonNode> target) {
        if (body == null || body.isMissingNode() || body.isNull()) {
            return;
        }
        JsonNode items = body.isArray() ? body : body.get("value");
        if (items == null || !items.isArray()) {
            return;
        }
        for (JsonNode item : items) {
            target.add(item);
        }
    }

    /**
     * Ссылка на следующую страницу из поля nextLink; null на последней странице
     */
    static String nextLink(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        JsonNode link = body.get("nextLink");
        if (link == null || !link.isTextual() || link.asText().isBlank()) {
            return null;
        }
        return link.asText();
    }
}

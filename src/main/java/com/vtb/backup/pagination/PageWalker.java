package com.vtb.backup.pagination;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.function.Predicate;

/**
 * Обход постраничных ответов management API.
 * Элементы всех страниц возвращаются одной последовательностью в порядке получения.
 */
public interface PageWalker {

    /**
     * @param target     адрес первой страницы
     * @param sufficient условие досрочной остановки по уже накопленным элементам
     * @return накопленные элементы; страница, которую не удалось получить, завершает обход
     */
    List<JsonNode> walk(String target, Predicate<List<JsonNode>> sufficient);

    default List<JsonNode> walk(String target) {
        return walk(target, items -> false);
    }
}

package com.vtb.backup.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.http.ArmResponse;
import com.vtb.backup.http.ResilientGetClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Пагинация по полю nextLink в теле ответа; отсутствие поля означает последнюю страницу
 */
@Slf4j
public class NextLinkPaginationWalker implements PageWalker {

    private final ResilientGetClient client;
    private final int maxPages;

    public NextLinkPaginationWalker(ResilientGetClient client, int maxPages) {
        this.client = client;
        this.maxPages = maxPages;
    }

    @Override
    public List<JsonNode> walk(String target, Predicate<List<JsonNode>> sufficient) {
        List<JsonNode> items = new ArrayList<>();
        String next = target;
        int pages = 0;
        while (next != null && pages < maxPages) {
            Optional<ArmResponse> response = client.get(next);
            pages++;
            if (response.isEmpty()) {
                log.debug("Страница {} для {} не получена, пагинация прервана", pages, target);
                break;
            }
            JsonNode body = response.get().getBody();
            PageItems.collect(body, items);
            if (sufficient != null && sufficient.test(items)) {
                break;
            }
            next = PageItems.nextLink(body);
        }
        if (next != null && pages >= maxPages) {
            log.warn("Достигнут лимит страниц ({}) для {}", maxPages, target);
        }
        return items;
    }
}

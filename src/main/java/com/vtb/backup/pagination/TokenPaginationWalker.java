package com.vtb.backup.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.http.ArmResponse;
import com.vtb.backup.http.ResilientGetClient;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Пагинация по токену продолжения из заголовка ответа.
 * Имя заголовка сравнивается без учета регистра, токен передается в следующий запрос
 * параметром запроса. Без заголовка обход продолжается по nextLink из тела ответа
 * (так пагинирует список точек восстановления Recovery Services), иначе страница последняя.
 */
@Slf4j
public class TokenPaginationWalker implements PageWalker {

    private final ResilientGetClient client;
    private final String continuationHeader;
    private final String queryParameter;
    private final int maxPages;

    public TokenPaginationWalker(ResilientGetClient client, String continuationHeader,
                                 String queryParameter, int maxPages) {
        this.client = client;
        this.continuationHeader = continuationHeader;
        this.queryParameter = queryParameter;
        this.maxPages = maxPages;
    }

    @Override
    public List<JsonNode> walk(String target, Predicate<List<JsonNode>> sufficient) {
        List<JsonNode> items = new ArrayList<>();
        String firstPage = client.resolve(target);
        if (firstPage == null) {
            return items;
        }

        String next = firstPage;
        int pages = 0;
        while (next != null && pages < maxPages) {
            Optional<ArmResponse> response = client.get(next);
            pages++;
            if (response.isEmpty()) {
                log.debug("Страница {} для {} не получена, пагинация прервана", pages, firstPage);
                break;
            }
            JsonNode body = response.get().getBody();
            PageItems.collect(body, items);
            if (sufficient != null && sufficient.test(items)) {
                break;
            }
            String token = response.get().header(continuationHeader);
            next = token != null ? withToken(firstPage, token) : PageItems.nextLink(body);
        }
        if (next != null && pages >= maxPages) {
            log.warn("Достигнут лимит страниц ({}) для {}", maxPages, firstPage);
        }
        return items;
    }

    private String withToken(String firstPage, String token) {
        HttpUrl url = HttpUrl.parse(firstPage);
        if (url == null) {
            return null;
        }
        return url.newBuilder()
            .setQueryParameter(queryParameter, token)
            .build()
            .toString();
    }
}

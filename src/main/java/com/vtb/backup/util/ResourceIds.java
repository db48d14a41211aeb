package com.vtb.backup.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор идентификаторов ресурсов по шаблону resourceGroup + provider/type.
 * Шаблон терпим к регистру, лишним сегментам и завершающему слэшу.
 */
public final class ResourceIds {

    private static final Pattern RESOURCE_ID = Pattern.compile(
        "/subscriptions/([^/]+)/resourceGroups/([^/]+)/providers/([^/]+/[^/]+)/([^/?#]+)((?:/[^/?#]+/[^/?#]+)*)",
        Pattern.CASE_INSENSITIVE);

    private ResourceIds() {
    }

    /**
     * Разобранный идентификатор ресурса
     */
    public record ResourceId(String subscriptionId,
                             String resourceGroup,
                             String providerType,
                             String name,
                             String normalized) {
    }

    public static Optional<ResourceId> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = RESOURCE_ID.matcher(text.trim());
        if (!matcher.find()) {
            return Optional.empty();
        }
        String suffix = matcher.group(5) != null ? matcher.group(5) : "";
        String canonical = "/subscriptions/" + matcher.group(1)
            + "/resourceGroups/" + matcher.group(2)
            + "/providers/" + matcher.group(3)
            + "/" + matcher.group(4)
            + suffix;
        return Optional.of(new ResourceId(
            matcher.group(1),
            matcher.group(2),
            matcher.group(3),
            matcher.group(4),
            normalize(canonical)));
    }

    /**
     * Ключ для сравнения без учета регистра
     */
    public static String normalize(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Последний сегмент идентификатора (имя ресурса)
     */
    public static String lastSegment(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        String trimmed = id.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}

package com.vtb.backup.schedule;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор длительностей вида P[nD][T[nH][nM][nS]]. Никогда не бросает исключений.
 */
@Slf4j
public final class DurationParser {

    private static final Pattern DURATION = Pattern.compile(
        "^P(?:(\\d+)D)?(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?)?$",
        Pattern.CASE_INSENSITIVE);

    private DurationParser() {
    }

    public static Optional<IsoDuration> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim();
        if (value.length() < 2 || value.endsWith("T") || value.endsWith("t")) {
            return Optional.empty();
        }
        Matcher matcher = DURATION.matcher(value);
        if (!matcher.matches()) {
            log.debug("Длительность вне поддерживаемой грамматики: {}", value);
            return Optional.empty();
        }
        if (matcher.group(1) == null && matcher.group(2) == null
            && matcher.group(3) == null && matcher.group(4) == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new IsoDuration(
                number(matcher.group(1)),
                number(matcher.group(2)),
                number(matcher.group(3)),
                number(matcher.group(4))));
        } catch (NumberFormatException e) {
            log.debug("Слишком большое значение длительности: {}", value);
            return Optional.empty();
        }
    }

    /**
     * Завершающая длительность повторяющегося интервала, например
     * "R/2024-01-01T02:00:00+00:00/PT4H" дает PT4H
     */
    public static Optional<IsoDuration> parseTrailing(String interval) {
        if (interval == null || interval.isBlank()) {
            return Optional.empty();
        }
        String value = interval.trim();
        int slash = value.lastIndexOf('/');
        return parse(slash >= 0 ? value.substring(slash + 1) : value);
    }

    private static long number(String group) {
        return group == null ? 0L : Long.parseLong(group);
    }
}

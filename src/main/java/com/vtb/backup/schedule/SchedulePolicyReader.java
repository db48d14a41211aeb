package com.vtb.backup.schedule;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.backup.util.JsonFields;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Чтение одного объекта schedulePolicy (классического, V2 или журнального).
 *
 * Явный интервал имеет приоритет. Для ежедневных и еженедельных расписаний без
 * интервала периодичность равна наибольшему разрыву между отсортированными
 * временами запуска (с переходом через полночь) или днями недели (с переходом
 * через границу недели). Это верхняя оценка худшего разрыва, а не число запусков.
 */
@Slf4j
class SchedulePolicyReader {

    private static final long DAY_SECONDS = 86_400L;
    private static final long WEEK_DAYS = 7L;

    /**
     * Поля с явным интервалом, в порядке приоритета
     */
    private static final String[] INTERVAL_FIELDS = {
        "scheduleFrequencyInMins", "repeatingTimeIntervals", "scheduleInterval", "interval"
    };

    /**
     * Поля окна резервного копирования, в порядке приоритета
     */
    private static final String[] WINDOW_FIELDS = {
        "scheduleWindowDuration", "windowDuration", "backupWindowDuration"
    };

    Optional<Long> cadenceSeconds(JsonNode schedule) {
        if (schedule == null || !schedule.isObject()) {
            return Optional.empty();
        }

        Optional<Long> explicit = explicitInterval(schedule);
        if (explicit.isPresent()) {
            return explicit;
        }

        JsonNode hourly = JsonFields.field(schedule, "hourlySchedule");
        if (hourly != null && hourly.isObject()) {
            Optional<Long> hourlyInterval = hourlyInterval(hourly);
            if (hourlyInterval.isPresent()) {
                return hourlyInterval;
            }
        }

        String frequency = JsonFields.text(schedule, "scheduleRunFrequency");
        String normalizedFrequency = frequency != null ? frequency.toLowerCase(Locale.ROOT) : "";
        switch (normalizedFrequency) {
            case "hourly":
                return hourly != null ? hourlyInterval(hourly) : Optional.empty();
            case "daily":
                return Optional.of(dailyGap(runTimes(schedule, "dailySchedule")));
            case "weekly":
                return Optional.of(weeklyGap(runDays(schedule)));
            default:
                break;
        }

        // Частота не указана: пробуем вложенные расписания V2
        if (JsonFields.field(schedule, "dailySchedule") != null) {
            return Optional.of(dailyGap(runTimes(schedule, "dailySchedule")));
        }
        if (JsonFields.field(schedule, "weeklySchedule") != null) {
            return Optional.of(weeklyGap(runDays(schedule)));
        }
        log.debug("Не удалось определить периодичность расписания: {}", schedule);
        return Optional.empty();
    }

    /**
     * Окно резервного копирования в часах, независимо от периодичности
     */
    Optional<Double> windowHours(JsonNode schedule) {
        if (schedule == null || !schedule.isObject()) {
            return Optional.empty();
        }
        JsonNode window = JsonFields.firstField(schedule, WINDOW_FIELDS);
        if (window == null) {
            JsonNode hourly = JsonFields.field(schedule, "hourlySchedule");
            window = JsonFields.firstField(hourly, WINDOW_FIELDS);
        }
        if (window == null || window.isContainerNode()) {
            return Optional.empty();
        }
        if (window.isNumber()) {
            return window.asDouble() > 0 ? Optional.of(window.asDouble()) : Optional.empty();
        }
        String text = window.asText().trim();
        Optional<IsoDuration> iso = DurationParser.parse(text);
        if (iso.isPresent()) {
            return Optional.of(Cadence.round2(iso.get().toHours()));
        }
        try {
            double hours = Double.parseDouble(text);
            return hours > 0 ? Optional.of(hours) : Optional.empty();
        } catch (NumberFormatException e) {
            log.debug("Неизвестный формат окна резервного копирования: {}", text);
            return Optional.empty();
        }
    }

    private Optional<Long> explicitInterval(JsonNode schedule) {
        for (String field : INTERVAL_FIELDS) {
            JsonNode value = JsonFields.field(schedule, field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (field.equals("scheduleFrequencyInMins")) {
                if (value.canConvertToInt() && value.asInt() > 0) {
                    return Optional.of(value.asInt() * 60L);
                }
                continue;
            }
            if (value.isArray()) {
                // несколько интервалов: берем длительность из хвоста первого
                if (value.size() > 0) {
                    Optional<IsoDuration> trailing = DurationParser.parseTrailing(value.get(0).asText());
                    if (trailing.isPresent() && trailing.get().toSeconds() > 0) {
                        return Optional.of(trailing.get().toSeconds());
                    }
                }
                continue;
            }
            if (value.isTextual()) {
                Optional<IsoDuration> parsed = DurationParser.parseTrailing(value.asText());
                if (parsed.isPresent() && parsed.get().toSeconds() > 0) {
                    return Optional.of(parsed.get().toSeconds());
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Long> hourlyInterval(JsonNode hourly) {
        Integer interval = JsonFields.integer(hourly, "interval");
        if (interval != null && interval > 0) {
            return Optional.of(interval * 3_600L);
        }
        return Optional.empty();
    }

    private List<String> runTimes(JsonNode schedule, String nestedField) {
        List<String> values = new ArrayList<>();
        JsonNode times = JsonFields.field(schedule, "scheduleRunTimes");
        if (times == null || !times.isArray() || times.size() == 0) {
            times = JsonFields.path(schedule, nestedField, "scheduleRunTimes");
        }
        if (times == null || !times.isArray() || times.size() == 0) {
            times = JsonFields.path(schedule, "weeklySchedule", "scheduleRunTimes");
        }
        if (times != null && times.isArray()) {
            times.forEach(node -> values.add(node.asText()));
        }
        return values;
    }

    private List<String> runDays(JsonNode schedule) {
        List<String> values = new ArrayList<>();
        JsonNode days = JsonFields.field(schedule, "scheduleRunDays");
        if (days == null || !days.isArray() || days.size() == 0) {
            days = JsonFields.path(schedule, "weeklySchedule", "scheduleRunDays");
        }
        if (days != null && days.isArray()) {
            days.forEach(node -> values.add(node.asText()));
        }
        return values;
    }

    /**
     * Наибольший разрыв между временами запуска в сутках; один запуск дает 24 часа
     */
    long dailyGap(List<String> runTimes) {
        TreeSet<Long> secondsOfDay = new TreeSet<>();
        for (String time : runTimes) {
            Long seconds = secondOfDay(time);
            if (seconds != null) {
                secondsOfDay.add(seconds);
            }
        }
        return maxCircularGap(new ArrayList<>(secondsOfDay), DAY_SECONDS);
    }

    /**
     * Наибольший разрыв между днями запуска в неделе; один день дает 7 суток
     */
    long weeklyGap(List<String> runDays) {
        TreeSet<Long> dayIndexes = new TreeSet<>();
        for (String day : runDays) {
            try {
                dayIndexes.add((long) DayOfWeek.valueOf(day.trim().toUpperCase(Locale.ROOT)).ordinal());
            } catch (IllegalArgumentException e) {
                log.debug("Неизвестный день недели в расписании: {}", day);
            }
        }
        return maxCircularGap(new ArrayList<>(dayIndexes), WEEK_DAYS) * DAY_SECONDS;
    }

    private long maxCircularGap(List<Long> sorted, long period) {
        if (sorted.size() <= 1) {
            return period;
        }
        long maxGap = 0;
        for (int i = 1; i < sorted.size(); i++) {
            maxGap = Math.max(maxGap, sorted.get(i) - sorted.get(i - 1));
        }
        long wrap = sorted.get(0) + period - sorted.get(sorted.size() - 1);
        return Math.max(maxGap, wrap);
    }

    private Long secondOfDay(String time) {
        if (time == null || time.isBlank()) {
            return null;
        }
        String value = time.trim();
        try {
            Instant instant = JsonFields.instant(value);
            if (instant != null) {
                return (long) instant.atOffset(ZoneOffset.UTC).toLocalTime().toSecondOfDay();
            }
            return (long) LocalTime.parse(value).toSecondOfDay();
        } catch (DateTimeParseException e) {
            log.debug("Неизвестный формат времени запуска: {}", value);
            return null;
        }
    }
}

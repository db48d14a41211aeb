package com.vtb.backup.schedule;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Длительность в ограниченной грамматике P[nD][T[nH][nM][nS]].
 * Недели, месяцы и годы не поддерживаются.
 */
@Getter
@EqualsAndHashCode
public final class IsoDuration {

    private final long days;
    private final long hours;
    private final long minutes;
    private final long seconds;

    public IsoDuration(long days, long hours, long minutes, long seconds) {
        this.days = days;
        this.hours = hours;
        this.minutes = minutes;
        this.seconds = seconds;
    }

    public long toSeconds() {
        return days * 86_400L + hours * 3_600L + minutes * 60L + seconds;
    }

    public double toHours() {
        return toSeconds() / 3_600.0;
    }

    /**
     * Обратное представление в той же грамматике (нулевые компоненты опускаются)
     */
    public String toIsoString() {
        StringBuilder sb = new StringBuilder("P");
        if (days > 0) {
            sb.append(days).append('D');
        }
        if (hours > 0 || minutes > 0 || seconds > 0) {
            sb.append('T');
            if (hours > 0) {
                sb.append(hours).append('H');
            }
            if (minutes > 0) {
                sb.append(minutes).append('M');
            }
            if (seconds > 0) {
                sb.append(seconds).append('S');
            }
        }
        if (sb.length() == 1) {
            sb.append("T0S");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toIsoString();
    }
}

package com.vtb.backup.schedule;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Нормализованная периодичность. Текстовое представление только производное.
 */
@Value
public class Cadence {

    public enum Unit {
        HOURS,
        MINUTES,
        SECONDS
    }

    long rawSeconds;
    double value;
    Unit unit;

    public double getHours() {
        return switch (unit) {
            case HOURS -> value;
            case MINUTES -> round2(value / 60.0);
            case SECONDS -> round2(value / 3_600.0);
        };
    }

    public String getText() {
        String number = format(value);
        return switch (unit) {
            case HOURS -> "Every " + number + (value == 1.0 ? " hour" : " hours");
            case MINUTES -> "Every " + number + (value == 1.0 ? " minute" : " minutes");
            case SECONDS -> "Every " + number + (value == 1.0 ? " second" : " seconds");
        };
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}

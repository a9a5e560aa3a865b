package com.batterysmart.swap_ledger.swap;

import com.batterysmart.swap_ledger.exception.InvalidInputException;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Named windows for swap history, in calendar days of the business zone.
 * LAST_WEEK and LAST_MONTH reach back 7 and 30 days and include today.
 * ALL has no lower bound.
 */
public enum HistoryPeriod {
    TODAY,
    YESTERDAY,
    LAST_WEEK,
    LAST_MONTH,
    ALL,
    CUSTOM;

    public static HistoryPeriod fromString(String value) {
        if (value == null || value.isBlank()) {
            return TODAY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("period", "Unknown history period: " + value);
        }
    }

    /**
     * @return the first day of the window, or null when it is unbounded
     */
    LocalDate startFrom(LocalDate today) {
        return switch (this) {
            case TODAY -> today;
            case YESTERDAY -> today.minusDays(1);
            case LAST_WEEK -> today.minusDays(7);
            case LAST_MONTH -> today.minusDays(30);
            case ALL -> null;
            case CUSTOM -> throw new IllegalStateException("CUSTOM has no implied start");
        };
    }

    LocalDate endFrom(LocalDate today) {
        return this == YESTERDAY ? today.minusDays(1) : today;
    }
}

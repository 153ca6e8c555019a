package com.finboard.ledger.support;

import com.finboard.ledger.error.ValidationException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Lenient ISO-8601 parsing for dates arriving in query strings and CSV cells.
 */
public final class DateTimes {

    private DateTimes() {
    }

    /**
     * Accepts {@code 2024-01-31}, {@code 2024-01-31T09:30:00} and offset forms such as
     * {@code 2024-01-31T09:30:00Z}. Values without an offset are read in {@code zone}; a bare date
     * means the start of that day. Returns null for null or blank input.
     */
    public static Instant parseInstant(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(zone).toInstant();
            }
            if (hasOffset(value)) {
                return OffsetDateTime.parse(value).toInstant();
            }
            return LocalDateTime.parse(value).atZone(zone).toInstant();
        } catch (DateTimeParseException ex) {
            throw new ValidationException("Invalid date: " + raw);
        }
    }

    private static boolean hasOffset(String value) {
        if (value.endsWith("Z") || value.endsWith("z")) {
            return true;
        }
        int timeStart = value.indexOf('T');
        if (timeStart < 0) {
            return false;
        }
        String time = value.substring(timeStart);
        return time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }
}

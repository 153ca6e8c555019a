package com.finboard.ledger.imports;

import com.finboard.ledger.error.ValidationException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * One data row of an uploaded CSV keyed by lower-cased header name. {@code number} is 1-based and
 * counts data rows only.
 */
public record CsvRow(int number, Map<String, String> cells) {

    public String optional(String column) {
        String value = cells.get(column);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public String required(String column) {
        String value = optional(column);
        if (value == null) {
            throw new ValidationException("missing " + column);
        }
        return value;
    }

    public BigDecimal requiredDecimal(String column) {
        String value = required(column);
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException ex) {
            throw new ValidationException("invalid " + column + " '" + value + "'");
        }
    }

    public BigDecimal optionalDecimal(String column) {
        return optional(column) == null ? null : requiredDecimal(column);
    }

    public UUID requiredUuid(String column) {
        String value = required(column);
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("invalid " + column + " '" + value + "'");
        }
    }
}

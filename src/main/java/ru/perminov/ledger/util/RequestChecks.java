package ru.perminov.ledger.util;

import ru.perminov.ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Structural checks on incoming requests. Each failure is a {@link ValidationException}
 * whose message names the offending field.
 */
public final class RequestChecks {

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private RequestChecks() {
    }

    public static LocalDate isoDate(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        if (!ISO_DATE.matcher(value).matches()) {
            throw new ValidationException(field + " must be in YYYY-MM-DD format");
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + " must be in YYYY-MM-DD format");
        }
    }

    public static BigDecimal present(BigDecimal value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    public static BigDecimal positive(BigDecimal value, String field) {
        present(value, field);
        if (value.signum() <= 0) {
            throw new ValidationException(field + " must be greater than zero");
        }
        return value;
    }

    public static BigDecimal notNegative(BigDecimal value, String field) {
        present(value, field);
        if (value.signum() < 0) {
            throw new ValidationException(field + " must not be negative");
        }
        return value;
    }

    public static String text(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return optionalText(value, field, maxLength);
    }

    public static String optionalText(String value, String field, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new ValidationException(field + " must be at most " + maxLength + " characters");
        }
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static long scaled(BigDecimal value, String field) {
        try {
            return FixedPoint.scale(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field + " is out of range");
        }
    }
}

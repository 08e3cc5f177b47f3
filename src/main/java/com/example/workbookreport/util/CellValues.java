package com.example.workbookreport.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for the cell value types a report can carry: text, numbers, dates and date-times.
 */
public final class CellValues {
    private static final Logger LOGGER = LoggerFactory.getLogger(CellValues.class);
    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private CellValues() {
    }

    public static boolean isSupported(Object value) {
        return value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof LocalDate
                || value instanceof LocalDateTime;
    }

    public static Optional<Double> asDouble(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        return Optional.empty();
    }

    public static Optional<LocalDateTime> asDateTime(Object value) {
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime);
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date.atStartOfDay());
        }
        return Optional.empty();
    }

    /**
     * Text a spreadsheet would show for the value. Used for column width measurement.
     *
     * @throws RuntimeException when the value's own string conversion fails
     */
    public static String displayText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return Double.toString(number);
            }
            return BigDecimal.valueOf(number).toPlainString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof LocalDateTime dateTime) {
            return DATE_TIME_FORMATTER.format(dateTime);
        }
        return value.toString();
    }

    /**
     * Same as {@link #displayText(Object)} but falls back to the empty string for a value that
     * cannot be rendered as text.
     */
    public static String displayTextOrEmpty(Object value) {
        try {
            return displayText(value);
        } catch (RuntimeException e) {
            LOGGER.debug("Cell value of type {} has no text form, measuring it as empty",
                    value.getClass().getName(), e);
            return "";
        }
    }
}

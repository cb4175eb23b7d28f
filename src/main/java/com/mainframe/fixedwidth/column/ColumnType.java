package com.mainframe.fixedwidth.column;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Built-in value coercions for columns.
 */
public enum ColumnType {
    /**
     * Text, kept as-is once padding is removed.
     */
    STRING,

    /**
     * Whole number, parsed to {@link Long}.
     */
    INTEGER,

    /**
     * Decimal number, parsed to {@link BigDecimal}. Without an explicit decimal point the
     * column's scale gives the number of implied decimal places (as in PIC 9(5)V99).
     */
    DECIMAL,

    /**
     * Calendar date, parsed to {@link LocalDate} with the column's pattern.
     */
    DATE;

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    Object parse(String text, int scale, DateTimeFormatter pattern) {
        return switch (this) {
        case STRING -> text;
        case INTEGER -> text.isBlank() ? null : Long.valueOf(text.trim());
        case DECIMAL -> text.isBlank() ? null : parseDecimal(text.trim(), scale);
        case DATE -> text.isBlank() ? null : LocalDate.parse(text.trim(), pattern);
        };
    }

    String format(Object value, int scale, DateTimeFormatter pattern) {
        if (value == null) {
            return "";
        }
        return switch (this) {
        case STRING -> value.toString();
        case INTEGER -> value instanceof Number n ? Long.toString(toLongExact(n)) : value.toString().trim();
        case DECIMAL -> formatDecimal(value, scale);
        case DATE -> value instanceof TemporalAccessor t ? pattern.format(t) : formatDateText(value.toString(), pattern);
        };
    }

    /**
     * ISO dates (as printed by {@link LocalDate#toString()}) are rewritten with the pattern;
     * anything else is taken as already formatted.
     */
    private static String formatDateText(String text, DateTimeFormatter pattern) {
        try {
            return pattern.format(LocalDate.parse(text.trim()));
        } catch (DateTimeParseException e) {
            return text;
        }
    }

    /**
     * @throws ArithmeticException if {@code n} has a fractional part or does not fit a long
     */
    private static long toLongExact(Number n) {
        if (n instanceof BigDecimal b) {
            return b.longValueExact();
        }
        if (n instanceof BigInteger b) {
            return b.longValueExact();
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue()).longValueExact();
        }
        return n.longValue();
    }

    private static BigDecimal parseDecimal(String text, int scale) {
        if (text.indexOf('.') >= 0) {
            return new BigDecimal(text);
        }
        return new BigDecimal(text).movePointLeft(scale);
    }

    private static String formatDecimal(Object value, int scale) {
        if (!(value instanceof Number) && value.toString().isBlank()) {
            return "";
        }
        BigDecimal decimal = value instanceof BigDecimal b ? b : new BigDecimal(value.toString().trim());
        if (scale == 0) {
            return decimal.toPlainString();
        }
        // implied decimal point: 123.45 at scale 2 is written as 12345
        return decimal.setScale(scale).unscaledValue().toString();
    }
}

package com.foo.extract.match;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Plain value read from (or written to) a cell.
 *
 * <p>{@code value} is {@code null} for {@link ValueType#NULL}, a {@link String} for TEXT, a
 * {@link Double} for NUMBER, a {@link Boolean} for BOOLEAN and the matching {@code java.time}
 * type for DATE, TIME and DATE_TIME.
 */
public record CellValue(ValueType type, Object value) {

    public static final CellValue NULL = new CellValue(ValueType.NULL, null);
    public static final CellValue EMPTY_TEXT = new CellValue(ValueType.TEXT, "");

    public CellValue {
        Objects.requireNonNull(type, "type");
        if (type == ValueType.NULL) {
            value = null;
        } else {
            Objects.requireNonNull(value, "value of a " + type + " cell");
        }
    }

    public static CellValue text(String text) {
        return text == null ? NULL : new CellValue(ValueType.TEXT, text);
    }

    public static CellValue number(double number) {
        return new CellValue(ValueType.NUMBER, number);
    }

    public static CellValue bool(boolean bool) {
        return new CellValue(ValueType.BOOLEAN, bool);
    }

    public static CellValue date(LocalDate date) {
        return date == null ? NULL : new CellValue(ValueType.DATE, date);
    }

    public static CellValue time(LocalTime time) {
        return time == null ? NULL : new CellValue(ValueType.TIME, time);
    }

    public static CellValue dateTime(LocalDateTime dateTime) {
        return dateTime == null ? NULL : new CellValue(ValueType.DATE_TIME, dateTime);
    }

    /** Wraps a plain Java object, as produced by test fixtures or the configuration parser. */
    public static CellValue of(Object object) {
        if (object == null) {
            return NULL;
        }
        if (object instanceof CellValue cellValue) {
            return cellValue;
        }
        if (object instanceof String s) {
            return text(s);
        }
        if (object instanceof Boolean b) {
            return bool(b);
        }
        if (object instanceof Number n) {
            return number(n.doubleValue());
        }
        if (object instanceof LocalDateTime dt) {
            return dateTime(dt);
        }
        if (object instanceof LocalDate d) {
            return date(d);
        }
        if (object instanceof LocalTime t) {
            return time(t);
        }
        throw new IllegalArgumentException("Unsupported cell value type: " + object.getClass().getName());
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    public boolean isText() {
        return type == ValueType.TEXT;
    }

    /** True for null and zero-length text, the two values that end a contiguous region. */
    public boolean isBlank() {
        return isNull() || (isText() && ((String) value).isEmpty());
    }

    public String asText() {
        return isText() ? (String) value : null;
    }

    public Double asNumber() {
        return type == ValueType.NUMBER ? (Double) value : null;
    }

    /**
     * Renders the value the way a user would type it: integral numbers without a decimal
     * part, everything else through {@code toString()}, null as an empty string.
     */
    public String toDisplayString() {
        return switch (type) {
            case NULL -> "";
            case NUMBER -> {
                double d = (Double) value;
                if (d == Math.rint(d) && !Double.isInfinite(d)) {
                    yield BigDecimal.valueOf(d).toBigInteger().toString();
                }
                yield Double.toString(d);
            }
            default -> value.toString();
        };
    }
}

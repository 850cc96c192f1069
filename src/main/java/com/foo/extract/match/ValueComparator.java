package com.foo.extract.match;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A single predicate ({@link Operator} plus operand) evaluated against one cell value.
 *
 * <p>Immutable. {@link #match(CellValue)} never throws: comparing values of incompatible types
 * simply does not match, which keeps sheet scans total.
 */
@Getter
@EqualsAndHashCode(exclude = "pattern")
public final class ValueComparator {

    private final Operator operator;
    private final CellValue operand;
    private final Pattern pattern;

    public ValueComparator(Operator operator, CellValue operand) {
        if (operator == null) {
            throw new ExtractConfigurationException("Comparator operator is required");
        }
        this.operator = operator;
        this.operand = operand == null ? CellValue.NULL : operand;
        this.pattern = operator == Operator.REGEX ? compile(this.operand) : null;
    }

    public static ValueComparator of(Operator operator, Object operand) {
        return new ValueComparator(operator, CellValue.of(operand));
    }

    public static ValueComparator of(Operator operator) {
        return new ValueComparator(operator, CellValue.NULL);
    }

    public static ValueComparator equalTo(Object operand) {
        return of(Operator.EQUAL, operand);
    }

    public static ValueComparator regex(String pattern) {
        return of(Operator.REGEX, pattern);
    }

    /**
     * Evaluates the predicate.
     *
     * @return the candidate itself when the predicate holds; an empty text for {@code EMPTY};
     *     the first capture group (or the whole text) for {@code REGEX}; empty otherwise
     */
    public Optional<CellValue> match(CellValue candidate) {
        CellValue value = candidate == null ? CellValue.NULL : candidate;

        return switch (operator) {
            case EMPTY -> value.isBlank() ? Optional.of(CellValue.EMPTY_TEXT) : Optional.empty();
            case NOT_EMPTY -> value.isBlank() ? Optional.empty() : Optional.of(value);
            case REGEX -> matchRegex(value);
            default -> matchComparison(value);
        };
    }

    public Optional<CellValue> match(Object candidate) {
        return match(CellValue.of(candidate));
    }

    public boolean matches(CellValue candidate) {
        return match(candidate).isPresent();
    }

    private Optional<CellValue> matchRegex(CellValue value) {
        if (!value.isText()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(value.asText());
        if (!matcher.find()) {
            return Optional.empty();
        }
        if (matcher.groupCount() >= 1) {
            String group = matcher.group(1);
            return Optional.of(CellValue.text(group == null ? "" : group));
        }
        return Optional.of(value);
    }

    private Optional<CellValue> matchComparison(CellValue value) {
        Integer cmp = compare(value, operand);
        if (cmp == null) {
            return Optional.empty();
        }
        if (operator.isOrdering() && value.isNull()) {
            return Optional.empty();
        }

        boolean holds = switch (operator) {
            case EQUAL -> cmp == 0;
            case NOT_EQUAL -> cmp != 0;
            case GREATER -> cmp > 0;
            case GREATER_EQUAL -> cmp >= 0;
            case LESS -> cmp < 0;
            case LESS_EQUAL -> cmp <= 0;
            default -> false;
        };
        return holds ? Optional.of(value) : Optional.empty();
    }

    /** Compares two values of compatible types, or returns {@code null} when they are not. */
    static Integer compare(CellValue left, CellValue right) {
        ValueType lt = left.type();
        ValueType rt = right.type();

        if (lt == ValueType.DATE && rt == ValueType.DATE_TIME) {
            return ((LocalDate) left.value()).atStartOfDay().compareTo((LocalDateTime) right.value());
        }
        if (lt == ValueType.DATE_TIME && rt == ValueType.DATE) {
            return ((LocalDateTime) left.value()).compareTo(((LocalDate) right.value()).atStartOfDay());
        }
        if (lt != rt) {
            return null;
        }

        return switch (lt) {
            case NULL -> 0;
            case TEXT -> ((String) left.value()).compareTo((String) right.value());
            case NUMBER -> Double.compare((Double) left.value(), (Double) right.value());
            case BOOLEAN -> Boolean.compare((Boolean) left.value(), (Boolean) right.value());
            case DATE -> ((LocalDate) left.value()).compareTo((LocalDate) right.value());
            case TIME -> ((LocalTime) left.value()).compareTo((LocalTime) right.value());
            case DATE_TIME -> ((LocalDateTime) left.value()).compareTo((LocalDateTime) right.value());
        };
    }

    private static Pattern compile(CellValue operand) {
        if (!operand.isText()) {
            throw new InvalidComparatorException(Operator.REGEX, operand, "regular expression must be text");
        }
        try {
            return Pattern.compile(operand.asText(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new InvalidComparatorException(Operator.REGEX, operand, e.getDescription(), e);
        }
    }

    @Override
    public String toString() {
        if (operator == Operator.EMPTY || operator == Operator.NOT_EMPTY) {
            return operator.name();
        }
        return operator.name() + " " + operand.toDisplayString();
    }
}

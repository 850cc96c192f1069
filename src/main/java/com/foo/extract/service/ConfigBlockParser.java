package com.foo.extract.service;

import com.foo.extract.match.CellValue;
import com.foo.extract.match.ExtractConfigurationException;
import com.foo.extract.match.Operator;
import com.foo.extract.match.ValueComparator;
import com.foo.extract.range.Range;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a three-column {@code key | operator | value} block into a {@link ConfigBlock}.
 *
 * <p>Rows whose key or operator is not non-empty text are skipped. Text values are
 * interpolated with the run's variables before the comparator is built.
 */
@Slf4j
public final class ConfigBlockParser {

    private static final Map<String, Operator> OPERATORS = Map.ofEntries(
            Map.entry("is", Operator.EQUAL),
            Map.entry("=", Operator.EQUAL),
            Map.entry("==", Operator.EQUAL),
            Map.entry("is not", Operator.NOT_EQUAL),
            Map.entry("!=", Operator.NOT_EQUAL),
            Map.entry("matches", Operator.REGEX),
            Map.entry("regex", Operator.REGEX),
            Map.entry("<", Operator.LESS),
            Map.entry("<=", Operator.LESS_EQUAL),
            Map.entry(">", Operator.GREATER),
            Map.entry(">=", Operator.GREATER_EQUAL),
            Map.entry("is empty", Operator.EMPTY),
            Map.entry("empty", Operator.EMPTY),
            Map.entry("is not empty", Operator.NOT_EMPTY),
            Map.entry("not empty", Operator.NOT_EMPTY));

    private ConfigBlockParser() {}

    /**
     * @throws ExtractConfigurationException for an unknown operator or an invalid regular expression
     */
    public static ConfigBlock parse(Range block, Map<String, CellValue> variables) {
        Map<String, ValueComparator> entries = new LinkedHashMap<>();
        if (block.isEmpty() || block.getColumns() < 3) {
            return new ConfigBlock(entries);
        }

        List<List<CellValue>> rows = block.getValues();
        for (int i = 0; i < rows.size(); i++) {
            List<CellValue> row = rows.get(i);
            CellValue key = row.get(0);
            CellValue operator = row.get(1);
            if (!key.isText() || key.isBlank() || !operator.isText() || operator.isBlank()) {
                log.debug("Skipping row {} of block at {}", block.getFirstRow() + i, block.getReference(false, true, false));
                continue;
            }

            String name = key.asText().trim().toLowerCase(Locale.ROOT);
            CellValue value = interpolate(row.get(2), variables);
            entries.put(name, parseComparator(name, operator.asText(), value));
        }
        return new ConfigBlock(entries);
    }

    public static Optional<Operator> parseOperator(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return Optional.ofNullable(OPERATORS.get(normalized));
    }

    static ValueComparator parseComparator(String key, String operatorText, CellValue value) {
        Operator operator = parseOperator(operatorText).orElseThrow(() ->
                new ExtractConfigurationException(key, "Operator `%s` not recognised".formatted(operatorText)));
        return new ValueComparator(operator, value);
    }

    private static CellValue interpolate(CellValue value, Map<String, CellValue> variables) {
        if (!value.isText() || value.isBlank()) {
            return value;
        }
        return CellValue.text(VariableInterpolator.interpolate(value.asText(), variables));
    }
}

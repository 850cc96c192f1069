package com.foo.extract.service;

import com.foo.extract.match.CellMatch;
import com.foo.extract.match.CellValue;
import com.foo.extract.match.ExtractConfigurationException;
import com.foo.extract.match.Match;
import com.foo.extract.match.Operator;
import com.foo.extract.match.RangeMatch;
import com.foo.extract.match.ReferenceResolver;
import com.foo.extract.match.ValueComparator;
import com.foo.extract.range.Range;
import com.foo.extract.target.Target;
import com.foo.extract.util.ExcelColumnUtil;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * Builds the source {@link Match} and the optional {@link Target} described by a {@code name}
 * block.
 *
 * <p>Unprefixed keys describe the source. Keys starting with {@code start}, {@code end},
 * {@code source row}, {@code source column}, {@code target row}, {@code target column} or
 * {@code target} describe the corresponding nested match; the bare prefix is shorthand for its
 * {@code value} ({@code reference} for {@code target}).
 */
@Slf4j
public final class BlockMatchFactory {

    public static final String NAME = "name";
    public static final String DIRECTORY = "directory";
    public static final String FILE = "file";

    static final String SHEET = "sheet";
    static final String REFERENCE = "reference";
    static final String VALUE = "value";
    static final String MIN_ROW = "min row";
    static final String MAX_ROW = "max row";
    static final String MIN_COL = "min column";
    static final String MAX_COL = "max column";
    static final String ROW_OFFSET = "row offset";
    static final String COL_OFFSET = "column offset";
    static final String ROWS = "rows";
    static final String COLS = "columns";
    static final String EXPAND = "expand";
    static final String ALIGN = "align";

    static final String SOURCE = "";
    static final String START = "start";
    static final String END = "end";
    static final String SOURCE_ROW = "source row";
    static final String SOURCE_COL = "source column";
    static final String TARGET_ROW = "target row";
    static final String TARGET_COL = "target column";
    static final String TARGET = "target";

    // Longer prefixes first so "target row" is not read as "target" + "row".
    private static final List<String> PREFIXES =
            List.of(SOURCE_ROW, SOURCE_COL, TARGET_ROW, TARGET_COL, START, END, TARGET);

    private static final Set<String> BLOCK_KEYS = Set.of(NAME, DIRECTORY, FILE, EXPAND, ALIGN);

    private static final Set<String> CELL_KEYS = Set.of(SHEET, REFERENCE, VALUE, MIN_ROW, MAX_ROW,
            MIN_COL, MAX_COL, ROW_OFFSET, COL_OFFSET, ROWS, COLS);

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "1");

    private BlockMatchFactory() {}

    public static String blockName(ConfigBlock block) {
        return block.get(NAME)
                .map(c -> c.getOperand().toDisplayString().trim())
                .filter(s -> !s.isEmpty())
                .orElseThrow(() -> new ExtractConfigurationException("Block has an empty name"));
    }

    /**
     * Builds the source match. Start/end cells, rows/columns or source row/column locators make
     * it a range; a bare reference is resolved against {@code sourceWorkbook} and becomes a range
     * match only if it names more than one cell.
     */
    public static Match buildSource(ConfigBlock block, Workbook sourceWorkbook) {
        String name = blockName(block);
        Map<String, Map<String, ValueComparator>> groups = group(block);
        Map<String, ValueComparator> fields = groups.getOrDefault(SOURCE, Map.of());
        ValueComparator sheet = fields.get(SHEET);

        boolean rangeShape = groups.containsKey(START) || groups.containsKey(END)
                || groups.containsKey(SOURCE_ROW) || groups.containsKey(SOURCE_COL)
                || fields.containsKey(ROWS) || fields.containsKey(COLS);
        if (rangeShape) {
            return buildRange(name, fields, groups.get(START), groups.get(END));
        }

        if (fields.containsKey(REFERENCE) && !fields.containsKey(ROW_OFFSET) && !fields.containsKey(COL_OFFSET)) {
            String reference = text(name, REFERENCE, fields.get(REFERENCE));
            Optional<Range> resolved = ReferenceResolver.resolve(sourceWorkbook, reference, sheet);
            if (resolved.isPresent() && !resolved.get().isCell()) {
                return RangeMatch.builder().name(name).sheet(sheet).reference(reference).build();
            }
        }
        return buildCell(name, fields);
    }

    /**
     * Builds the target for a block, or empty when the block has no {@code target} keys and
     * only matches.
     */
    public static Optional<Target> buildTarget(ConfigBlock block, Match source) {
        String name = blockName(block);
        Map<String, Map<String, ValueComparator>> groups = group(block);
        Map<String, ValueComparator> targetFields = groups.get(TARGET);

        CellMatch sourceRow = locator(name, SOURCE_ROW, groups);
        CellMatch sourceCol = locator(name, SOURCE_COL, groups);
        CellMatch targetRow = locator(name, TARGET_ROW, groups);
        CellMatch targetCol = locator(name, TARGET_COL, groups);

        if (targetFields == null) {
            if (targetRow != null || targetCol != null) {
                throw new ExtractConfigurationException(name, "Target row and column need a target");
            }
            return Optional.empty();
        }

        boolean sourceStaysRange = source.kind() == Match.Kind.RANGE && (sourceRow == null || sourceCol == null);
        boolean targetIsRange = targetRow != null || targetCol != null || sourceStaysRange
                || targetFields.containsKey(ROWS) || targetFields.containsKey(COLS);

        Match target = targetIsRange
                ? buildRange(name + " target", targetFields, null, null)
                : buildCell(name + " target", targetFields);

        return Optional.of(Target.builder()
                .source(source)
                .target(target)
                .sourceRow(sourceRow)
                .sourceCol(sourceCol)
                .targetRow(targetRow)
                .targetCol(targetCol)
                .expand(flag(block, EXPAND))
                .align(flag(block, ALIGN))
                .build());
    }

    /** Groups keys by prefix; unprefixed source keys go under {@link #SOURCE}. */
    static Map<String, Map<String, ValueComparator>> group(ConfigBlock block) {
        Map<String, Map<String, ValueComparator>> groups = new LinkedHashMap<>();
        block.entries().forEach((key, comparator) -> {
            if (BLOCK_KEYS.contains(key)) {
                return;
            }
            String prefix = SOURCE;
            String field = key;
            for (String candidate : PREFIXES) {
                if (key.equals(candidate)) {
                    prefix = candidate;
                    field = candidate.equals(TARGET) ? REFERENCE : VALUE;
                    break;
                }
                // "target row offset" is the target's row offset, not a "target row" field.
                if (key.startsWith(candidate + " ") && CELL_KEYS.contains(key.substring(candidate.length()).trim())) {
                    prefix = candidate;
                    field = key.substring(candidate.length()).trim();
                    break;
                }
            }
            if (!CELL_KEYS.contains(field)) {
                log.debug("Ignoring unknown key `{}`", key);
                return;
            }
            groups.computeIfAbsent(prefix, p -> new LinkedHashMap<>()).put(field, comparator);
        });
        return groups;
    }

    private static CellMatch locator(String name, String prefix, Map<String, Map<String, ValueComparator>> groups) {
        Map<String, ValueComparator> fields = groups.get(prefix);
        return fields == null ? null : buildCell(name + " " + prefix, fields);
    }

    static CellMatch buildCell(String name, Map<String, ValueComparator> fields) {
        CellMatch.CellMatchBuilder builder = CellMatch.builder()
                .name(name)
                .sheet(fields.get(SHEET))
                .value(fields.get(VALUE))
                .minRow(integer(name, MIN_ROW, fields.get(MIN_ROW)))
                .maxRow(integer(name, MAX_ROW, fields.get(MAX_ROW)))
                .minCol(column(name, MIN_COL, fields.get(MIN_COL)))
                .maxCol(column(name, MAX_COL, fields.get(MAX_COL)));
        if (fields.containsKey(REFERENCE)) {
            builder.reference(text(name, REFERENCE, fields.get(REFERENCE)));
        }
        Integer rowOffset = integer(name, ROW_OFFSET, fields.get(ROW_OFFSET));
        Integer colOffset = integer(name, COL_OFFSET, fields.get(COL_OFFSET));
        return builder
                .rowOffset(rowOffset == null ? 0 : rowOffset)
                .colOffset(colOffset == null ? 0 : colOffset)
                .build();
    }

    private static RangeMatch buildRange(String name, Map<String, ValueComparator> fields,
                                         Map<String, ValueComparator> startFields,
                                         Map<String, ValueComparator> endFields) {
        RangeMatch.RangeMatchBuilder builder = RangeMatch.builder()
                .name(name)
                .sheet(fields.get(SHEET))
                .rows(integer(name, ROWS, fields.get(ROWS)))
                .cols(integer(name, COLS, fields.get(COLS)));

        if (fields.containsKey(REFERENCE)) {
            builder.reference(text(name, REFERENCE, fields.get(REFERENCE)));
        }
        if (startFields != null) {
            builder.startCell(buildCell(name + " start", startFields));
        } else if (!fields.containsKey(REFERENCE)) {
            // The unprefixed value search anchors the range.
            builder.startCell(buildCell(name + " start", fields));
        }
        if (endFields != null) {
            builder.endCell(buildCell(name + " end", endFields));
        }
        return builder.build();
    }

    private static String text(String name, String key, ValueComparator comparator) {
        CellValue operand = comparator.getOperand();
        if (comparator.getOperator() != Operator.EQUAL || operand.isBlank()) {
            throw new ExtractConfigurationException(name, "`%s` must use operator `is` and a value".formatted(key));
        }
        return operand.toDisplayString().trim();
    }

    private static Integer integer(String name, String key, ValueComparator comparator) {
        if (comparator == null) {
            return null;
        }
        CellValue operand = comparator.getOperand();
        Double number = operand.asNumber();
        if (number != null && number == Math.rint(number)) {
            return number.intValue();
        }
        if (operand.isText()) {
            try {
                return Integer.parseInt(operand.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("`{}` is not a whole number: {}", key, e.getMessage());
            }
        }
        throw new ExtractConfigurationException(name,
                "`%s` must be a whole number, not `%s`".formatted(key, operand.toDisplayString()));
    }

    private static Integer column(String name, String key, ValueComparator comparator) {
        if (comparator == null) {
            return null;
        }
        CellValue operand = comparator.getOperand();
        if (operand.isText()) {
            try {
                int column = ExcelColumnUtil.parseColumnReference(operand.asText());
                if (column > 0) {
                    return column;
                }
            } catch (IllegalArgumentException e) {
                throw new ExtractConfigurationException(name,
                        "`%s` must be a column letter or number, not `%s`".formatted(key, operand.asText()), e);
            }
        }
        return integer(name, key, comparator);
    }

    private static boolean flag(ConfigBlock block, String key) {
        return block.get(key).map(ValueComparator::getOperand).map(operand -> {
            if (operand.value() instanceof Boolean b) {
                return b;
            }
            Double number = operand.asNumber();
            if (number != null) {
                return number != 0;
            }
            return TRUE_WORDS.contains(operand.toDisplayString().trim().toLowerCase(Locale.ROOT));
        }).orElse(false);
    }
}

package com.foo.extract.match;

import com.foo.extract.range.Range;
import java.util.Optional;
import lombok.Builder;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * Locates a single cell, either by reference (defined name, table or coordinate) or by searching
 * a sheet for the first cell whose value satisfies a comparator.
 *
 * <p>Exactly one of {@code reference} and {@code value} must be set. A value search needs a sheet
 * filter; when none is set the search simply finds nothing. The row/column offsets are applied
 * after the search, so the final cell may lie outside the min/max search bounds.
 *
 * <p>Bounds are 1-based and inclusive; null means open-ended.
 */
@Builder(toBuilder = true)
public record CellMatch(
        String name,
        ValueComparator sheet,
        String reference,
        ValueComparator value,
        int rowOffset,
        int colOffset,
        Integer minRow,
        Integer minCol,
        Integer maxRow,
        Integer maxCol) implements Match {

    public CellMatch {
        if (reference != null && reference.isBlank()) {
            reference = null;
        }
        if ((reference != null) == (value != null)) {
            throw new ExtractConfigurationException(name, "Exactly one of reference and value must be set");
        }
        checkBounds(name, "row", minRow, maxRow);
        checkBounds(name, "column", minCol, maxCol);
    }

    public static CellMatch byReference(String name, String reference) {
        return builder().name(name).reference(reference).build();
    }

    public static CellMatch byValue(String name, ValueComparator sheet, ValueComparator value) {
        return builder().name(name).sheet(sheet).value(value).build();
    }

    @Override
    public Kind kind() {
        return Kind.CELL;
    }

    @Override
    public CellMatch withSheet(ValueComparator sheetFilter) {
        if (sheet != null || sheetFilter == null) {
            return this;
        }
        return toBuilder().sheet(sheetFilter).build();
    }

    @Override
    public Optional<MatchResult> match(Workbook workbook) {
        Optional<MatchResult> found;
        if (reference != null) {
            found = ReferenceResolver.resolve(workbook, reference, sheet)
                    .filter(Range::isCell)
                    .map(MatchResult::of);
        } else {
            found = SheetSearch.selectSheet(workbook, sheet)
                    .flatMap(s -> SheetSearch.findValue(s, value, minRow, maxRow, minCol, maxCol));
        }
        return found.flatMap(this::applyOffset);
    }

    /**
     * Resolves this match inside {@code box}: value searches scan only the box (narrowed further
     * by any bounds of this match) on the box's sheet, and references resolve against the box's
     * sheet. A result that ends up outside the box after the offset is discarded.
     */
    public Optional<MatchResult> matchWithin(Range box) {
        if (box.isEmpty()) {
            return Optional.empty();
        }
        Sheet boxSheet = box.getSheet();

        Optional<MatchResult> found;
        if (reference != null) {
            found = ReferenceResolver.resolve(boxSheet.getWorkbook(), reference, boxSheet, false)
                    .filter(Range::isCell)
                    .map(MatchResult::of);
        } else {
            int r1 = Math.max(box.getFirstRow(), minRow != null ? minRow : 1);
            int r2 = Math.min(box.getLastRow(), maxRow != null ? maxRow : Integer.MAX_VALUE);
            int c1 = Math.max(box.getFirstColumn(), minCol != null ? minCol : 1);
            int c2 = Math.min(box.getLastColumn(), maxCol != null ? maxCol : Integer.MAX_VALUE);
            found = SheetSearch.findValue(boxSheet, value, r1, r2, c1, c2);
        }

        return found.flatMap(this::applyOffset).filter(result -> box.contains(result.range()));
    }

    private Optional<MatchResult> applyOffset(MatchResult result) {
        Range shifted = result.range().offset(rowOffset, colOffset);
        return shifted.isEmpty() ? Optional.empty() : Optional.of(result.withRange(shifted));
    }

    private static void checkBounds(String name, String axis, Integer min, Integer max) {
        if ((min != null && min < 1) || (max != null && max < 1)) {
            throw new ExtractConfigurationException(name, "Minimum and maximum %s must be 1 or more".formatted(axis));
        }
        if (min != null && max != null && min > max) {
            throw new ExtractConfigurationException(name,
                    "Minimum %s %d is after maximum %s %d".formatted(axis, min, axis, max));
        }
    }
}

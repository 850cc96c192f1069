package com.foo.extract.match;

import com.foo.extract.range.Range;
import com.foo.extract.util.CellValueUtils;
import java.util.Optional;
import lombok.Builder;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * Locates a rectangular block of cells.
 *
 * <p>Either {@code reference} names the block (defined name, table or coordinate), or
 * {@code startCell} anchors it and the size comes from one of:
 * <ul>
 *   <li>{@code endCell}: the opposite corner, located independently;</li>
 *   <li>{@code rows} and {@code cols}: a fixed size;</li>
 *   <li>neither: the contiguous region grown right along the anchor's row and down along its
 *       column until the first blank cell.</li>
 * </ul>
 *
 * <p>A sheet filter set here is copied into start and end cell matches that have none.
 */
@Builder(toBuilder = true)
public record RangeMatch(
        String name,
        ValueComparator sheet,
        String reference,
        CellMatch startCell,
        CellMatch endCell,
        Integer rows,
        Integer cols) implements Match {

    /** How the extent of a start-anchored range is determined. */
    public enum SizeMode {
        REFERENCE,
        END_CELL,
        FIXED,
        CONTIGUOUS
    }

    public RangeMatch {
        boolean hasReference = reference != null && !reference.isBlank();
        if (hasReference == (startCell != null)) {
            throw new ExtractConfigurationException(name, "Exactly one of reference and start cell must be set");
        }
        if (hasReference && (endCell != null || rows != null || cols != null)) {
            throw new ExtractConfigurationException(name, "End cell, rows and columns require a start cell");
        }
        if ((rows == null) != (cols == null)) {
            throw new ExtractConfigurationException(name, "Rows and columns must be set together");
        }
        if (rows != null && endCell != null) {
            throw new ExtractConfigurationException(name, "Set either an end cell or rows and columns, not both");
        }
        if (rows != null && (rows < 1 || cols < 1)) {
            throw new ExtractConfigurationException(name, "Rows and columns must be 1 or more");
        }

        if (startCell != null) {
            startCell = startCell.withSheet(sheet);
        }
        if (endCell != null) {
            endCell = endCell.withSheet(sheet);
        }
    }

    public static RangeMatch byReference(String name, String reference) {
        return builder().name(name).reference(reference).build();
    }

    @Override
    public Kind kind() {
        return Kind.RANGE;
    }

    public SizeMode sizeMode() {
        if (reference != null && !reference.isBlank()) {
            return SizeMode.REFERENCE;
        }
        if (endCell != null) {
            return SizeMode.END_CELL;
        }
        return rows != null ? SizeMode.FIXED : SizeMode.CONTIGUOUS;
    }

    public boolean isContiguous() {
        return sizeMode() == SizeMode.CONTIGUOUS;
    }

    @Override
    public RangeMatch withSheet(ValueComparator sheetFilter) {
        if (sheet != null || sheetFilter == null) {
            return this;
        }
        return toBuilder().sheet(sheetFilter).build();
    }

    @Override
    public Optional<MatchResult> match(Workbook workbook) {
        if (sizeMode() == SizeMode.REFERENCE) {
            return ReferenceResolver.resolve(workbook, reference, sheet).map(MatchResult::of);
        }

        Optional<MatchResult> start = startCell.match(workbook);
        if (start.isEmpty()) {
            return Optional.empty();
        }
        Range anchor = start.get().range();
        Sheet anchorSheet = anchor.getSheet();

        Range block = switch (sizeMode()) {
            case END_CELL -> endCell.match(workbook)
                    .map(MatchResult::range)
                    .filter(end -> end.getSheet() == anchorSheet)
                    .map(end -> Range.of(anchorSheet, anchor.getFirstRow(), anchor.getFirstColumn(),
                            end.getFirstRow(), end.getFirstColumn()))
                    .orElse(Range.empty());
            case FIXED -> Range.of(anchorSheet, anchor.getFirstRow(), anchor.getFirstColumn(),
                    anchor.getFirstRow() + rows - 1, anchor.getFirstColumn() + cols - 1);
            default -> contiguous(anchor);
        };

        if (block.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(start.get().withRange(block));
    }

    /**
     * Grows from the anchor to the right while the next cell in the anchor's row is not blank,
     * and down while the next cell in the anchor's column is not blank. The anchor itself may be
     * blank.
     */
    static Range contiguous(Range anchor) {
        Sheet sheet = anchor.getSheet();
        int row = anchor.getFirstRow();
        int col = anchor.getFirstColumn();
        SpreadsheetVersion version = SpreadsheetVersion.EXCEL2007;

        int lastCol = col;
        while (lastCol < version.getMaxColumns() && !CellValueUtils.read(sheet, row, lastCol + 1).isBlank()) {
            lastCol++;
        }
        int lastRow = row;
        while (lastRow < version.getMaxRows() && !CellValueUtils.read(sheet, lastRow + 1, col).isBlank()) {
            lastRow++;
        }
        return Range.of(sheet, row, col, lastRow, lastCol);
    }
}

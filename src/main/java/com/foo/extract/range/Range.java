package com.foo.extract.range;

import com.foo.extract.match.CellValue;
import com.foo.extract.util.CellValueUtils;
import com.foo.extract.util.ExcelColumnUtil;
import com.foo.extract.util.ReferenceParser;
import com.foo.extract.util.SheetShiftUtils;
import com.foo.extract.util.WorkbookCopyUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;

/**
 * A rectangular block of cells on one sheet, optionally known through an {@link Alias}.
 *
 * <p>Ranges are values. Rows and columns are 1-based in the public API; cell accessors taking
 * an {@code (i, j)} pair are 0-based offsets from the top-left cell. Reading never creates rows
 * or cells.
 *
 * <p><b>Invalidation:</b> {@link #resize(int, int)} inserts or deletes whole sheet rows/columns.
 * Every other Range on the same sheet that lies below or to the right of the table, including
 * this one, may point at moved data afterwards. Use only the returned Range.
 */
@Slf4j
public final class Range {

    private static final Range EMPTY = new Range(null, null, null);

    private final Sheet sheet;
    private final CellRangeAddress address;
    private final Alias alias;

    private Range(Sheet sheet, CellRangeAddress address, Alias alias) {
        this.sheet = sheet;
        this.address = address;
        this.alias = alias;
    }

    public static Range empty() {
        return EMPTY;
    }

    /**
     * A range between two 1-based corners, in either order. Corners outside the sheet grid give
     * an empty range.
     */
    public static Range of(Sheet sheet, int firstRow, int firstColumn, int lastRow, int lastColumn) {
        Objects.requireNonNull(sheet, "sheet");
        int r1 = Math.min(firstRow, lastRow);
        int r2 = Math.max(firstRow, lastRow);
        int c1 = Math.min(firstColumn, lastColumn);
        int c2 = Math.max(firstColumn, lastColumn);

        SpreadsheetVersion version = SpreadsheetVersion.EXCEL2007;
        if (r1 < 1 || c1 < 1 || r2 > version.getMaxRows() || c2 > version.getMaxColumns()) {
            return EMPTY;
        }
        return new Range(sheet, new CellRangeAddress(r1 - 1, r2 - 1, c1 - 1, c2 - 1), null);
    }

    /** Wraps a 0-based POI address. */
    public static Range of(Sheet sheet, CellRangeAddress address) {
        return of(sheet, address.getFirstRow() + 1, address.getFirstColumn() + 1,
                address.getLastRow() + 1, address.getLastColumn() + 1);
    }

    public static Range cell(Sheet sheet, int row, int column) {
        return of(sheet, row, column, row, column);
    }

    public Range withAlias(Alias newAlias) {
        if (isEmpty()) {
            return this;
        }
        return new Range(sheet, address, newAlias);
    }

    public boolean isEmpty() {
        return sheet == null;
    }

    public boolean isCell() {
        return !isEmpty() && getRows() == 1 && getColumns() == 1;
    }

    public boolean isRange() {
        return !isEmpty() && !isCell();
    }

    public int getRows() {
        return isEmpty() ? 0 : address.getLastRow() - address.getFirstRow() + 1;
    }

    public int getColumns() {
        return isEmpty() ? 0 : address.getLastColumn() - address.getFirstColumn() + 1;
    }

    public int getFirstRow() {
        return isEmpty() ? 0 : address.getFirstRow() + 1;
    }

    public int getFirstColumn() {
        return isEmpty() ? 0 : address.getFirstColumn() + 1;
    }

    public int getLastRow() {
        return isEmpty() ? 0 : address.getLastRow() + 1;
    }

    public int getLastColumn() {
        return isEmpty() ? 0 : address.getLastColumn() + 1;
    }

    public Sheet getSheet() {
        return sheet;
    }

    public Workbook getWorkbook() {
        return isEmpty() ? null : sheet.getWorkbook();
    }

    public Alias getAlias() {
        return alias;
    }

    /** A copy of the 0-based POI address, or null when empty. */
    public CellRangeAddress getAddress() {
        return isEmpty() ? null : address.copy();
    }

    /** The single cell of a one-cell range, or null if it is not one or the cell does not exist. */
    public Cell getCell() {
        return isCell() ? getCell(0, 0) : null;
    }

    public Cell getFirstCell() {
        return isEmpty() ? null : getCell(0, 0);
    }

    public Cell getLastCell() {
        return isEmpty() ? null : getCell(getRows() - 1, getColumns() - 1);
    }

    /** The existing POI cell at a 0-based offset, or null when that cell was never created. */
    public Cell getCell(int i, int j) {
        checkOffset(i, j);
        Row row = sheet.getRow(address.getFirstRow() + i);
        return row == null ? null : row.getCell(address.getFirstColumn() + j);
    }

    /** The POI cell at a 0-based offset, creating the row and cell if needed. */
    public Cell getOrCreateCell(int i, int j) {
        checkOffset(i, j);
        return WorkbookCopyUtils.getOrCreateCell(sheet, address.getFirstRow() + i, address.getFirstColumn() + j);
    }

    public CellValue getValue(int i, int j) {
        checkOffset(i, j);
        return CellValueUtils.read(getCell(i, j));
    }

    /** Value of the top-left cell ({@link CellValue#NULL} when empty). */
    public CellValue getValue() {
        return isEmpty() ? CellValue.NULL : getValue(0, 0);
    }

    /** Snapshot of the block as rows of values. */
    public List<List<CellValue>> getValues() {
        if (isEmpty()) {
            return Collections.emptyList();
        }
        List<List<CellValue>> rows = new ArrayList<>(getRows());
        for (int i = 0; i < getRows(); i++) {
            List<CellValue> row = new ArrayList<>(getColumns());
            for (int j = 0; j < getColumns(); j++) {
                row.add(getValue(i, j));
            }
            rows.add(Collections.unmodifiableList(row));
        }
        return Collections.unmodifiableList(rows);
    }

    /** The one-cell range at a 0-based offset. */
    public Range cellAt(int i, int j) {
        checkOffset(i, j);
        return cell(sheet, getFirstRow() + i, getFirstColumn() + j);
    }

    /** This range moved by the given number of rows and columns; empty if it leaves the sheet. */
    public Range offset(int rows, int columns) {
        if (isEmpty()) {
            return EMPTY;
        }
        if (rows == 0 && columns == 0) {
            return this;
        }
        return of(sheet, getFirstRow() + rows, getFirstColumn() + columns,
                getLastRow() + rows, getLastColumn() + columns);
    }

    public boolean contains(Range other) {
        return !isEmpty() && !other.isEmpty()
                && sheet == other.sheet
                && other.getFirstRow() >= getFirstRow() && other.getLastRow() <= getLastRow()
                && other.getFirstColumn() >= getFirstColumn() && other.getLastColumn() <= getLastColumn();
    }

    public String getReference() {
        return getReference(true, true, true);
    }

    /**
     * Renders the alias name (when {@code useAlias} and one is present) or an A1 reference such
     * as {@code 'Report 1'!$B$5:$F$9}.
     *
     * @return the reference, or null for an empty range
     */
    public String getReference(boolean absolute, boolean useSheet, boolean useAlias) {
        if (isEmpty()) {
            return null;
        }
        if (useAlias && alias != null) {
            return alias.name();
        }

        String prefix = useSheet ? ReferenceParser.quoteSheetName(sheet.getSheetName()) + "!" : "";
        String start = ExcelColumnUtil.toCoordinate(getFirstRow(), getFirstColumn(), absolute);
        if (isCell()) {
            return prefix + start;
        }
        return prefix + start + ":" + ExcelColumnUtil.toCoordinate(getLastRow(), getLastColumn(), absolute);
    }

    /**
     * Resizes the block to {@code rows x columns} in place on the sheet and returns the new Range.
     * Growing inserts whole blank rows below / columns to the right of the block; shrinking
     * deletes trailing rows/columns. Following content shifts accordingly, together with its merged
     * regions, formula references, defined names and tables. An aliased block has its defined name
     * or table rewritten to the new area.
     *
     * <p>This Range and any other Range on the sheet must not be used afterwards.
     */
    public Range resize(int rows, int columns) {
        if (isEmpty()) {
            throw new IllegalStateException("Cannot resize an empty range");
        }
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("Cannot resize to %d x %d".formatted(rows, columns));
        }

        int rowsDelta = rows - getRows();
        int colsDelta = columns - getColumns();
        if (rowsDelta == 0 && colsDelta == 0) {
            return this;
        }

        int firstRow = address.getFirstRow();
        int firstCol = address.getFirstColumn();

        if (rowsDelta > 0) {
            int at = address.getLastRow() + 1;
            SheetShiftUtils.insertRows(sheet, at, rowsDelta);
            AliasUpdater.shiftTables(sheet, alias, at, rowsDelta, true);
        } else if (rowsDelta < 0) {
            int at = firstRow + rows;
            SheetShiftUtils.deleteRows(sheet, at, -rowsDelta);
            AliasUpdater.shiftTables(sheet, alias, at - rowsDelta, rowsDelta, true);
        }

        if (colsDelta > 0) {
            int at = address.getLastColumn() + 1;
            SheetShiftUtils.insertColumns(sheet, at, colsDelta);
            AliasUpdater.shiftTables(sheet, alias, at, colsDelta, false);
        } else if (colsDelta < 0) {
            int at = firstCol + columns;
            SheetShiftUtils.deleteColumns(sheet, at, -colsDelta);
            AliasUpdater.shiftTables(sheet, alias, at - colsDelta, colsDelta, false);
        }

        Range resized = new Range(sheet,
                new CellRangeAddress(firstRow, firstRow + rows - 1, firstCol, firstCol + columns - 1), alias);
        if (alias != null) {
            AliasUpdater.repoint(resized);
        }

        log.debug("Resized {} from {}x{} to {}x{}", resized.getReference(true, true, false),
                getRows(), getColumns(), rows, columns);
        return resized;
    }

    private void checkOffset(int i, int j) {
        if (isEmpty() || i < 0 || j < 0 || i >= getRows() || j >= getColumns()) {
            throw new IndexOutOfBoundsException(
                    "Offset (%d, %d) outside %dx%d range".formatted(i, j, getRows(), getColumns()));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Range other)) {
            return false;
        }
        return sheet == other.sheet && Objects.equals(address, other.address) && Objects.equals(alias, other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet == null ? 0 : System.identityHashCode(sheet), address, alias);
    }

    @Override
    public String toString() {
        return isEmpty() ? "Range[empty]" : "Range[" + getReference(false, true, false)
                + (alias != null ? " as " + alias.name() : "") + "]";
    }
}

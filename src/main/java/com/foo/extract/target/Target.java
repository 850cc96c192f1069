package com.foo.extract.target;

import com.foo.extract.match.CellMatch;
import com.foo.extract.match.CellValue;
import com.foo.extract.match.ExtractConfigurationException;
import com.foo.extract.match.Match;
import com.foo.extract.match.MatchResult;
import com.foo.extract.range.Range;
import com.foo.extract.util.CellValueWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * Copies matched data from a source workbook into a target workbook.
 *
 * <p>The transfer shape is fixed when the target is built:
 * <ul>
 *   <li>cell to cell, where a range side is narrowed to one cell by its row and column
 *       locators;</li>
 *   <li>whole table: range to range without locators, optionally resizing the target to the
 *       source's dimensions ({@code expand});</li>
 *   <li>vector: range to range with one row or column locator per side. The located row/column
 *       is copied positionally (optionally resizing the target along that axis) or, with
 *       {@code align}, by matching labels in the first row/column of each table.</li>
 * </ul>
 *
 * <p>All matching happens before the target workbook is touched, so a miss leaves it unchanged.
 */
@Slf4j
@Getter
public final class Target {

    private enum TransferMode {
        CELL,
        TABLE,
        VECTOR
    }

    private final Match source;
    private final Match target;
    private final CellMatch sourceRow;
    private final CellMatch sourceCol;
    private final CellMatch targetRow;
    private final CellMatch targetCol;
    private final boolean align;
    private final boolean expand;

    @Getter(AccessLevel.NONE)
    private final TransferMode mode;

    @Builder
    private Target(Match source, Match target, CellMatch sourceRow, CellMatch sourceCol,
                   CellMatch targetRow, CellMatch targetCol, boolean align, boolean expand) {
        if (source == null || target == null) {
            throw new ExtractConfigurationException("A source and a target match are required");
        }
        this.source = source;
        this.target = target;
        this.sourceRow = sourceRow == null ? null : sourceRow.withSheet(source.sheet());
        this.sourceCol = sourceCol == null ? null : sourceCol.withSheet(source.sheet());
        this.targetRow = targetRow == null ? null : targetRow.withSheet(target.sheet());
        this.targetCol = targetCol == null ? null : targetCol.withSheet(target.sheet());
        this.align = align;
        this.expand = expand;
        this.mode = resolveMode();
    }

    private TransferMode resolveMode() {
        String name = source.name();
        boolean sourceIsRange = source.kind() == Match.Kind.RANGE;
        boolean targetIsRange = target.kind() == Match.Kind.RANGE;
        int sourceLocators = count(sourceRow, sourceCol);
        int targetLocators = count(targetRow, targetCol);

        if (!sourceIsRange && sourceLocators > 0) {
            throw new ExtractConfigurationException(name, "Source row and column need a range source");
        }
        if (!targetIsRange && targetLocators > 0) {
            throw new ExtractConfigurationException(name, "Target row and column need a range target");
        }
        if (sourceIsRange && !targetIsRange && sourceLocators != 2) {
            throw new ExtractConfigurationException(name,
                    "A source row and column must be specified if the source is a range and the target is a cell");
        }
        if (!sourceIsRange && targetIsRange && targetLocators != 2) {
            throw new ExtractConfigurationException(name,
                    "A target row and column must be specified if the source is a cell and the target is a range");
        }

        boolean sourceIsCell = !sourceIsRange || sourceLocators == 2;
        boolean targetIsCell = !targetIsRange || targetLocators == 2;
        if (sourceIsCell != targetIsCell) {
            throw new ExtractConfigurationException(name, "Cannot copy a table to a single cell or vice-versa");
        }

        TransferMode resolved;
        if (sourceIsCell) {
            resolved = TransferMode.CELL;
        } else if (sourceLocators == 0 && targetLocators == 0) {
            resolved = TransferMode.TABLE;
        } else if (sourceLocators == 1 && targetLocators == 1) {
            resolved = TransferMode.VECTOR;
        } else {
            throw new ExtractConfigurationException(name,
                    "Set exactly one of row and column on both source and target to copy a row or column");
        }

        if (align && resolved != TransferMode.VECTOR) {
            throw new ExtractConfigurationException(name, "Align only applies when copying a single row or column");
        }
        return resolved;
    }

    public Optional<MatchResult> extract(Workbook sourceWorkbook, Workbook targetWorkbook) {
        return extract(sourceWorkbook, targetWorkbook, new CellValueWriter());
    }

    /**
     * Runs the transfer.
     *
     * @return the source match result, or empty when any match or locator found nothing, in
     *     which case the target workbook has not been modified
     */
    public Optional<MatchResult> extract(Workbook sourceWorkbook, Workbook targetWorkbook, CellValueWriter writer) {
        Optional<MatchResult> sourceMatch = source.match(sourceWorkbook);
        if (sourceMatch.isEmpty()) {
            log.debug("{}: source not found", source.name());
            return Optional.empty();
        }
        Optional<MatchResult> targetMatch = target.match(targetWorkbook);
        if (targetMatch.isEmpty()) {
            log.debug("{}: target not found", source.name());
            return Optional.empty();
        }

        Optional<Side> sourceSide = Side.locate(sourceMatch.get().range(), sourceRow, sourceCol);
        Optional<Side> targetSide = Side.locate(targetMatch.get().range(), targetRow, targetCol);
        if (sourceSide.isEmpty() || targetSide.isEmpty()) {
            log.debug("{}: row or column locator not found inside the {} range",
                    source.name(), sourceSide.isEmpty() ? "source" : "target");
            return Optional.empty();
        }

        switch (mode) {
            case CELL -> copyCell(sourceSide.get(), targetSide.get(), writer);
            case TABLE -> copyTable(sourceSide.get().range(), targetSide.get().range(), writer);
            case VECTOR -> copyVector(sourceSide.get(), targetSide.get(), writer);
        }
        return sourceMatch;
    }

    private void copyCell(Side from, Side to, CellValueWriter writer) {
        Range sourceCell = from.range();
        Range targetCell = to.range();
        if (!sourceCell.isCell() || !targetCell.isCell()) {
            throw new ExtractConfigurationException(source.name(), "Cannot copy a table to a single cell or vice-versa");
        }
        writer.write(targetCell.getOrCreateCell(0, 0), sourceCell.getValue());
    }

    private void copyTable(Range from, Range to, CellValueWriter writer) {
        List<List<CellValue>> values = from.getValues();
        Range table = to;
        if (expand) {
            table = to.resize(from.getRows(), from.getColumns());
        }

        int rows = Math.min(from.getRows(), table.getRows());
        int cols = Math.min(from.getColumns(), table.getColumns());
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                writer.write(table.getOrCreateCell(i, j), values.get(i).get(j));
            }
        }
    }

    private void copyVector(Side from, Side to, CellValueWriter writer) {
        List<CellValue> sourceVector = from.vector();

        if (align) {
            Map<String, CellValue> lookup = new HashMap<>();
            List<CellValue> sourceLabels = from.labels();
            for (int k = 0; k < sourceLabels.size(); k++) {
                String key = labelKey(sourceLabels.get(k));
                if (key != null) {
                    lookup.put(key, sourceVector.get(k));
                }
            }

            List<CellValue> targetLabels = to.labels();
            for (int k = 0; k < targetLabels.size(); k++) {
                String key = labelKey(targetLabels.get(k));
                if (key != null && lookup.containsKey(key)) {
                    writer.write(to.vectorCell(k), lookup.get(key));
                }
            }
            return;
        }

        Side side = to;
        if (expand && to.length() != sourceVector.size()) {
            side = to.resizeVector(sourceVector.size());
        }
        int length = Math.min(sourceVector.size(), side.length());
        for (int k = 0; k < length; k++) {
            writer.write(side.vectorCell(k), sourceVector.get(k));
        }
    }

    private static String labelKey(CellValue label) {
        if (label.isBlank()) {
            return null;
        }
        String key = label.toDisplayString().trim().toLowerCase(Locale.ROOT);
        return key.isEmpty() ? null : key;
    }

    private static int count(CellMatch row, CellMatch col) {
        return (row != null ? 1 : 0) + (col != null ? 1 : 0);
    }

    /**
     * One side of a transfer after locators were applied: the whole range, a single cell, or a
     * range with one located row ({@code rowIndex}) or column ({@code colIndex}), as 0-based
     * offsets into the range.
     */
    private record Side(Range range, Integer rowIndex, Integer colIndex) {

        static Optional<Side> locate(Range range, CellMatch rowLocator, CellMatch colLocator) {
            Integer rowIndex = null;
            Integer colIndex = null;
            if (rowLocator != null) {
                Optional<MatchResult> hit = rowLocator.matchWithin(range);
                if (hit.isEmpty()) {
                    return Optional.empty();
                }
                rowIndex = hit.get().range().getFirstRow() - range.getFirstRow();
            }
            if (colLocator != null) {
                Optional<MatchResult> hit = colLocator.matchWithin(range);
                if (hit.isEmpty()) {
                    return Optional.empty();
                }
                colIndex = hit.get().range().getFirstColumn() - range.getFirstColumn();
            }
            if (rowIndex != null && colIndex != null) {
                return Optional.of(new Side(range.cellAt(rowIndex, colIndex), null, null));
            }
            return Optional.of(new Side(range, rowIndex, colIndex));
        }

        boolean isRowVector() {
            return rowIndex != null;
        }

        int length() {
            return isRowVector() ? range.getColumns() : range.getRows();
        }

        List<CellValue> vector() {
            List<CellValue> values = new ArrayList<>(length());
            for (int k = 0; k < length(); k++) {
                values.add(isRowVector() ? range.getValue(rowIndex, k) : range.getValue(k, colIndex));
            }
            return values;
        }

        /** The first row of the table for a row vector, the first column for a column vector. */
        List<CellValue> labels() {
            List<CellValue> values = new ArrayList<>(length());
            for (int k = 0; k < length(); k++) {
                values.add(isRowVector() ? range.getValue(0, k) : range.getValue(k, 0));
            }
            return values;
        }

        Cell vectorCell(int k) {
            return isRowVector() ? range.getOrCreateCell(rowIndex, k) : range.getOrCreateCell(k, colIndex);
        }

        Side resizeVector(int length) {
            Range resized = isRowVector()
                    ? range.resize(range.getRows(), length)
                    : range.resize(length, range.getColumns());
            return new Side(resized, rowIndex, colIndex);
        }
    }
}

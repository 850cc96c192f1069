package com.foo.extract.util;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;

/**
 * Inserts and deletes whole rows and columns with POI's sheet shifters.
 *
 * <p>All indices are 0-based. POI moves cells, merged regions, comments and hyperlinks, and
 * rewrites formula and defined-name references into the moved area. Table areas are not moved;
 * callers re-point those themselves.
 */
public final class SheetShiftUtils {

    private SheetShiftUtils() {
        // Utility class
    }

    /** Inserts {@code count} empty rows before {@code startRow}, pushing later rows down. */
    public static void insertRows(Sheet sheet, int startRow, int count) {
        requirePositive(count);
        sheet.shiftRows(startRow, Math.max(sheet.getLastRowNum(), startRow), count, true, false);
    }

    /** Deletes {@code count} rows starting at {@code startRow}, pulling later rows up. */
    public static void deleteRows(Sheet sheet, int startRow, int count) {
        requirePositive(count);
        int endRow = startRow + count - 1;
        removeMergedRegions(sheet, new CellRangeAddress(startRow, endRow, 0, maxColumnIndex(sheet)));
        for (int r = startRow; r <= endRow; r++) {
            Row row = sheet.getRow(r);
            if (row != null) {
                sheet.removeRow(row);
            }
        }
        int last = sheet.getLastRowNum();
        if (last > endRow) {
            sheet.shiftRows(endRow + 1, last, -count, true, false);
        }
    }

    /** Inserts {@code count} empty columns before {@code startCol}, pushing later columns right. */
    public static void insertColumns(Sheet sheet, int startCol, int count) {
        requirePositive(count);
        int last = CellValueUtils.usedColumns(sheet) - 1;
        sheet.shiftColumns(startCol, Math.max(last, startCol), count);
        for (int c = last + count; c >= startCol + count; c--) {
            sheet.setColumnWidth(c, sheet.getColumnWidth(c - count));
        }
    }

    /** Deletes {@code count} columns starting at {@code startCol}, pulling later columns left. */
    public static void deleteColumns(Sheet sheet, int startCol, int count) {
        requirePositive(count);
        int endCol = startCol + count - 1;
        removeMergedRegions(sheet, new CellRangeAddress(0, Math.max(sheet.getLastRowNum(), 0), startCol, endCol));
        for (Row row : sheet) {
            for (int c = startCol; c <= endCol; c++) {
                Cell cell = row.getCell(c);
                if (cell != null) {
                    row.removeCell(cell);
                }
            }
        }
        int last = CellValueUtils.usedColumns(sheet) - 1;
        if (last > endCol) {
            sheet.shiftColumns(endCol + 1, last, -count);
        }
    }

    private static void removeMergedRegions(Sheet sheet, CellRangeAddress area) {
        for (int i = sheet.getNumMergedRegions() - 1; i >= 0; i--) {
            if (sheet.getMergedRegion(i).intersects(area)) {
                sheet.removeMergedRegion(i);
            }
        }
    }

    private static int maxColumnIndex(Sheet sheet) {
        return sheet.getWorkbook().getSpreadsheetVersion().getLastColumnIndex();
    }

    private static void requirePositive(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Shift count must be positive: " + count);
        }
    }
}

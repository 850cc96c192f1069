package com.foo.extract.util;

import com.foo.extract.match.CellValue;
import java.time.LocalDateTime;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

/**
 * Reads POI cells as {@link CellValue}s without creating rows or cells.
 */
public final class CellValueUtils {

    private CellValueUtils() {
        // Utility class
    }

    /**
     * Reads the cell at a 1-based row/column. Missing rows and cells read as
     * {@link CellValue#NULL}.
     */
    public static CellValue read(Sheet sheet, int row, int column) {
        if (sheet == null || row < 1 || column < 1) {
            return CellValue.NULL;
        }
        Row r = sheet.getRow(row - 1);
        if (r == null) {
            return CellValue.NULL;
        }
        return read(r.getCell(column - 1));
    }

    public static CellValue read(Cell cell) {
        if (cell == null) {
            return CellValue.NULL;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        return switch (type) {
            case STRING -> CellValue.text(cell.getStringCellValue());
            case NUMERIC -> readNumeric(cell);
            case BOOLEAN -> CellValue.bool(cell.getBooleanCellValue());
            case ERROR -> CellValue.text(errorText(cell.getErrorCellValue()));
            default -> CellValue.NULL;
        };
    }

    /** Number of rows in the sheet's used area (0 for an empty sheet). */
    public static int usedRows(Sheet sheet) {
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return 0;
        }
        return sheet.getLastRowNum() + 1;
    }

    /** Number of columns in the sheet's used area (0 for an empty sheet). */
    public static int usedColumns(Sheet sheet) {
        int max = 0;
        for (Row row : sheet) {
            max = Math.max(max, row.getLastCellNum());
        }
        return max;
    }

    private static CellValue readNumeric(Cell cell) {
        double numeric = cell.getNumericCellValue();
        if (DateUtil.isCellDateFormatted(cell)) {
            LocalDateTime dateTime = cell.getLocalDateTimeCellValue();
            if (numeric >= 0 && numeric < 1) {
                return CellValue.time(dateTime.toLocalTime());
            }
            return CellValue.dateTime(dateTime);
        }
        return CellValue.number(numeric);
    }

    private static String errorText(byte code) {
        try {
            return FormulaError.forInt(code).getString();
        } catch (IllegalArgumentException e) {
            return "#ERROR!";
        }
    }
}

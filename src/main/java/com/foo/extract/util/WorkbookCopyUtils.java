package com.foo.extract.util;

import java.util.Map;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * Stateless helpers for cell styles and cell creation inside POI workbooks.
 */
public final class WorkbookCopyUtils {

    private WorkbookCopyUtils() {
        // Utility class
    }

    /**
     * Returns a CellStyle that clones the base style and uses the given data format.
     * Results are cached by base style index and format to prevent style explosion (POI 64K limit).
     *
     * @param cache mutated by this method; caller should pass a per-operation HashMap
     */
    public static CellStyle getOrCreateFormattedStyle(Workbook wb, CellStyle base, String format,
            Map<String, CellStyle> cache) {
        String key = base.getIndex() + "|" + format;
        return cache.computeIfAbsent(key, k -> {
            CellStyle formatted = wb.createCellStyle();
            formatted.cloneStyleFrom(base);
            formatted.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat(format));
            return formatted;
        });
    }

    /** True when the cell's style already renders numbers as dates or times. */
    public static boolean hasDateFormat(Cell cell) {
        CellStyle style = cell.getCellStyle();
        return style != null && DateUtil.isADateFormat(style.getDataFormat(), style.getDataFormatString());
    }

    public static Row getOrCreateRow(Sheet sheet, int rowIndex) {
        Row row = sheet.getRow(rowIndex);
        return row != null ? row : sheet.createRow(rowIndex);
    }

    public static Cell getOrCreateCell(Sheet sheet, int rowIndex, int colIndex) {
        Row row = getOrCreateRow(sheet, rowIndex);
        Cell cell = row.getCell(colIndex);
        return cell != null ? cell : row.createCell(colIndex);
    }
}

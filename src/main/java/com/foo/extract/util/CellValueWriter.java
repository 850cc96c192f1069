package com.foo.extract.util;

import com.foo.extract.match.CellValue;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.Map;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;

/**
 * Writes {@link CellValue}s into POI cells. Date and time values get a date data format
 * (cloned from the cell's existing style) unless the cell is already date-formatted, so they
 * read back as dates.
 *
 * <p>Not thread-safe: holds a style cache. Create one per extraction pass.
 */
public class CellValueWriter {

    public static final String DEFAULT_DATE_FORMAT = "yyyy-mm-dd";
    public static final String DEFAULT_DATE_TIME_FORMAT = "yyyy-mm-dd hh:mm:ss";
    public static final String DEFAULT_TIME_FORMAT = "hh:mm:ss";

    private static final double SECONDS_PER_DAY = 86_400d;

    private final String dateFormat;
    private final String dateTimeFormat;
    private final String timeFormat;
    private final Map<String, CellStyle> styleCache = new HashMap<>();

    public CellValueWriter() {
        this(DEFAULT_DATE_FORMAT, DEFAULT_DATE_TIME_FORMAT, DEFAULT_TIME_FORMAT);
    }

    public CellValueWriter(String dateFormat, String dateTimeFormat, String timeFormat) {
        this.dateFormat = dateFormat;
        this.dateTimeFormat = dateTimeFormat;
        this.timeFormat = timeFormat;
    }

    public void write(Cell cell, CellValue value) {
        CellValue v = value == null ? CellValue.NULL : value;
        switch (v.type()) {
            case NULL -> cell.setBlank();
            case TEXT -> cell.setCellValue(v.asText());
            case NUMBER -> cell.setCellValue(v.asNumber());
            case BOOLEAN -> cell.setCellValue((Boolean) v.value());
            case DATE -> {
                cell.setCellValue((LocalDate) v.value());
                ensureDateFormat(cell, dateFormat);
            }
            case DATE_TIME -> {
                cell.setCellValue((LocalDateTime) v.value());
                ensureDateFormat(cell, dateTimeFormat);
            }
            case TIME -> {
                LocalTime time = (LocalTime) v.value();
                cell.setCellValue(time.toNanoOfDay() / 1_000_000_000d / SECONDS_PER_DAY);
                ensureDateFormat(cell, timeFormat);
            }
        }
    }

    private void ensureDateFormat(Cell cell, String format) {
        if (WorkbookCopyUtils.hasDateFormat(cell)) {
            return;
        }
        CellStyle formatted = WorkbookCopyUtils.getOrCreateFormattedStyle(
                cell.getSheet().getWorkbook(), cell.getCellStyle(), format, styleCache);
        cell.setCellStyle(formatted);
    }
}

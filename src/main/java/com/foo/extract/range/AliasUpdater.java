package com.foo.extract.range;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Name;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;

/**
 * Keeps the resized alias and any named tables pointing at the right cells after
 * {@link Range#resize} inserted or deleted rows/columns.
 */
@Slf4j
final class AliasUpdater {

    private AliasUpdater() {}

    /** Rewrites the alias of {@code resized} so it covers the resized block. */
    static void repoint(Range resized) {
        Alias alias = resized.getAlias();
        Sheet sheet = resized.getSheet();

        if (alias.isDefinedName()) {
            Name name = findName(sheet, alias);
            if (name == null) {
                log.warn("Defined name '{}' disappeared before it could be updated", alias.name());
                return;
            }
            name.setRefersToFormula(resized.getReference(true, true, false));
            return;
        }

        XSSFTable table = findTable(sheet, alias.name());
        if (table == null) {
            log.warn("Table '{}' not found on sheet '{}'", alias.name(), sheet.getSheetName());
            return;
        }
        table.setArea(toArea(sheet, resized.getAddress()));
    }

    /**
     * Moves named tables on {@code sheet} that lie entirely at or after {@code from} (0-based row
     * or column index) by {@code delta}. POI's shifters move cells and defined names but leave
     * table areas where they were. The resized table itself is skipped; {@link #repoint} takes
     * care of it.
     */
    static void shiftTables(Sheet sheet, Alias skip, int from, int delta, boolean rows) {
        if (!(sheet instanceof XSSFSheet xssfSheet)) {
            return;
        }
        for (XSSFTable table : xssfSheet.getTables()) {
            if (skip != null && skip.isNamedTable() && table.getName().equalsIgnoreCase(skip.name())) {
                continue;
            }
            CellRangeAddress area = new CellRangeAddress(
                    table.getStartCellReference().getRow(), table.getEndCellReference().getRow(),
                    table.getStartCellReference().getCol(), table.getEndCellReference().getCol());
            if (liesAfter(area, from, rows)) {
                CellRangeAddress moved = shift(area, delta, rows);
                log.debug("Shifting table '{}' from {} to {}", table.getName(),
                        area.formatAsString(), moved.formatAsString());
                table.setArea(toArea(sheet, moved));
            }
        }
    }

    static Name findName(Sheet sheet, Alias alias) {
        for (Name name : sheet.getWorkbook().getAllNames()) {
            if (isSameName(name, alias)) {
                return name;
            }
        }
        return null;
    }

    static XSSFTable findTable(Sheet sheet, String tableName) {
        if (!(sheet instanceof XSSFSheet xssfSheet)) {
            return null;
        }
        for (XSSFTable table : xssfSheet.getTables()) {
            if (tableName.equalsIgnoreCase(table.getName())) {
                return table;
            }
        }
        return null;
    }

    private static boolean isSameName(Name name, Alias alias) {
        return name.getNameName().equalsIgnoreCase(alias.name()) && name.getSheetIndex() == alias.sheetIndex();
    }

    private static boolean liesAfter(CellRangeAddress area, int from, boolean rows) {
        return rows ? area.getFirstRow() >= from : area.getFirstColumn() >= from;
    }

    private static CellRangeAddress shift(CellRangeAddress area, int delta, boolean rows) {
        if (rows) {
            return new CellRangeAddress(area.getFirstRow() + delta, area.getLastRow() + delta,
                    area.getFirstColumn(), area.getLastColumn());
        }
        return new CellRangeAddress(area.getFirstRow(), area.getLastRow(),
                area.getFirstColumn() + delta, area.getLastColumn() + delta);
    }

    private static AreaReference toArea(Sheet sheet, CellRangeAddress address) {
        String sheetName = sheet.getSheetName();
        return new AreaReference(
                new CellReference(sheetName, address.getFirstRow(), address.getFirstColumn(), true, true),
                new CellReference(sheetName, address.getLastRow(), address.getLastColumn(), true, true),
                SpreadsheetVersion.EXCEL2007);
    }
}

package com.foo.extract.match;

import com.foo.extract.range.Alias;
import com.foo.extract.range.Range;
import com.foo.extract.util.ReferenceParser;
import com.foo.extract.util.ReferenceParser.ParsedReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Name;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;

/**
 * Resolves a reference string to a {@link Range}, trying in order: a defined name local to the
 * selected sheet, a workbook-global defined name, a named table, and finally a literal A1
 * coordinate (optionally sheet-qualified).
 */
@Slf4j
public final class ReferenceResolver {

    private ReferenceResolver() {}

    /**
     * Resolves against the first sheet matching {@code sheetFilter}. When a filter is given but
     * no sheet matches, only names, tables and sheet-qualified coordinates can resolve.
     */
    public static Optional<Range> resolve(Workbook workbook, String reference, ValueComparator sheetFilter) {
        Sheet selected = SheetSearch.selectSheet(workbook, sheetFilter).orElse(null);
        return resolve(workbook, reference, selected, sheetFilter == null);
    }

    /**
     * @param selectedSheet the sheet unqualified references are read from, or null
     * @param useActiveSheet whether an unqualified coordinate falls back to the active sheet
     *     when {@code selectedSheet} is null
     * @return the resolved block, or empty when nothing by that reference exists
     */
    public static Optional<Range> resolve(Workbook workbook, String reference, Sheet selectedSheet,
                                          boolean useActiveSheet) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String ref = reference.trim();

        if (selectedSheet != null) {
            int sheetIndex = workbook.getSheetIndex(selectedSheet);
            Optional<Range> local = resolveDefinedName(workbook, ref, sheetIndex);
            if (local.isPresent()) {
                return local;
            }
        }

        Optional<Range> global = resolveDefinedName(workbook, ref, Alias.GLOBAL_SCOPE);
        if (global.isPresent()) {
            return global;
        }

        Optional<Range> table = resolveTable(workbook, ref, selectedSheet);
        if (table.isPresent()) {
            return table;
        }

        return resolveCoordinate(workbook, ref, selectedSheet, useActiveSheet);
    }

    private static Optional<Range> resolveDefinedName(Workbook workbook, String ref, int sheetIndex) {
        for (Name name : workbook.getAllNames()) {
            if (name.getSheetIndex() != sheetIndex || !name.getNameName().equalsIgnoreCase(ref)) {
                continue;
            }
            Sheet scopeSheet = sheetIndex == Alias.GLOBAL_SCOPE ? null : workbook.getSheetAt(sheetIndex);
            Optional<Range> range = resolveCoordinate(workbook, name.getRefersToFormula(), scopeSheet, false);
            if (range.isEmpty()) {
                log.debug("Defined name '{}' refers to '{}', which is not a cell block",
                        name.getNameName(), name.getRefersToFormula());
                return Optional.empty();
            }
            return Optional.of(range.get().withAlias(Alias.definedName(name.getNameName(), sheetIndex)));
        }
        return Optional.empty();
    }

    private static Optional<Range> resolveTable(Workbook workbook, String ref, Sheet selectedSheet) {
        List<Sheet> candidates = new ArrayList<>();
        if (selectedSheet != null) {
            candidates.add(selectedSheet);
        }
        workbook.forEach(candidates::add);

        for (Sheet sheet : candidates) {
            if (!(sheet instanceof XSSFSheet xssfSheet)) {
                continue;
            }
            for (XSSFTable table : xssfSheet.getTables()) {
                if (ref.equalsIgnoreCase(table.getName()) || ref.equalsIgnoreCase(table.getDisplayName())) {
                    CellRangeAddress area = new CellRangeAddress(
                            table.getStartCellReference().getRow(), table.getEndCellReference().getRow(),
                            table.getStartCellReference().getCol(), table.getEndCellReference().getCol());
                    return Optional.of(Range.of(sheet, area).withAlias(Alias.namedTable(table.getName())));
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Range> resolveCoordinate(Workbook workbook, String ref, Sheet selectedSheet,
                                                     boolean useActiveSheet) {
        Optional<ParsedReference> parsed = ReferenceParser.parse(ref);
        if (parsed.isEmpty()) {
            log.debug("'{}' is neither a name, a table nor a cell reference", ref);
            return Optional.empty();
        }

        Sheet sheet;
        if (parsed.get().sheetName() != null) {
            sheet = workbook.getSheet(parsed.get().sheetName());
            if (sheet == null) {
                log.debug("Sheet '{}' referenced by '{}' does not exist", parsed.get().sheetName(), ref);
                return Optional.empty();
            }
        } else if (selectedSheet != null) {
            sheet = selectedSheet;
        } else if (useActiveSheet && workbook.getNumberOfSheets() > 0) {
            sheet = workbook.getSheetAt(workbook.getActiveSheetIndex());
        } else {
            return Optional.empty();
        }

        Range range = Range.of(sheet, parsed.get().address());
        return range.isEmpty() ? Optional.empty() : Optional.of(range);
    }
}

package com.foo.extract.match;

import com.foo.extract.range.Range;
import com.foo.extract.util.CellValueUtils;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * Sheet selection by title and bounded row-major value scans.
 */
@Slf4j
final class SheetSearch {

    private SheetSearch() {}

    /** The first sheet, in workbook order, whose title satisfies {@code filter}. */
    static Optional<Sheet> selectSheet(Workbook workbook, ValueComparator filter) {
        if (filter == null) {
            return Optional.empty();
        }
        for (Sheet sheet : workbook) {
            if (filter.matches(CellValue.text(sheet.getSheetName()))) {
                return Optional.of(sheet);
            }
        }
        log.debug("No sheet matches {}", filter);
        return Optional.empty();
    }

    /**
     * Scans rows top to bottom and columns left to right for the first cell satisfying
     * {@code value}. Bounds are 1-based and inclusive; a null bound falls back to the first row
     * or column, or to the edge of the sheet's used area.
     */
    static Optional<MatchResult> findValue(Sheet sheet, ValueComparator value,
                                           Integer minRow, Integer maxRow, Integer minCol, Integer maxCol) {
        int r1 = minRow != null ? minRow : 1;
        int c1 = minCol != null ? minCol : 1;
        int r2 = maxRow != null ? maxRow : CellValueUtils.usedRows(sheet);
        int c2 = maxCol != null ? maxCol : CellValueUtils.usedColumns(sheet);

        for (int r = r1; r <= r2; r++) {
            for (int c = c1; c <= c2; c++) {
                Optional<CellValue> captured = value.match(CellValueUtils.read(sheet, r, c));
                if (captured.isPresent()) {
                    return Optional.of(new MatchResult(Range.cell(sheet, r, c), captured.get()));
                }
            }
        }
        return Optional.empty();
    }
}

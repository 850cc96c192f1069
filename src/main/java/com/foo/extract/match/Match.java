package com.foo.extract.match;

import java.util.Optional;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * A declarative locator that resolves to a cell ({@link CellMatch}) or a block of cells
 * ({@link RangeMatch}) inside a workbook.
 *
 * <p>Implementations are immutable. {@link #match(Workbook)} never throws for absent data;
 * invalid settings are rejected when the match is built.
 */
public interface Match {

    enum Kind {
        CELL,
        RANGE
    }

    String name();

    /** Sheet title filter, or null when the match is not tied to a sheet by title. */
    ValueComparator sheet();

    Kind kind();

    Optional<MatchResult> match(Workbook workbook);

    /** A copy using {@code sheetFilter} when this match has no sheet filter of its own. */
    Match withSheet(ValueComparator sheetFilter);
}

package com.foo.extract.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.CellReference;

/**
 * Parses A1-style references such as {@code B3}, {@code $B$3:$D$9} or {@code 'Report 1'!B3}.
 * Names, whole-row/column references and multi-area references are not coordinates and parse
 * to empty.
 */
public final class ReferenceParser {

    private static final Pattern REFERENCE = Pattern.compile(
            "^(?:(?:'((?:[^']|'')+)'|([^'!:]+))!)?"
                    + "(\\$?[A-Za-z]{1,3}\\$?[0-9]+)"
                    + "(?::(\\$?[A-Za-z]{1,3}\\$?[0-9]+))?$");

    /** A parsed reference; {@code sheetName} is null when the text carried no sheet. */
    public record ParsedReference(String sheetName, CellRangeAddress address) {}

    private ReferenceParser() {}

    public static Optional<ParsedReference> parse(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        Matcher m = REFERENCE.matcher(reference.trim());
        if (!m.matches()) {
            return Optional.empty();
        }

        String sheetName = m.group(1) != null ? m.group(1).replace("''", "'") : m.group(2);
        if (sheetName != null) {
            sheetName = sheetName.trim();
        }

        CellReference first = new CellReference(m.group(3).replace("$", ""));
        CellReference last = m.group(4) != null ? new CellReference(m.group(4).replace("$", "")) : first;

        SpreadsheetVersion version = SpreadsheetVersion.EXCEL2007;
        if (!isValid(first, version) || !isValid(last, version)) {
            return Optional.empty();
        }

        CellRangeAddress address = new CellRangeAddress(
                Math.min(first.getRow(), last.getRow()),
                Math.max(first.getRow(), last.getRow()),
                Math.min(first.getCol(), last.getCol()),
                Math.max(first.getCol(), last.getCol()));
        return Optional.of(new ParsedReference(sheetName, address));
    }

    /** Quotes a sheet name for use in a reference when Excel would require it. */
    public static String quoteSheetName(String sheetName) {
        if (sheetName.matches("[A-Za-z_][A-Za-z0-9_.]*") && !sheetName.matches("(?i)[A-Z]{1,3}[0-9]+")) {
            return sheetName;
        }
        return "'" + sheetName.replace("'", "''") + "'";
    }

    private static boolean isValid(CellReference ref, SpreadsheetVersion version) {
        return ref.getRow() >= 0 && ref.getRow() <= version.getLastRowIndex()
                && ref.getCol() >= 0 && ref.getCol() <= version.getLastColumnIndex();
    }
}

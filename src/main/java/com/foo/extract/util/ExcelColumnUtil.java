package com.foo.extract.util;

import org.apache.poi.ss.util.CellReference;

public final class ExcelColumnUtil {

  private ExcelColumnUtil() {}

  /** Converts Excel column letters to a 0-based index. A=0, B=1, ..., Z=25, AA=26, AB=27, ... */
  public static int letterToIndex(String column) {
    if (column == null || column.isBlank()) {
      return -1;
    }

    String col = column.toUpperCase().trim();
    int index = 0;

    for (int i = 0; i < col.length(); i++) {
      char c = col.charAt(i);
      if (c < 'A' || c > 'Z') {
        throw new IllegalArgumentException("Invalid column letter: " + column);
      }
      index = index * 26 + (c - 'A' + 1);
    }

    return index - 1;
  }

  /** Converts a 0-based index to Excel column letters. 0=A, 1=B, ..., 25=Z, 26=AA, 27=AB, ... */
  public static String indexToLetter(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Column index must be non-negative: " + index);
    }

    StringBuilder sb = new StringBuilder();
    int col = index + 1;

    while (col > 0) {
      int remainder = (col - 1) % 26;
      sb.insert(0, (char) ('A' + remainder));
      col = (col - 1) / 26;
    }

    return sb.toString();
  }

  /**
   * Parses a column given either as letters ("C") or as a 1-based number ("3").
   *
   * @return the 1-based column number, or -1 for null/blank input
   */
  public static int parseColumnReference(String reference) {
    if (reference == null || reference.isBlank()) {
      return -1;
    }
    String trimmed = reference.trim();
    if (trimmed.chars().allMatch(Character::isDigit)) {
      return Integer.parseInt(trimmed);
    }
    return letterToIndex(trimmed) + 1;
  }

  /**
   * Formats a 1-based row/column pair as an A1 coordinate, e.g. (3, 2) becomes "B3", or "$B$3"
   * when {@code absolute} is set.
   */
  public static String toCoordinate(int row, int column, boolean absolute) {
    return new CellReference(row - 1, column - 1, absolute, absolute).formatAsString();
  }
}

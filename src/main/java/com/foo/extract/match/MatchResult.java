package com.foo.extract.match;

import com.foo.extract.range.Range;
import java.util.Optional;

/**
 * A resolved match: the located range and, for value searches, the comparator's captured value
 * ({@code null} for reference lookups).
 */
public record MatchResult(Range range, CellValue value) {

    public static MatchResult of(Range range) {
        return new MatchResult(range, null);
    }

    public Optional<CellValue> capturedValue() {
        return Optional.ofNullable(value);
    }

    public MatchResult withRange(Range newRange) {
        return new MatchResult(newRange, value);
    }
}

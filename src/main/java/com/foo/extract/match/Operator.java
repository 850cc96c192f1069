package com.foo.extract.match;

public enum Operator {

    /** Same type and equal value. */
    EQUAL,

    NOT_EQUAL,

    GREATER,

    GREATER_EQUAL,

    LESS,

    LESS_EQUAL,

    /** Null or zero-length text. */
    EMPTY,

    /** Anything but null and zero-length text. */
    NOT_EMPTY,

    /** Case-insensitive search in text; the operand is the pattern. */
    REGEX;

    public boolean isOrdering() {
        return this == GREATER || this == GREATER_EQUAL || this == LESS || this == LESS_EQUAL;
    }
}

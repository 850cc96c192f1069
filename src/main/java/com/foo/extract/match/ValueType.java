package com.foo.extract.match;

/** The kinds of value a spreadsheet cell can hold. */
public enum ValueType {
    NULL,
    TEXT,
    NUMBER,
    BOOLEAN,
    DATE,
    TIME,
    DATE_TIME
}

package com.foo.extract.range;

/**
 * The name a {@link Range} was resolved through: a defined name (workbook-global when
 * {@code sheetIndex} is -1, otherwise local to that sheet) or a named table.
 */
public record Alias(Type type, String name, int sheetIndex) {

    public enum Type {
        DEFINED_NAME,
        NAMED_TABLE
    }

    public static final int GLOBAL_SCOPE = -1;

    public static Alias definedName(String name, int sheetIndex) {
        return new Alias(Type.DEFINED_NAME, name, sheetIndex);
    }

    public static Alias namedTable(String name) {
        return new Alias(Type.NAMED_TABLE, name, GLOBAL_SCOPE);
    }

    public boolean isDefinedName() {
        return type == Type.DEFINED_NAME;
    }

    public boolean isNamedTable() {
        return type == Type.NAMED_TABLE;
    }
}

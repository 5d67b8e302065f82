package com.schemata.core;

/**
 * Base kind of a column type. Catalog types this library does not model, such as {@code TOKENLIST} or
 * {@code PROTO<...>}, are {@link #OTHER}.
 */
public enum TypeKind {
    BOOL,
    INT64,
    FLOAT32,
    FLOAT64,
    NUMERIC,
    STRING,
    BYTES,
    DATE,
    TIMESTAMP,
    JSON,
    ARRAY,
    OTHER;

    /**
     * Parses the base kind of a catalog type such as {@code STRING(MAX)} or {@code ARRAY<INT64>}.
     *
     * @throws IllegalArgumentException if {@code ddlType} is blank
     */
    public static TypeKind of(String ddlType) {
        if (ddlType == null || ddlType.isBlank()) {
            throw new IllegalArgumentException("Column type must not be blank");
        }
        String upper = ddlType.trim().toUpperCase();
        int end = upper.length();
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (c == '(' || c == '<') {
                end = i;
                break;
            }
        }
        String base = upper.substring(0, end).trim();
        for (TypeKind kind : values()) {
            if (kind != OTHER && kind.name().equals(base)) {
                return kind;
            }
        }
        return OTHER;
    }
}

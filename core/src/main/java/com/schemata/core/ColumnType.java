package com.schemata.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.regex.Pattern;

/**
 * A column's catalog type, e.g. {@code INT64}, {@code STRING(MAX)} or {@code ARRAY<STRING(MAX)>},
 * together with its nullability.
 *
 * <p>Any non-blank type text is accepted, so every catalog row can be represented. Only
 * {@linkplain #wellFormed() well-formed} types may be used in new DDL.
 */
public record ColumnType(
        @JsonProperty("type") String ddlType,
        @JsonProperty("nullable") boolean nullable
) {
    private static final String ELEMENT =
            "(?:BOOL|INT64|FLOAT32|FLOAT64|NUMERIC|DATE|TIMESTAMP|JSON|(?:STRING|BYTES)\\((?:[1-9][0-9]*|MAX)\\))";
    private static final Pattern WELL_FORMED =
            Pattern.compile(ELEMENT + "|ARRAY<" + ELEMENT + ">", Pattern.CASE_INSENSITIVE);

    public ColumnType {
        if (ddlType == null || ddlType.isBlank()) {
            throw new IllegalArgumentException("Column type must not be blank");
        }
        ddlType = ddlType.trim();
    }

    public static ColumnType nullable(String ddlType) {
        return new ColumnType(ddlType, true);
    }

    public static ColumnType notNull(String ddlType) {
        return new ColumnType(ddlType, false);
    }

    @JsonIgnore
    public TypeKind kind() {
        return TypeKind.of(ddlType);
    }

    /**
     * @return whether the whole type text is a scalar, sized or array type this library can render into DDL
     */
    @JsonIgnore
    public boolean wellFormed() {
        return WELL_FORMED.matcher(ddlType).matches();
    }

    @JsonIgnore
    public boolean isArray() {
        return kind() == TypeKind.ARRAY;
    }

    /**
     * @return the element type of an array column
     * @throws IllegalStateException if this is not an array type
     */
    @JsonIgnore
    public ColumnType elementType() {
        if (!isArray()) {
            throw new IllegalStateException(ddlType + " is not an array type");
        }
        int open = ddlType.indexOf('<');
        int close = ddlType.lastIndexOf('>');
        if (open < 0 || close < open) {
            throw new IllegalStateException("Malformed array type: " + ddlType);
        }
        return new ColumnType(ddlType.substring(open + 1, close), true);
    }

    public String ddl() {
        return nullable ? ddlType : ddlType + " NOT NULL";
    }

    @Override
    public String toString() {
        return ddl();
    }
}

package com.schemata.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the columns catalog relation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnSchema(
        @JsonProperty("table_catalog") String tableCatalog,
        @JsonProperty("table_schema") String tableSchema,
        @JsonProperty("table_name") String tableName,
        @JsonProperty("column_name") String columnName,
        @JsonProperty("ordinal_position") Integer ordinalPosition,
        @JsonProperty("is_nullable") String isNullable,
        @JsonProperty("spanner_type") String spannerType
) {
    /**
     * @throws CatalogReadException if the row carries no type
     */
    public ColumnType type() {
        if (spannerType == null || spannerType.isBlank()) {
            throw new CatalogReadException("Column " + tableName + "." + columnName + " has no type");
        }
        return new ColumnType(spannerType, "YES".equalsIgnoreCase(isNullable));
    }
}

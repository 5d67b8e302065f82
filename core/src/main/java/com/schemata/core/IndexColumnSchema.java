package com.schemata.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the index-columns catalog relation. A {@code null} ordinal position marks a column
 * that is stored with the index but is not part of its key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexColumnSchema(
        @JsonProperty("table_catalog") String tableCatalog,
        @JsonProperty("table_schema") String tableSchema,
        @JsonProperty("table_name") String tableName,
        @JsonProperty("index_name") String indexName,
        @JsonProperty("column_name") String columnName,
        @JsonProperty("ordinal_position") Integer ordinalPosition,
        @JsonProperty("column_ordering") String columnOrdering,
        @JsonProperty("is_nullable") String isNullable,
        @JsonProperty("spanner_type") String spannerType
) {}

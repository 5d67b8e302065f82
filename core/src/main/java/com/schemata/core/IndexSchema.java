package com.schemata.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexSchema(
        @JsonProperty("table_catalog") String tableCatalog,
        @JsonProperty("table_schema") String tableSchema,
        @JsonProperty("table_name") String tableName,
        @JsonProperty("index_name") String indexName,
        @JsonProperty("index_type") String indexType,
        @JsonProperty("parent_table_name") String parentTableName,
        @JsonProperty("is_unique") boolean isUnique,
        @JsonProperty("is_null_filtered") boolean isNullFiltered,
        @JsonProperty("index_state") String indexState
) {}

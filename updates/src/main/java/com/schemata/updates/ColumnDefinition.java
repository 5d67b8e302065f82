package com.schemata.updates;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.schemata.core.ColumnType;

public record ColumnDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("type") ColumnType type
) {}

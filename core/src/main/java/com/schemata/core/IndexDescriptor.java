package com.schemata.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * An index as reconstructed from the catalog. {@code columns} holds the key columns in key order.
 */
public record IndexDescriptor(
        @JsonProperty("columns") List<String> columns,
        @JsonProperty("type") String type,
        @JsonProperty("unique") boolean unique,
        @JsonProperty("nullFiltered") boolean nullFiltered,
        @JsonProperty("state") String state,
        @JsonProperty("parentTable") String parentTable
) {
    public IndexDescriptor {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}

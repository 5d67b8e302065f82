package com.schemata.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.schemata.core.config.CatalogConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of one table: its columns, its primary key ordering and its indexes.
 *
 * <p>Every table is described by this one type; callers that need to tell tables apart use
 * {@link #table()}. {@code primaryKeyIndex} names the entry of {@code indexes} that holds the primary key.
 */
public record ModelDescriptor(
        @JsonProperty("table") String table,
        @JsonProperty("schema") Map<String, ColumnType> columnSchema,
        @JsonProperty("primaryIndexKeys") List<String> primaryIndexKeys,
        @JsonProperty("indexes") Map<String, IndexDescriptor> indexes,
        @JsonProperty("primaryKeyIndex") String primaryKeyIndex
) {
    public ModelDescriptor {
        columnSchema = Collections.unmodifiableMap(new LinkedHashMap<>(columnSchema));
        primaryIndexKeys = List.copyOf(primaryIndexKeys);
        indexes = indexes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(indexes));
        primaryKeyIndex = primaryKeyIndex == null ? CatalogConfig.DEFAULT_PRIMARY_KEY_INDEX : primaryKeyIndex;
    }

    public ModelDescriptor(String table, Map<String, ColumnType> columnSchema, List<String> primaryIndexKeys,
                           Map<String, IndexDescriptor> indexes) {
        this(table, columnSchema, primaryIndexKeys, indexes, null);
    }

    public boolean hasColumn(String column) {
        return columnSchema.containsKey(column);
    }

    public Optional<ColumnType> columnType(String column) {
        return Optional.ofNullable(columnSchema.get(column));
    }

    public boolean hasIndex(String index) {
        return indexes.containsKey(index);
    }

    public Optional<IndexDescriptor> index(String index) {
        return Optional.ofNullable(indexes.get(index));
    }

    public boolean isPrimaryKey(String index) {
        return primaryKeyIndex.equals(index);
    }

    /**
     * @return every index except the primary key, in catalog order
     */
    public Map<String, IndexDescriptor> secondaryIndexes() {
        Map<String, IndexDescriptor> secondary = new LinkedHashMap<>(indexes);
        secondary.remove(primaryKeyIndex);
        return Collections.unmodifiableMap(secondary);
    }
}

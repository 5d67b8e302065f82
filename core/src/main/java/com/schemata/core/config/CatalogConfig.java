package com.schemata.core.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where the catalog lives and how to read it.
 *
 * @param catalogName     value of {@code table_catalog} for user tables; empty for the default catalog
 * @param schemaName      value of {@code table_schema} for user tables; empty for the default schema
 * @param primaryKeyIndex reserved name of every table's primary key index
 * @param relations       catalog relation name to the physical table that holds it
 */
public record CatalogConfig(
        String catalogName,
        String schemaName,
        String primaryKeyIndex,
        Map<String, String> relations
) {
    public static final String DEFAULT_NAMESPACE = "";
    public static final String DEFAULT_PRIMARY_KEY_INDEX = "PRIMARY_KEY";

    public CatalogConfig {
        relations = relations == null ? Map.of() : Map.copyOf(relations);
    }

    public static CatalogConfig defaults() {
        return builder().build();
    }

    /**
     * @return the physical table for a catalog relation; relations without a mapping are read by name
     */
    public String relationTable(String relation) {
        return relations.getOrDefault(relation, relation);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String catalogName = DEFAULT_NAMESPACE;
        private String schemaName = DEFAULT_NAMESPACE;
        private String primaryKeyIndex = DEFAULT_PRIMARY_KEY_INDEX;
        private final Map<String, String> relations = new LinkedHashMap<>();

        public Builder() {
            relations.put("columns", "information_schema.columns");
            relations.put("indexes", "information_schema.indexes");
            relations.put("index_columns", "information_schema.index_columns");
        }

        public Builder catalogName(String catalogName) {
            this.catalogName = catalogName;
            return this;
        }

        public Builder schemaName(String schemaName) {
            this.schemaName = schemaName;
            return this;
        }

        public Builder primaryKeyIndex(String primaryKeyIndex) {
            this.primaryKeyIndex = primaryKeyIndex;
            return this;
        }

        public Builder relation(String relation, String table) {
            this.relations.put(relation, table);
            return this;
        }

        public Builder relations(Map<String, String> relations) {
            this.relations.putAll(relations);
            return this;
        }

        public CatalogConfig build() {
            return new CatalogConfig(catalogName, schemaName, primaryKeyIndex, relations);
        }
    }
}

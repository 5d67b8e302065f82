package com.schemata.core;

/**
 * A catalog relation that can be queried like an ordinary table, and the record type its rows map to.
 * The physical table behind {@link #name()} is resolved through
 * {@link com.schemata.core.config.CatalogConfig#relationTable(String)}.
 */
public record CatalogRelation<T>(String name, Class<T> rowType) {
    public static final CatalogRelation<ColumnSchema> COLUMNS =
            new CatalogRelation<>("columns", ColumnSchema.class);
    public static final CatalogRelation<IndexSchema> INDEXES =
            new CatalogRelation<>("indexes", IndexSchema.class);
    public static final CatalogRelation<IndexColumnSchema> INDEX_COLUMNS =
            new CatalogRelation<>("index_columns", IndexColumnSchema.class);
}

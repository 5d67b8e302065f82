package com.schemata.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CatalogConfigTest {

    @Test
    void defaultsToUnqualifiedNamespace() {
        CatalogConfig config = CatalogConfig.defaults();
        assertEquals("", config.catalogName());
        assertEquals("", config.schemaName());
        assertEquals("PRIMARY_KEY", config.primaryKeyIndex());
        assertEquals("information_schema.columns", config.relationTable("columns"));
        assertEquals("information_schema.indexes", config.relationTable("indexes"));
        assertEquals("information_schema.index_columns", config.relationTable("index_columns"));
    }

    @Test
    void relationsCanBeRemapped() {
        CatalogConfig config = CatalogConfig.builder()
                .schemaName("app")
                .relation("columns", "catalog_columns")
                .build();

        assertEquals("app", config.schemaName());
        assertEquals("catalog_columns", config.relationTable("columns"));
        assertEquals("information_schema.indexes", config.relationTable("indexes"));
        assertEquals("unmapped", config.relationTable("unmapped"));
    }

    @Test
    void missingRelationsReadByName() {
        CatalogConfig config = new CatalogConfig("", "", "PRIMARY_KEY", null);

        assertEquals("columns", config.relationTable("columns"));
    }
}

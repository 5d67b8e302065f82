package com.schemata.metadata;

import com.schemata.core.CatalogFetcher;
import com.schemata.core.CatalogReadException;
import com.schemata.core.CatalogRelation;
import com.schemata.core.ColumnSchema;
import com.schemata.core.ColumnType;
import com.schemata.core.IndexColumnSchema;
import com.schemata.core.IndexDescriptor;
import com.schemata.core.IndexSchema;
import com.schemata.core.Transaction;
import com.schemata.core.condition.EqualityCondition;
import com.schemata.core.condition.InequalityCondition;
import com.schemata.core.condition.OrderByCondition;
import com.schemata.core.config.CatalogConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the columns, indexes and index-columns catalog relations and folds their rows into per-table maps.
 *
 * <p>Reads issued with the same {@link Transaction} observe one snapshot. Without a transaction each read
 * sees the latest catalog state, so a concurrent schema change between reads can produce a torn view.
 */
public class CatalogReader {
    private static final Logger logger = LoggerFactory.getLogger(CatalogReader.class);

    static final String TABLE_CATALOG = "table_catalog";
    static final String TABLE_SCHEMA = "table_schema";
    static final String ORDINAL_POSITION = "ordinal_position";

    private final CatalogFetcher fetcher;
    private final CatalogConfig config;

    public CatalogReader(CatalogFetcher fetcher, CatalogConfig config) {
        this.fetcher = fetcher;
        this.config = config;
    }

    /**
     * @return table name to column name to column type
     * @throws CatalogReadException if the catalog cannot be read
     */
    public Map<String, Map<String, ColumnType>> readColumns(Transaction transaction) {
        List<ColumnSchema> rows = fetcher.where(CatalogRelation.COLUMNS, transaction, List.of(
                new EqualityCondition(TABLE_CATALOG, config.catalogName()),
                new EqualityCondition(TABLE_SCHEMA, config.schemaName())));

        Map<String, Map<String, ColumnType>> tables = new LinkedHashMap<>();
        for (ColumnSchema row : rows) {
            tables.computeIfAbsent(row.tableName(), t -> new LinkedHashMap<>())
                    .put(row.columnName(), row.type());
        }

        logger.debug("Read {} columns across {} tables", rows.size(), tables.size());
        return tables;
    }

    /**
     * @return table name to index name to index, with each index's key columns in key order
     * @throws CatalogReadException if the catalog cannot be read
     */
    public Map<String, Map<String, IndexDescriptor>> readIndexes(Transaction transaction) {
        // Rows arrive sorted by ordinal position, so appending rebuilds each index's key order.
        // A null position marks a stored column that is not part of the key.
        List<IndexColumnSchema> columnRows = fetcher.where(CatalogRelation.INDEX_COLUMNS, transaction, List.of(
                new EqualityCondition(TABLE_CATALOG, config.catalogName()),
                new EqualityCondition(TABLE_SCHEMA, config.schemaName()),
                InequalityCondition.notNull(ORDINAL_POSITION),
                OrderByCondition.ascending(ORDINAL_POSITION)));

        Map<IndexKey, List<String>> indexColumns = new LinkedHashMap<>();
        for (IndexColumnSchema row : columnRows) {
            indexColumns.computeIfAbsent(new IndexKey(row.tableName(), row.indexName()), k -> new ArrayList<>())
                    .add(row.columnName());
        }

        List<IndexSchema> indexRows = fetcher.where(CatalogRelation.INDEXES, transaction, List.of(
                new EqualityCondition(TABLE_CATALOG, config.catalogName()),
                new EqualityCondition(TABLE_SCHEMA, config.schemaName())));

        Map<String, Map<String, IndexDescriptor>> indexes = new LinkedHashMap<>();
        for (IndexSchema row : indexRows) {
            List<String> columns = indexColumns.getOrDefault(new IndexKey(row.tableName(), row.indexName()), List.of());
            indexes.computeIfAbsent(row.tableName(), t -> new LinkedHashMap<>())
                    .put(row.indexName(), new IndexDescriptor(
                            columns,
                            row.indexType(),
                            row.isUnique(),
                            row.isNullFiltered(),
                            row.indexState(),
                            row.parentTableName()));
        }

        logger.debug("Read {} indexes ({} key columns) across {} tables",
                indexRows.size(), columnRows.size(), indexes.size());
        return indexes;
    }

    private record IndexKey(String table, String index) {}
}

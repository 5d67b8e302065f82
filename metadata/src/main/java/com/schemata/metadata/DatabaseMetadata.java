package com.schemata.metadata;

import com.schemata.core.AdminApi;
import com.schemata.core.CatalogFetcher;
import com.schemata.core.ColumnType;
import com.schemata.core.IndexDescriptor;
import com.schemata.core.ModelDescriptor;
import com.schemata.core.SchemaUpdate;
import com.schemata.core.Transaction;
import com.schemata.core.config.CatalogConfig;

import java.util.Map;

/**
 * Entry point for treating a database's structure as data: read its tables as models and evolve its schema.
 *
 * <p>Nothing is cached. Every call reads the catalog again, so two calls return equal but distinct
 * descriptors.
 */
public class DatabaseMetadata implements ModelSource {
    private final CatalogFetcher fetcher;
    private final CatalogReader reader;
    private final ModelSynthesizer synthesizer;
    private final SchemaChangeApplier applier;

    public DatabaseMetadata(CatalogFetcher fetcher, AdminApi adminApi, CatalogConfig config) {
        this.fetcher = fetcher;
        this.reader = new CatalogReader(fetcher, config);
        this.synthesizer = new ModelSynthesizer(config.primaryKeyIndex());
        this.applier = new SchemaChangeApplier(this, adminApi);
    }

    public DatabaseMetadata(CatalogFetcher fetcher, AdminApi adminApi) {
        this(fetcher, adminApi, CatalogConfig.defaults());
    }

    public Map<String, ModelDescriptor> models() {
        return models(null);
    }

    /**
     * Reads the catalog and builds one descriptor per table. Pass a snapshot from
     * {@link #beginSnapshot()} to read all three catalog relations consistently.
     */
    @Override
    public Map<String, ModelDescriptor> models(Transaction transaction) {
        Map<String, Map<String, ColumnType>> tables = reader.readColumns(transaction);
        Map<String, Map<String, IndexDescriptor>> indexes = reader.readIndexes(transaction);
        return synthesizer.synthesize(tables, indexes);
    }

    public Map<String, Map<String, ColumnType>> tables(Transaction transaction) {
        return reader.readColumns(transaction);
    }

    public Map<String, Map<String, IndexDescriptor>> indexes(Transaction transaction) {
        return reader.readIndexes(transaction);
    }

    public Transaction beginSnapshot() {
        return fetcher.beginSnapshot();
    }

    public SchemaChangeResult columnUpdate(SchemaUpdate update) {
        return applier.applyColumnUpdate(update);
    }

    public SchemaChangeResult createTable(SchemaUpdate update) {
        return applier.applyCreateTableUpdate(update);
    }

    public SchemaChangeResult indexUpdate(SchemaUpdate update) {
        return applier.applyIndexUpdate(update);
    }

    public SchemaChangeResult apply(SchemaUpdate update) {
        return applier.apply(update);
    }

    public SchemaChangeResult apply(SchemaUpdate update, Transaction transaction) {
        return applier.apply(update, transaction);
    }
}

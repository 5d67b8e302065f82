package com.schemata.metadata;

import com.schemata.core.ColumnType;
import com.schemata.core.IndexDescriptor;
import com.schemata.core.MissingPrimaryKeyException;
import com.schemata.core.ModelDescriptor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Builds one {@link ModelDescriptor} per table from the maps produced by a {@link CatalogReader}.
 * Both maps must come from the same read cycle.
 */
public class ModelSynthesizer {
    private final String primaryKeyIndex;

    public ModelSynthesizer(String primaryKeyIndex) {
        this.primaryKeyIndex = primaryKeyIndex;
    }

    /**
     * @return table name to descriptor, sorted by table name
     * @throws MissingPrimaryKeyException if a table has no primary key index
     */
    public Map<String, ModelDescriptor> synthesize(
            Map<String, Map<String, ColumnType>> tables,
            Map<String, Map<String, IndexDescriptor>> indexes) {
        Map<String, ModelDescriptor> models = new TreeMap<>();
        for (Map.Entry<String, Map<String, ColumnType>> entry : tables.entrySet()) {
            String table = entry.getKey();
            Map<String, IndexDescriptor> tableIndexes = indexes.get(table);
            IndexDescriptor primary = tableIndexes == null ? null : tableIndexes.get(primaryKeyIndex);
            if (primary == null) {
                throw new MissingPrimaryKeyException(table, primaryKeyIndex);
            }
            models.put(table, new ModelDescriptor(
                    table, entry.getValue(), primary.columns(), tableIndexes, primaryKeyIndex));
        }
        return models;
    }
}

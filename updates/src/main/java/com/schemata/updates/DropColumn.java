package com.schemata.updates;

import com.schemata.core.ColumnUpdate;
import com.schemata.core.IndexDescriptor;
import com.schemata.core.ModelDescriptor;

import java.util.List;
import java.util.Map;

import static com.schemata.updates.Checks.require;

/**
 * Drops a column that is neither part of the primary key nor a key column of a secondary index.
 */
public record DropColumn(String table, String column) implements ColumnUpdate {

    @Override
    public void validate(ModelDescriptor model) {
        require(model.hasColumn(column), table, "Column " + column + " does not exist on " + table);
        require(!model.primaryIndexKeys().contains(column), table,
                "Column " + column + " is part of the primary key of " + table);
        for (Map.Entry<String, IndexDescriptor> index : model.secondaryIndexes().entrySet()) {
            require(!index.getValue().columns().contains(column), table,
                    "Column " + column + " is used by index " + index.getKey());
        }
    }

    @Override
    public List<String> ddl(ModelDescriptor model) {
        return List.of(DdlTemplates.shared().render("drop_column", Map.of(
                "table", table,
                "column", column)));
    }
}

package com.schemata.updates;

import com.schemata.core.ColumnType;
import com.schemata.core.ColumnUpdate;
import com.schemata.core.ModelDescriptor;

import java.util.List;
import java.util.Map;

import static com.schemata.updates.Checks.columnType;
import static com.schemata.updates.Checks.identifier;
import static com.schemata.updates.Checks.require;

/**
 * Adds a nullable column to an existing table.
 */
public record AddColumn(String table, String column, ColumnType type) implements ColumnUpdate {

    @Override
    public void validate(ModelDescriptor model) {
        identifier(table, "column", column);
        columnType(table, column, type);
        require(!model.hasColumn(column), table, "Column " + column + " already exists on " + table);
        require(type.nullable(), table, "Column " + column + " must be nullable to be added to an existing table");
    }

    @Override
    public List<String> ddl(ModelDescriptor model) {
        return List.of(DdlTemplates.shared().render("add_column", Map.of(
                "table", table,
                "column", column,
                "type", type.ddl())));
    }
}

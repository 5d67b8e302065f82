package com.schemata.updates;

import com.schemata.core.ColumnType;
import com.schemata.core.CreateTableUpdate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.schemata.updates.Checks.columnType;
import static com.schemata.updates.Checks.firstDuplicate;
import static com.schemata.updates.Checks.identifier;
import static com.schemata.updates.Checks.require;

/**
 * Creates a table, optionally interleaved in a parent table.
 *
 * @param interleaveParent parent table, or {@code null} for a top-level table
 */
public record CreateTable(
        String table,
        List<ColumnDefinition> columns,
        List<String> primaryKeys,
        String interleaveParent
) implements CreateTableUpdate {

    public CreateTable {
        columns = columns == null ? List.of() : List.copyOf(columns);
        primaryKeys = primaryKeys == null ? List.of() : List.copyOf(primaryKeys);
    }

    public CreateTable(String table, List<ColumnDefinition> columns, List<String> primaryKeys) {
        this(table, columns, primaryKeys, null);
    }

    public static Builder builder(String table) {
        return new Builder(table);
    }

    @Override
    public void validate() {
        identifier(table, "table", table);
        require(!columns.isEmpty(), table, "Table " + table + " needs at least one column");

        Map<String, ColumnDefinition> byName = new HashMap<>();
        for (ColumnDefinition column : columns) {
            identifier(table, "column", column.name());
            columnType(table, column.name(), column.type());
            byName.put(column.name(), column);
        }
        List<String> names = new ArrayList<>();
        columns.forEach(c -> names.add(c.name()));
        String duplicate = firstDuplicate(names);
        require(duplicate == null, table, "Column " + duplicate + " is defined more than once");

        require(!primaryKeys.isEmpty(), table, "Table " + table + " needs a primary key");
        String duplicateKey = firstDuplicate(primaryKeys);
        require(duplicateKey == null, table, "Primary key column " + duplicateKey + " is listed more than once");
        for (String key : primaryKeys) {
            ColumnDefinition column = byName.get(key);
            require(column != null, table, "Primary key column " + key + " is not defined");
            require(!column.type().isArray(), table, "Primary key column " + key + " cannot be an array");
        }
        if (interleaveParent != null) {
            identifier(table, "parent table", interleaveParent);
        }
    }

    @Override
    public List<String> ddl() {
        List<Map<String, Object>> columnContext = new ArrayList<>();
        for (ColumnDefinition column : columns) {
            columnContext.add(Map.of("name", column.name(), "type", column.type().ddl()));
        }
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("table", table);
        context.put("columns", columnContext);
        context.put("primaryKeys", primaryKeys);
        context.put("parent", interleaveParent);
        return List.of(DdlTemplates.shared().render("create_table", context));
    }

    public static class Builder {
        private final String table;
        private final List<ColumnDefinition> columns = new ArrayList<>();
        private final List<String> primaryKeys = new ArrayList<>();
        private String interleaveParent;

        private Builder(String table) {
            this.table = table;
        }

        public Builder column(String name, ColumnType type) {
            this.columns.add(new ColumnDefinition(name, type));
            return this;
        }

        public Builder primaryKey(String... columns) {
            this.primaryKeys.addAll(List.of(columns));
            return this;
        }

        public Builder interleaveIn(String parent) {
            this.interleaveParent = parent;
            return this;
        }

        public CreateTable build() {
            return new CreateTable(table, columns, primaryKeys, interleaveParent);
        }
    }
}

package com.schemata.updates;

import com.schemata.core.IndexUpdate;
import com.schemata.core.ModelDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.schemata.updates.Checks.firstDuplicate;
import static com.schemata.updates.Checks.identifier;
import static com.schemata.updates.Checks.require;

/**
 * Creates a secondary index over existing columns.
 *
 * @param columns          key columns, in key order
 * @param storing          extra columns stored with the index
 * @param interleaveParent table to interleave the index in, or {@code null}
 */
public record CreateIndex(
        String table,
        String index,
        List<String> columns,
        boolean unique,
        boolean nullFiltered,
        List<String> storing,
        String interleaveParent
) implements IndexUpdate {

    public CreateIndex {
        columns = columns == null ? List.of() : List.copyOf(columns);
        storing = storing == null ? List.of() : List.copyOf(storing);
    }

    public static Builder builder(String table, String index) {
        return new Builder(table, index);
    }

    @Override
    public void validate(ModelDescriptor model) {
        identifier(table, "index", index);
        require(!model.isPrimaryKey(index), table, "Index name " + index + " is reserved for the primary key");
        require(!model.hasIndex(index), table, "Index " + index + " already exists on " + table);
        require(!columns.isEmpty(), table, "Index " + index + " needs at least one column");

        List<String> all = new ArrayList<>(columns);
        all.addAll(storing);
        String duplicate = firstDuplicate(all);
        require(duplicate == null, table, "Column " + duplicate + " is listed more than once in index " + index);
        for (String column : all) {
            require(model.hasColumn(column), table, "Index " + index + " refers to unknown column " + column);
        }
        if (interleaveParent != null) {
            identifier(table, "parent table", interleaveParent);
        }
    }

    @Override
    public List<String> ddl(ModelDescriptor model) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("table", table);
        context.put("index", index);
        context.put("columns", columns);
        context.put("unique", unique);
        context.put("nullFiltered", nullFiltered);
        context.put("storing", storing);
        context.put("parent", interleaveParent);
        return List.of(DdlTemplates.shared().render("create_index", context));
    }

    public static class Builder {
        private final String table;
        private final String index;
        private final List<String> columns = new ArrayList<>();
        private final List<String> storing = new ArrayList<>();
        private boolean unique;
        private boolean nullFiltered;
        private String interleaveParent;

        private Builder(String table, String index) {
            this.table = table;
            this.index = index;
        }

        public Builder column(String... columns) {
            this.columns.addAll(List.of(columns));
            return this;
        }

        public Builder storing(String... columns) {
            this.storing.addAll(List.of(columns));
            return this;
        }

        public Builder unique() {
            this.unique = true;
            return this;
        }

        public Builder nullFiltered() {
            this.nullFiltered = true;
            return this;
        }

        public Builder interleaveIn(String parent) {
            this.interleaveParent = parent;
            return this;
        }

        public CreateIndex build() {
            return new CreateIndex(table, index, columns, unique, nullFiltered, storing, interleaveParent);
        }
    }
}

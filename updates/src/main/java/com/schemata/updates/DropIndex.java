package com.schemata.updates;

import com.schemata.core.IndexUpdate;
import com.schemata.core.ModelDescriptor;

import java.util.List;
import java.util.Map;

import static com.schemata.updates.Checks.require;

/**
 * Drops a secondary index. The primary key index, under whatever name the model carries, cannot be dropped.
 */
public record DropIndex(String table, String index) implements IndexUpdate {

    @Override
    public void validate(ModelDescriptor model) {
        require(!model.isPrimaryKey(index), table, "The primary key of " + table + " cannot be dropped");
        require(model.hasIndex(index), table, "Index " + index + " does not exist on " + table);
    }

    @Override
    public List<String> ddl(ModelDescriptor model) {
        return List.of(DdlTemplates.shared().render("drop_index", Map.of("index", index)));
    }
}

package com.schemata.core;

import java.util.List;

/**
 * Adds, alters or drops a column of an existing table.
 */
public interface ColumnUpdate extends SchemaUpdate {
    /**
     * @throws InvalidSchemaChangeException if the change is not legal for {@code model}
     */
    void validate(ModelDescriptor model);

    List<String> ddl(ModelDescriptor model);
}

package com.schemata.core;

import java.util.List;

/**
 * Creates or drops a secondary index on an existing table.
 */
public interface IndexUpdate extends SchemaUpdate {
    /**
     * @throws InvalidSchemaChangeException if the index definition does not fit {@code model}
     */
    void validate(ModelDescriptor model);

    List<String> ddl(ModelDescriptor model);
}

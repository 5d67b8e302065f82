package com.schemata.core;

import java.util.List;

/**
 * Creates a table that does not exist yet. Validation only checks that the definition is internally
 * consistent.
 */
public interface CreateTableUpdate extends SchemaUpdate {
    /**
     * @throws InvalidSchemaChangeException if the definition is inconsistent
     */
    void validate();

    List<String> ddl();
}

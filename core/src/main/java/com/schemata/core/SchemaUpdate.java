package com.schemata.core;

/**
 * A request to change the schema of one table. Every request is exactly one of {@link ColumnUpdate},
 * {@link CreateTableUpdate} or {@link IndexUpdate}.
 */
public interface SchemaUpdate {
    /**
     * @return the table this change targets
     */
    String table();
}

package com.schemata.core;

/**
 * The catalog lists a table without a primary key index.
 */
public class MissingPrimaryKeyException extends SchemaException {
    public MissingPrimaryKeyException(String table, String primaryKeyIndex) {
        super(table, "Table " + table + " has no " + primaryKeyIndex + " index", null);
    }
}

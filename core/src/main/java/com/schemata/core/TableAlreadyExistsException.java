package com.schemata.core;

public class TableAlreadyExistsException extends SchemaException {
    public TableAlreadyExistsException(String table) {
        super(table, "Table " + table + " already exists", null);
    }
}

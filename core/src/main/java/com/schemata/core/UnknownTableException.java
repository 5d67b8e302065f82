package com.schemata.core;

public class UnknownTableException extends SchemaException {
    public UnknownTableException(String table) {
        super(table, "Table " + table + " does not exist", null);
    }
}

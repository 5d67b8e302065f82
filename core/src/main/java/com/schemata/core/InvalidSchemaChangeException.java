package com.schemata.core;

/**
 * A schema change is unsound relative to the current schema. The message carries the reason.
 */
public class InvalidSchemaChangeException extends SchemaException {
    public InvalidSchemaChangeException(String table, String reason) {
        super(table, reason, null);
    }
}

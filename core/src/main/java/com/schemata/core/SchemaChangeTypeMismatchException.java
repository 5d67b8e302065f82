package com.schemata.core;

/**
 * A schema change was handed to an apply operation for a different kind of change.
 */
public class SchemaChangeTypeMismatchException extends SchemaException {
    public SchemaChangeTypeMismatchException(Class<?> expected, Object actual) {
        super("Expected a " + expected.getSimpleName() + " but got "
                + (actual == null ? "null" : actual.getClass().getName()));
    }
}

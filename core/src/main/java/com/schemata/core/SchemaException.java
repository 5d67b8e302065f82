package com.schemata.core;

/**
 * Base type for every failure raised while reading the catalog or applying a schema change.
 */
public class SchemaException extends RuntimeException {
    private final String table;

    public SchemaException(String message) {
        this(null, message, null);
    }

    public SchemaException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public SchemaException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    /**
     * @return the table this failure concerns, or {@code null} when it is not table specific
     */
    public String table() {
        return table;
    }
}

package com.schemata.core;

/**
 * The catalog fetch primitive failed. Raised unchanged to the caller, never retried.
 */
public class CatalogReadException extends SchemaException {
    public CatalogReadException(String message) {
        super(message);
    }

    public CatalogReadException(String message, Throwable cause) {
        super(message, cause);
    }
}

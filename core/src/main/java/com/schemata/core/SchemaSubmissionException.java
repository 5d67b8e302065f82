package com.schemata.core;

public class SchemaSubmissionException extends SchemaException {
    public SchemaSubmissionException(String message) {
        super(message);
    }

    public SchemaSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}

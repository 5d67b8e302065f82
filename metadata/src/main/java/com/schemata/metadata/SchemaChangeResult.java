package com.schemata.metadata;

import java.util.List;

/**
 * A schema change that was accepted by the admin API.
 */
public record SchemaChangeResult(String table, List<String> ddl, String operationId) {
    public SchemaChangeResult {
        ddl = List.copyOf(ddl);
    }
}

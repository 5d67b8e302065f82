package com.schemata.core;

import java.util.List;

/**
 * Submits DDL to the database's administrative control plane.
 */
public interface AdminApi {

    /**
     * Submits {@code ddl} as one schema update and returns once the database has accepted it.
     *
     * @param ddl         statements, applied in order
     * @param operationId identifier used to track this update, may be {@code null}
     * @throws SchemaSubmissionException if the database rejects the update
     */
    void updateSchema(List<String> ddl, String operationId);

    default void updateSchema(String ddl) {
        updateSchema(List.of(ddl), null);
    }
}

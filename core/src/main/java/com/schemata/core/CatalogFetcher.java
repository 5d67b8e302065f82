package com.schemata.core;

import com.schemata.core.condition.Condition;

import java.util.Arrays;
import java.util.List;

/**
 * Reads rows from a catalog relation.
 */
public interface CatalogFetcher {

    /**
     * Fetches the rows of {@code relation} matching every condition, ordered by any
     * {@link com.schemata.core.condition.OrderByCondition} present.
     *
     * @param relation    the catalog relation to read
     * @param transaction a snapshot from {@link #beginSnapshot()}, or {@code null} to read the latest state
     * @param conditions  predicates and orderings, applied together
     * @return typed rows, in the requested order
     * @throws CatalogReadException if the read fails
     */
    <T> List<T> where(CatalogRelation<T> relation, Transaction transaction, List<Condition> conditions);

    default <T> List<T> where(CatalogRelation<T> relation, Transaction transaction, Condition... conditions) {
        return where(relation, transaction, Arrays.asList(conditions));
    }

    /**
     * Opens a snapshot shared by every read issued with the returned handle.
     */
    Transaction beginSnapshot();
}

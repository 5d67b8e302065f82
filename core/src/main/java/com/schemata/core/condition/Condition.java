package com.schemata.core.condition;

import java.util.List;

/**
 * A predicate or ordering handed to a {@link com.schemata.core.CatalogFetcher}. Conditions are plain data;
 * each fetcher decides how to evaluate them.
 */
public interface Condition {
    /**
     * @return the catalog columns this condition refers to
     */
    List<String> columns();
}

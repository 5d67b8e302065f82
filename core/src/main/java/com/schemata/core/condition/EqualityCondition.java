package com.schemata.core.condition;

import java.util.List;
import java.util.Objects;

/**
 * {@code column = value}. A {@code null} value matches rows where the column is null.
 */
public record EqualityCondition(String column, Object value) implements Condition {
    public EqualityCondition {
        Objects.requireNonNull(column, "column");
    }

    @Override
    public List<String> columns() {
        return List.of(column);
    }
}

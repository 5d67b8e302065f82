package com.schemata.core.condition;

import java.util.List;
import java.util.Objects;

/**
 * {@code column != value}. A {@code null} value means {@code column IS NOT NULL}.
 */
public record InequalityCondition(String column, Object value) implements Condition {
    public InequalityCondition {
        Objects.requireNonNull(column, "column");
    }

    public static InequalityCondition notNull(String column) {
        return new InequalityCondition(column, null);
    }

    @Override
    public List<String> columns() {
        return List.of(column);
    }
}

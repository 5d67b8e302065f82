package com.schemata.core.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Orders fetched rows by one or more columns. Fetchers must honor this ordering exactly; callers fold
 * rows in the order they are returned.
 */
public record OrderByCondition(List<Ordering> orderings) implements Condition {

    public record Ordering(String column, OrderType direction) {
        public Ordering {
            Objects.requireNonNull(column, "column");
            Objects.requireNonNull(direction, "direction");
        }
    }

    public OrderByCondition {
        if (orderings == null || orderings.isEmpty()) {
            throw new IllegalArgumentException("At least one ordering is required");
        }
        orderings = List.copyOf(orderings);
    }

    public static OrderByCondition ascending(String column) {
        return new OrderByCondition(List.of(new Ordering(column, OrderType.ASC)));
    }

    public static OrderByCondition descending(String column) {
        return new OrderByCondition(List.of(new Ordering(column, OrderType.DESC)));
    }

    @Override
    public List<String> columns() {
        List<String> columns = new ArrayList<>();
        for (Ordering ordering : orderings) {
            columns.add(ordering.column());
        }
        return columns;
    }
}

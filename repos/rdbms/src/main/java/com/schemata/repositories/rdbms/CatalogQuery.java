package com.schemata.repositories.rdbms;

import com.schemata.core.CatalogReadException;
import com.schemata.core.condition.Condition;
import com.schemata.core.condition.EqualityCondition;
import com.schemata.core.condition.InequalityCondition;
import com.schemata.core.condition.OrderByCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A parameterized {@code SELECT} over one catalog table.
 */
public record CatalogQuery(String sql, List<Object> parameters) {
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    public CatalogQuery {
        parameters = List.copyOf(parameters);
    }

    public static CatalogQuery of(String table, List<Condition> conditions) {
        checkName(table);
        List<String> predicates = new ArrayList<>();
        List<String> orderings = new ArrayList<>();
        List<Object> parameters = new ArrayList<>();

        for (Condition condition : conditions) {
            condition.columns().forEach(CatalogQuery::checkName);
            if (condition instanceof EqualityCondition) {
                EqualityCondition eq = (EqualityCondition) condition;
                if (eq.value() == null) {
                    predicates.add(eq.column() + " IS NULL");
                } else {
                    predicates.add(eq.column() + " = ?");
                    parameters.add(eq.value());
                }
            } else if (condition instanceof InequalityCondition) {
                InequalityCondition ne = (InequalityCondition) condition;
                if (ne.value() == null) {
                    predicates.add(ne.column() + " IS NOT NULL");
                } else {
                    predicates.add(ne.column() + " != ?");
                    parameters.add(ne.value());
                }
            } else if (condition instanceof OrderByCondition) {
                for (OrderByCondition.Ordering ordering : ((OrderByCondition) condition).orderings()) {
                    orderings.add(ordering.column() + " " + ordering.direction().name());
                }
            } else {
                throw new CatalogReadException("Unsupported condition: " + condition);
            }
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table);
        if (!predicates.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
        if (!orderings.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderings));
        }
        return new CatalogQuery(sql.toString(), parameters);
    }

    private static void checkName(String name) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new CatalogReadException("Invalid catalog identifier: " + name);
        }
    }
}

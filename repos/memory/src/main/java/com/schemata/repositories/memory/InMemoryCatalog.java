package com.schemata.repositories.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemata.core.CatalogFetcher;
import com.schemata.core.CatalogReadException;
import com.schemata.core.CatalogRelation;
import com.schemata.core.ColumnSchema;
import com.schemata.core.IndexColumnSchema;
import com.schemata.core.IndexSchema;
import com.schemata.core.Transaction;
import com.schemata.core.condition.Condition;
import com.schemata.core.condition.EqualityCondition;
import com.schemata.core.condition.InequalityCondition;
import com.schemata.core.condition.OrderByCondition;
import com.schemata.core.condition.OrderType;
import com.schemata.core.config.CatalogConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog held in memory. Conditions are evaluated locally; orderings use a stable sort, so rows that
 * compare equal keep their insertion order.
 */
public class InMemoryCatalog implements CatalogFetcher {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCatalog.class);
    private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() {};

    private final InMemoryStore store;
    private final ObjectMapper objectMapper;
    private final CatalogConfig config;

    public InMemoryCatalog(InMemoryStore store, CatalogConfig config) {
        this.store = store;
        this.config = config;
        this.objectMapper = new ObjectMapper();
    }

    public InMemoryCatalog() {
        this(new InMemoryStore(), CatalogConfig.defaults());
    }

    public <T> InMemoryCatalog insert(CatalogRelation<T> relation, T row) {
        store.add(relation.name(), objectMapper.convertValue(row, ROW));
        return this;
    }

    public InMemoryCatalog insert(String relation, Map<String, Object> row) {
        store.add(relation, row);
        return this;
    }

    /**
     * Adds a column of a user table in the configured namespace.
     */
    public InMemoryCatalog column(String table, String column, String type, boolean nullable) {
        return insert(CatalogRelation.COLUMNS, new ColumnSchema(
                config.catalogName(), config.schemaName(), table, column, null, nullable ? "YES" : "NO", type));
    }

    public InMemoryCatalog index(String table, String index, boolean unique) {
        return insert(CatalogRelation.INDEXES, new IndexSchema(
                config.catalogName(), config.schemaName(), table, index,
                config.primaryKeyIndex().equals(index) ? "PRIMARY_KEY" : "INDEX",
                "", unique, false, config.primaryKeyIndex().equals(index) ? null : "READ_WRITE"));
    }

    /**
     * Adds an index column. A {@code null} position stores the column with the index outside its key.
     */
    public InMemoryCatalog indexColumn(String table, String index, String column, Integer position) {
        return insert(CatalogRelation.INDEX_COLUMNS, new IndexColumnSchema(
                config.catalogName(), config.schemaName(), table, index, column, position,
                position == null ? null : "ASC", null, null));
    }

    /**
     * Adds a table with its columns and a primary key made of {@code keys}, in order.
     */
    public InMemoryCatalog table(String table, Map<String, String> columns, List<String> keys) {
        columns.forEach((column, type) -> column(table, column, type, !keys.contains(column)));
        index(table, config.primaryKeyIndex(), true);
        for (int i = 0; i < keys.size(); i++) {
            indexColumn(table, config.primaryKeyIndex(), keys.get(i), i + 1);
        }
        return this;
    }

    @Override
    public <T> List<T> where(CatalogRelation<T> relation, Transaction transaction, List<Condition> conditions) {
        List<Map<String, Object>> rows = source(relation.name(), transaction);

        List<Map<String, Object>> matched = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (matches(row, conditions)) {
                matched.add(row);
            }
        }

        for (Condition condition : conditions) {
            if (condition instanceof OrderByCondition) {
                // List.sort is stable
                matched.sort(comparator((OrderByCondition) condition));
            }
        }

        logger.debug("Fetched {} of {} rows from {}", matched.size(), rows.size(), relation.name());

        List<T> result = new ArrayList<>(matched.size());
        for (Map<String, Object> row : matched) {
            try {
                result.add(objectMapper.convertValue(row, relation.rowType()));
            } catch (IllegalArgumentException e) {
                throw new CatalogReadException("Malformed " + relation.name() + " row: " + row, e);
            }
        }
        return result;
    }

    @Override
    public Transaction beginSnapshot() {
        return new InMemorySnapshot(store.copy());
    }

    private List<Map<String, Object>> source(String relation, Transaction transaction) {
        if (transaction == null) {
            return store.rows(relation);
        }
        if (!(transaction instanceof InMemorySnapshot)) {
            throw new CatalogReadException("Transaction was not opened by an in-memory catalog: "
                    + transaction.getClass().getName());
        }
        InMemorySnapshot snapshot = (InMemorySnapshot) transaction;
        if (!snapshot.isOpen()) {
            throw new CatalogReadException("Snapshot is closed");
        }
        return snapshot.rows(relation);
    }

    private static boolean matches(Map<String, Object> row, List<Condition> conditions) {
        for (Condition condition : conditions) {
            if (condition instanceof EqualityCondition) {
                EqualityCondition eq = (EqualityCondition) condition;
                if (!same(row.get(eq.column()), eq.value())) {
                    return false;
                }
            } else if (condition instanceof InequalityCondition) {
                InequalityCondition ne = (InequalityCondition) condition;
                Object actual = row.get(ne.column());
                if (ne.value() == null ? actual == null : actual == null || same(actual, ne.value())) {
                    return false;
                }
            } else if (!(condition instanceof OrderByCondition)) {
                throw new CatalogReadException("Unsupported condition: " + condition);
            }
        }
        return true;
    }

    private static boolean same(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return compareNumbers((Number) actual, (Number) expected) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static Comparator<Map<String, Object>> comparator(OrderByCondition orderBy) {
        Comparator<Map<String, Object>> comparator = null;
        for (OrderByCondition.Ordering ordering : orderBy.orderings()) {
            Comparator<Map<String, Object>> next = (a, b) -> compareValues(a.get(ordering.column()), b.get(ordering.column()));
            if (ordering.direction() == OrderType.DESC) {
                next = next.reversed();
            }
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator;
    }

    // Nulls sort first, matching ascending order in the catalog.
    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number) a, (Number) b);
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return ((Comparable) a).compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static int compareNumbers(Number a, Number b) {
        return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
    }
}

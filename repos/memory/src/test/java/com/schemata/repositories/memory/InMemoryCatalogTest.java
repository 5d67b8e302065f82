package com.schemata.repositories.memory;

import com.schemata.core.CatalogReadException;
import com.schemata.core.CatalogRelation;
import com.schemata.core.ColumnSchema;
import com.schemata.core.IndexColumnSchema;
import com.schemata.core.IndexSchema;
import com.schemata.core.Transaction;
import com.schemata.core.condition.EqualityCondition;
import com.schemata.core.condition.InequalityCondition;
import com.schemata.core.condition.OrderByCondition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCatalogTest {

    private final InMemoryCatalog catalog = new InMemoryCatalog();

    private static List<String> columnNames(List<IndexColumnSchema> rows) {
        return rows.stream().map(IndexColumnSchema::columnName).collect(Collectors.toList());
    }

    @Test
    void equalityFiltersRows() {
        catalog.column("Users", "id", "INT64", false)
                .column("Orders", "id", "INT64", false);

        List<ColumnSchema> rows = catalog.where(CatalogRelation.COLUMNS, null,
                new EqualityCondition("table_name", "Orders"));

        assertEquals(1, rows.size());
        assertEquals("Orders", rows.get(0).tableName());
    }

    @Test
    void inequalityWithNullExcludesNulls() {
        catalog.indexColumn("T", "I", "a", 2)
                .indexColumn("T", "I", "b", null)
                .indexColumn("T", "I", "c", 1);

        List<IndexColumnSchema> rows = catalog.where(CatalogRelation.INDEX_COLUMNS, null,
                InequalityCondition.notNull("ordinal_position"));

        assertEquals(List.of("a", "c"), columnNames(rows));
    }

    @Test
    void inequalityWithValueExcludesMatchesAndNulls() {
        catalog.indexColumn("T", "I", "a", 1)
                .indexColumn("T", "I", "b", 2)
                .indexColumn("T", "I", "c", null);

        List<IndexColumnSchema> rows = catalog.where(CatalogRelation.INDEX_COLUMNS, null,
                new InequalityCondition("ordinal_position", 1L));

        assertEquals(List.of("b"), columnNames(rows));
    }

    @Test
    void ordersAscendingAndDescending() {
        catalog.indexColumn("T", "I", "c", 3)
                .indexColumn("T", "I", "a", 1)
                .indexColumn("T", "I", "b", 2);

        assertEquals(List.of("a", "b", "c"), columnNames(catalog.where(CatalogRelation.INDEX_COLUMNS, null,
                OrderByCondition.ascending("ordinal_position"))));
        assertEquals(List.of("c", "b", "a"), columnNames(catalog.where(CatalogRelation.INDEX_COLUMNS, null,
                OrderByCondition.descending("ordinal_position"))));
    }

    @Test
    void orderingIsStableForTies() {
        catalog.indexColumn("T", "I", "first", 1)
                .indexColumn("T", "I", "second", 1)
                .indexColumn("T", "I", "third", 0);

        assertEquals(List.of("third", "first", "second"), columnNames(catalog.where(CatalogRelation.INDEX_COLUMNS,
                null, OrderByCondition.ascending("ordinal_position"))));
    }

    @Test
    void nullsSortFirstAscending() {
        catalog.indexColumn("T", "I", "keyed", 1)
                .indexColumn("T", "I", "stored", null);

        assertEquals(List.of("stored", "keyed"), columnNames(catalog.where(CatalogRelation.INDEX_COLUMNS, null,
                OrderByCondition.ascending("ordinal_position"))));
    }

    @Test
    void typedRowsRoundTripThroughTheStore() {
        IndexSchema index = new IndexSchema("", "", "Users", "ByEmail", "INDEX", "", true, false, "READ_WRITE");
        catalog.insert(CatalogRelation.INDEXES, index);

        assertEquals(List.of(index), catalog.where(CatalogRelation.INDEXES, null, List.of()));
    }

    @Test
    void rawRowsMapToRecords() {
        catalog.insert("columns", Map.of(
                "table_catalog", "",
                "table_schema", "",
                "table_name", "Users",
                "column_name", "id",
                "is_nullable", "NO",
                "spanner_type", "INT64",
                "extra_column", "ignored"));

        ColumnSchema row = catalog.where(CatalogRelation.COLUMNS, null, List.of()).get(0);

        assertEquals("id", row.columnName());
        assertFalse(row.type().nullable());
    }

    @Test
    void snapshotIgnoresLaterWrites() {
        catalog.column("Users", "id", "INT64", false);

        try (Transaction snapshot = catalog.beginSnapshot()) {
            catalog.column("Users", "name", "STRING(MAX)", true);

            assertEquals(1, catalog.where(CatalogRelation.COLUMNS, snapshot, List.of()).size());
            assertEquals(2, catalog.where(CatalogRelation.COLUMNS, null, List.of()).size());
        }
    }

    @Test
    void closedSnapshotCannotBeRead() {
        Transaction snapshot = catalog.beginSnapshot();
        snapshot.close();

        assertFalse(snapshot.isOpen());
        assertThrows(CatalogReadException.class, () -> catalog.where(CatalogRelation.COLUMNS, snapshot, List.of()));
    }

    @Test
    void foreignTransactionIsRejected() {
        Transaction foreign = new Transaction() {
            @Override
            public boolean isOpen() {
                return true;
            }

            @Override
            public void close() {
            }
        };

        assertThrows(CatalogReadException.class, () -> catalog.where(CatalogRelation.COLUMNS, foreign, List.of()));
    }

    @Test
    void tableHelperWritesPrimaryKey() {
        catalog.table("Orders", Map.of("user_id", "INT64", "order_id", "INT64"), List.of("user_id", "order_id"));

        List<IndexColumnSchema> keys = catalog.where(CatalogRelation.INDEX_COLUMNS, null,
                new EqualityCondition("index_name", "PRIMARY_KEY"),
                OrderByCondition.ascending("ordinal_position"));

        assertEquals(List.of("user_id", "order_id"), columnNames(keys));
    }
}

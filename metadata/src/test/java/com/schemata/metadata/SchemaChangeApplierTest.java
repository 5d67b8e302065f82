package com.schemata.metadata;

import com.schemata.core.AdminApi;
import com.schemata.core.ColumnType;
import com.schemata.core.ColumnUpdate;
import com.schemata.core.IndexDescriptor;
import com.schemata.core.InvalidSchemaChangeException;
import com.schemata.core.ModelDescriptor;
import com.schemata.core.SchemaChangeTypeMismatchException;
import com.schemata.core.SchemaSubmissionException;
import com.schemata.core.SchemaUpdate;
import com.schemata.core.TableAlreadyExistsException;
import com.schemata.core.Transaction;
import com.schemata.core.UnknownTableException;
import com.schemata.updates.AddColumn;
import com.schemata.updates.CreateIndex;
import com.schemata.updates.CreateTable;
import com.schemata.updates.DropIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchemaChangeApplierTest {

    @Mock
    private AdminApi adminApi;

    @Mock
    private ModelSource modelSource;

    private SchemaChangeApplier applier;

    private final ModelDescriptor users = new ModelDescriptor(
            "Users",
            Map.of("id", ColumnType.notNull("INT64"), "name", ColumnType.nullable("STRING(MAX)")),
            List.of("id"),
            Map.of("PRIMARY_KEY", new IndexDescriptor(List.of("id"), "PRIMARY_KEY", true, false, null, "")));

    @BeforeEach
    void setUp() {
        applier = new SchemaChangeApplier(modelSource, adminApi);
    }

    private void currentModels() {
        when(modelSource.models(any())).thenReturn(Map.of("Users", users));
    }

    @Test
    void columnUpdateOnUnknownTableSubmitsNothing() {
        currentModels();

        UnknownTableException e = assertThrows(UnknownTableException.class, () -> applier.applyColumnUpdate(
                new AddColumn("Orders", "total", ColumnType.nullable("NUMERIC"))));

        assertEquals("Orders", e.table());
        verifyNoInteractions(adminApi);
    }

    @Test
    void indexUpdateOnUnknownTableSubmitsNothing() {
        currentModels();

        assertThrows(UnknownTableException.class, () -> applier.applyIndexUpdate(
                CreateIndex.builder("Orders", "ByTotal").column("total").build()));

        verifyNoInteractions(adminApi);
    }

    @Test
    void createTableOnExistingTableSubmitsNothing() {
        currentModels();

        TableAlreadyExistsException e = assertThrows(TableAlreadyExistsException.class, () ->
                applier.applyCreateTableUpdate(CreateTable.builder("Users")
                        .column("id", ColumnType.notNull("INT64"))
                        .primaryKey("id")
                        .build()));

        assertEquals("Users", e.table());
        verifyNoInteractions(adminApi);
    }

    @Test
    void wrongVariantFailsBeforeReadingTheCatalog() {
        assertThrows(SchemaChangeTypeMismatchException.class, () -> applier.applyColumnUpdate(
                CreateIndex.builder("Users", "ByName").column("name").build()));
        assertThrows(SchemaChangeTypeMismatchException.class, () -> applier.applyIndexUpdate(
                new AddColumn("Users", "email", ColumnType.nullable("STRING(MAX)"))));
        assertThrows(SchemaChangeTypeMismatchException.class, () -> applier.applyCreateTableUpdate(
                new DropIndex("Users", "ByName")));
        assertThrows(SchemaChangeTypeMismatchException.class, () -> applier.applyColumnUpdate(null));

        verifyNoInteractions(modelSource, adminApi);
    }

    @Test
    void unknownVariantIsRejectedByDispatch() {
        SchemaUpdate unknown = () -> "Users";

        assertThrows(SchemaChangeTypeMismatchException.class, () -> applier.apply(unknown));
        verifyNoInteractions(modelSource, adminApi);
    }

    @Test
    void invalidChangeSubmitsNothing() {
        currentModels();

        InvalidSchemaChangeException e = assertThrows(InvalidSchemaChangeException.class, () ->
                applier.applyColumnUpdate(new AddColumn("Users", "name", ColumnType.nullable("STRING(MAX)"))));

        assertTrue(e.getMessage().contains("already exists"));
        verifyNoInteractions(adminApi);
    }

    @Test
    void submitsColumnDdl() {
        currentModels();

        SchemaChangeResult result = applier.applyColumnUpdate(
                new AddColumn("Users", "email", ColumnType.nullable("STRING(MAX)")));

        assertEquals("Users", result.table());
        assertEquals(List.of("ALTER TABLE Users ADD COLUMN email STRING(MAX)"), result.ddl());
        assertNotNull(result.operationId());
        verify(adminApi).updateSchema(result.ddl(), result.operationId());
    }

    @Test
    void submitsCreateTableDdl() {
        currentModels();

        SchemaChangeResult result = applier.applyCreateTableUpdate(CreateTable.builder("Orders")
                .column("order_id", ColumnType.notNull("INT64"))
                .column("total", ColumnType.nullable("NUMERIC"))
                .primaryKey("order_id")
                .build());

        assertEquals(List.of("CREATE TABLE Orders (order_id INT64 NOT NULL, total NUMERIC) PRIMARY KEY (order_id)"),
                result.ddl());
        verify(adminApi).updateSchema(result.ddl(), result.operationId());
    }

    @Test
    void submitsIndexDdl() {
        currentModels();

        SchemaChangeResult result = applier.applyIndexUpdate(
                CreateIndex.builder("Users", "ByName").column("name").build());

        assertEquals(List.of("CREATE INDEX ByName ON Users (name)"), result.ddl());
        verify(adminApi).updateSchema(result.ddl(), result.operationId());
    }

    @Test
    void dispatchesByVariant() {
        currentModels();

        SchemaChangeResult result = applier.apply(new AddColumn("Users", "email", ColumnType.nullable("STRING(MAX)")));

        assertEquals(List.of("ALTER TABLE Users ADD COLUMN email STRING(MAX)"), result.ddl());
    }

    @Test
    void operationIdsAreUniquePerSubmission() {
        currentModels();

        SchemaChangeResult first = applier.apply(new AddColumn("Users", "a", ColumnType.nullable("INT64")));
        SchemaChangeResult second = applier.apply(new AddColumn("Users", "b", ColumnType.nullable("INT64")));

        assertNotEquals(first.operationId(), second.operationId());
    }

    @Test
    void validatesAgainstTheCurrentDescriptorBeforeRenderingDdl() {
        currentModels();
        ColumnUpdate update = mock(ColumnUpdate.class);
        when(update.table()).thenReturn("Users");
        when(update.ddl(users)).thenReturn(List.of("ALTER TABLE Users DROP COLUMN name"));

        applier.applyColumnUpdate(update);

        InOrder order = inOrder(update, adminApi);
        order.verify(update).validate(users);
        order.verify(update).ddl(users);
        order.verify(adminApi).updateSchema(eq(List.of("ALTER TABLE Users DROP COLUMN name")), anyString());
    }

    @Test
    void readsModelsUnderTheGivenTransaction() {
        Transaction snapshot = mock(Transaction.class);
        when(modelSource.models(snapshot)).thenReturn(Map.of("Users", users));

        applier.apply(new AddColumn("Users", "email", ColumnType.nullable("STRING(MAX)")), snapshot);

        verify(modelSource).models(snapshot);
    }

    @Test
    void submissionFailuresPropagate() {
        currentModels();
        doThrow(new SchemaSubmissionException("rejected")).when(adminApi).updateSchema(anyList(), anyString());

        assertThrows(SchemaSubmissionException.class, () -> applier.applyIndexUpdate(
                CreateIndex.builder("Users", "ByName").column("name").build()));
    }
}

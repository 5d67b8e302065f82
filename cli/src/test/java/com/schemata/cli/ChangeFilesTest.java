package com.schemata.cli;

import com.schemata.core.ColumnType;
import com.schemata.core.SchemaUpdate;
import com.schemata.updates.AddColumn;
import com.schemata.updates.AlterColumn;
import com.schemata.updates.CreateIndex;
import com.schemata.updates.CreateTable;
import com.schemata.updates.DropColumn;
import com.schemata.updates.DropIndex;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeFilesTest {

    @Test
    void readsEveryKindOfChange() throws IOException {
        List<SchemaUpdate> changes;
        try (InputStream in = getClass().getResourceAsStream("/changes/users.json")) {
            changes = ChangeFiles.read(in);
        }

        assertEquals(6, changes.size());
        assertEquals(new AddColumn("Users", "age", ColumnType.nullable("INT64")), changes.get(0));
        assertEquals(new AlterColumn("Users", "name", ColumnType.nullable("BYTES(MAX)")), changes.get(1));
        assertEquals(new DropColumn("Users", "avatar"), changes.get(2));
        assertEquals(CreateTable.builder("Orders")
                .column("user_id", ColumnType.notNull("INT64"))
                .column("order_id", ColumnType.notNull("INT64"))
                .primaryKey("user_id", "order_id")
                .interleaveIn("Users")
                .build(), changes.get(3));
        assertEquals(CreateIndex.builder("Users", "ByNameAge").column("name", "age").unique().build(), changes.get(4));
        assertEquals(new DropIndex("Users", "ByName"), changes.get(5));
    }

    @Test
    void rejectsUnknownKind() {
        String json = "[{\"kind\": \"rename_table\", \"table\": \"Users\"}]";

        assertThrows(InvalidTypeIdException.class,
                () -> ChangeFiles.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }
}

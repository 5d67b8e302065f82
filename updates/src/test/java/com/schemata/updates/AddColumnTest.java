package com.schemata.updates;

import com.schemata.core.ColumnType;
import com.schemata.core.InvalidSchemaChangeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AddColumnTest {

    @Test
    void addsNullableColumn() {
        AddColumn update = new AddColumn("Users", "nickname", ColumnType.nullable("STRING(64)"));

        assertDoesNotThrow(() -> update.validate(Models.users()));
        assertEquals(List.of("ALTER TABLE Users ADD COLUMN nickname STRING(64)"), update.ddl(Models.users()));
    }

    @Test
    void rejectsExistingColumn() {
        AddColumn update = new AddColumn("Users", "name", ColumnType.nullable("STRING(MAX)"));

        InvalidSchemaChangeException e = assertThrows(InvalidSchemaChangeException.class,
                () -> update.validate(Models.users()));
        assertEquals("Users", e.table());
        assertTrue(e.getMessage().contains("already exists"));
    }

    @Test
    void rejectsNotNullColumn() {
        AddColumn update = new AddColumn("Users", "created", ColumnType.notNull("TIMESTAMP"));

        InvalidSchemaChangeException e = assertThrows(InvalidSchemaChangeException.class,
                () -> update.validate(Models.users()));
        assertTrue(e.getMessage().contains("nullable"));
    }

    @Test
    void rejectsBadIdentifier() {
        AddColumn update = new AddColumn("Users", "1st", ColumnType.nullable("INT64"));

        assertThrows(InvalidSchemaChangeException.class, () -> update.validate(Models.users()));
    }

    @Test
    void rejectsTrailingTextAfterType() {
        AddColumn update = new AddColumn("Users", "nickname", ColumnType.nullable("STRING(MAX); DROP TABLE Users"));

        InvalidSchemaChangeException e = assertThrows(InvalidSchemaChangeException.class,
                () -> update.validate(Models.users()));
        assertTrue(e.getMessage().contains("unsupported type"));
    }

    @Test
    void rejectsUnlistedType() {
        assertThrows(InvalidSchemaChangeException.class,
                () -> new AddColumn("Users", "tokens", ColumnType.nullable("TOKENLIST")).validate(Models.users()));
    }

    @Test
    void rejectsMissingType() {
        AddColumn update = new AddColumn("Users", "nickname", null);

        assertThrows(InvalidSchemaChangeException.class, () -> update.validate(Models.users()));
    }
}

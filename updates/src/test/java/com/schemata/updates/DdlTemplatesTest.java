package com.schemata.updates;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DdlTemplatesTest {

    @Test
    void doesNotEscapeTypes() {
        String ddl = new DdlTemplates().render("add_column", Map.of(
                "table", "Users",
                "column", "tags",
                "type", "ARRAY<STRING(MAX)>"));

        assertEquals("ALTER TABLE Users ADD COLUMN tags ARRAY<STRING(MAX)>", ddl);
    }

    @Test
    void failsOnMissingTemplate() {
        assertThrows(RuntimeException.class, () -> new DdlTemplates().render("truncate_table", Map.of()));
    }
}

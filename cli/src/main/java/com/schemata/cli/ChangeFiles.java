package com.schemata.cli;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemata.core.SchemaUpdate;
import com.schemata.updates.AddColumn;
import com.schemata.updates.AlterColumn;
import com.schemata.updates.CreateIndex;
import com.schemata.updates.CreateTable;
import com.schemata.updates.DropColumn;
import com.schemata.updates.DropIndex;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads a JSON array of schema changes. Each element names its change with a {@code kind} field:
 *
 * <pre>
 * [
 *   {"kind": "add_column", "table": "Users", "column": "email", "type": {"type": "STRING(MAX)", "nullable": true}},
 *   {"kind": "create_index", "table": "Users", "index": "ByEmail", "columns": ["email"], "unique": true}
 * ]
 * </pre>
 */
public final class ChangeFiles {
    private static final TypeReference<List<SchemaUpdate>> CHANGES = new TypeReference<>() {};

    private ChangeFiles() {}

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = AddColumn.class, name = "add_column"),
            @JsonSubTypes.Type(value = AlterColumn.class, name = "alter_column"),
            @JsonSubTypes.Type(value = DropColumn.class, name = "drop_column"),
            @JsonSubTypes.Type(value = CreateTable.class, name = "create_table"),
            @JsonSubTypes.Type(value = CreateIndex.class, name = "create_index"),
            @JsonSubTypes.Type(value = DropIndex.class, name = "drop_index")
    })
    interface SchemaUpdateMixin {}

    public static ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.addMixIn(SchemaUpdate.class, SchemaUpdateMixin.class);
        return mapper;
    }

    public static List<SchemaUpdate> read(File file) throws IOException {
        return mapper().readValue(file, CHANGES);
    }

    public static List<SchemaUpdate> read(InputStream in) throws IOException {
        return mapper().readValue(in, CHANGES);
    }
}

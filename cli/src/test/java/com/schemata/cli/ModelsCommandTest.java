package com.schemata.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ModelsCommandTest {

    @TempDir
    Path dir;

    private SqliteDatabase database;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() throws Exception {
        database = new SqliteDatabase(dir);
        out = new StringWriter();
        err = new StringWriter();
        cli = new CommandLine(new SchemataCli());
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    @Test
    void printsModelsAsJson() throws Exception {
        int exitCode = cli.execute(database.args("models"));

        assertEquals(0, exitCode, err.toString());
        JsonNode users = new ObjectMapper().readTree(out.toString()).get("Users");
        assertEquals("Users", users.get("table").asText());
        assertEquals("id", users.get("primaryIndexKeys").get(0).asText());
        assertEquals("INT64", users.get("schema").get("id").get("type").asText());
        assertFalse(users.get("schema").get("id").get("nullable").asBoolean());
        assertEquals("name", users.get("indexes").get("ByName").get("columns").get(0).asText());
    }

    @Test
    void writesModelsToFile() throws Exception {
        Path output = dir.resolve("models.json");

        int exitCode = cli.execute(database.args("models", "--output", output.toString()));

        assertEquals(0, exitCode, err.toString());
        assertTrue(new ObjectMapper().readTree(output.toFile()).has("Users"));
    }

    @Test
    void reportsMissingPrimaryKey() throws Exception {
        database.execute("DELETE FROM catalog_indexes WHERE index_name = 'PRIMARY_KEY'");

        int exitCode = cli.execute(database.args("models"));

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Users"));
    }
}

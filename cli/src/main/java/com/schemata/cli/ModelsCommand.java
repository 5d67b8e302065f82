package com.schemata.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.schemata.core.ModelDescriptor;
import com.schemata.core.SchemaException;
import com.schemata.core.Transaction;
import com.schemata.metadata.DatabaseMetadata;
import com.schemata.repositories.rdbms.JdbcAdminApi;
import com.schemata.repositories.rdbms.JdbcCatalogFetcher;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "models",
        description = "Read the catalog and print one model per table as JSON",
        mixinStandardHelpOptions = true
)
public class ModelsCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ModelsCommand.class);

    @Mixin
    private ConnectionOptions connection;

    @Option(names = {"--output", "-o"}, description = "Output file (default: stdout)")
    private File output;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try (HikariDataSource dataSource = connection.dataSource()) {
            DatabaseMetadata metadata = new DatabaseMetadata(
                    new JdbcCatalogFetcher(dataSource, connection.catalogConfig()),
                    new JdbcAdminApi(dataSource),
                    connection.catalogConfig());

            Map<String, ModelDescriptor> models;
            try (Transaction snapshot = metadata.beginSnapshot()) {
                models = metadata.models(snapshot);
            }
            logger.info("Read {} models from {}", models.size(), connection.jdbcUrl);

            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);

            if (output != null) {
                mapper.writeValue(output, models);
                spec.commandLine().getOut().println("Models written to " + output.getAbsolutePath());
            } else {
                spec.commandLine().getOut().println(mapper.writeValueAsString(models));
            }
            spec.commandLine().getOut().flush();
            return 0;
        } catch (SchemaException | IOException e) {
            logger.error("Failed to read models", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}

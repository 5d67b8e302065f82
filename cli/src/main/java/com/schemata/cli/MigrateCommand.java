package com.schemata.cli;

import com.schemata.core.AdminApi;
import com.schemata.core.SchemaException;
import com.schemata.core.SchemaUpdate;
import com.schemata.metadata.DatabaseMetadata;
import com.schemata.metadata.SchemaChangeResult;
import com.schemata.repositories.memory.RecordingAdminApi;
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
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "migrate",
        description = "Validate and apply the schema changes listed in a JSON file",
        mixinStandardHelpOptions = true
)
public class MigrateCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MigrateCommand.class);

    @Mixin
    private ConnectionOptions connection;

    @Option(names = {"--file", "-f"}, required = true, description = "JSON file with the changes to apply, in order")
    private File file;

    @Option(names = {"--dry-run"}, description = "Validate and print the DDL without executing it")
    private boolean dryRun;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        List<SchemaUpdate> changes;
        try {
            changes = ChangeFiles.read(file);
        } catch (IOException e) {
            logger.error("Failed to read change file {}", file, e);
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return 2;
        }

        try (HikariDataSource dataSource = connection.dataSource()) {
            RecordingAdminApi recorder = new RecordingAdminApi();
            AdminApi adminApi = dryRun ? recorder : new JdbcAdminApi(dataSource);
            DatabaseMetadata metadata = new DatabaseMetadata(
                    new JdbcCatalogFetcher(dataSource, connection.catalogConfig()),
                    adminApi,
                    connection.catalogConfig());

            for (SchemaUpdate change : changes) {
                SchemaChangeResult result = metadata.apply(change);
                out.println((dryRun ? "Validated " : "Applied ")
                        + change.getClass().getSimpleName() + " on " + result.table()
                        + " (" + result.operationId() + ")");
            }

            if (dryRun) {
                for (String statement : recorder.statements()) {
                    out.println(statement + ";");
                }
            }
            out.flush();
            return 0;
        } catch (SchemaException e) {
            logger.error("Migration stopped", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}

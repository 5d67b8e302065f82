package com.schemata.cli;

import com.schemata.core.config.CatalogConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection and catalog options shared by every subcommand.
 */
public class ConnectionOptions {

    @Option(names = {"--jdbc-url"}, required = true, description = "JDBC connection URL")
    String jdbcUrl;

    @Option(names = {"--username", "-u"}, description = "Database username")
    String username;

    @Option(names = {"--password", "-p"}, description = "Database password")
    String password;

    @Option(names = {"--catalog"}, defaultValue = "", description = "table_catalog of user tables (default: empty)")
    String catalog;

    @Option(names = {"--schema", "-s"}, defaultValue = "", description = "table_schema of user tables (default: empty)")
    String schema;

    @Option(names = {"--primary-key-index"}, defaultValue = CatalogConfig.DEFAULT_PRIMARY_KEY_INDEX,
            description = "Name of the primary key index (default: ${DEFAULT-VALUE})")
    String primaryKeyIndex;

    @Option(names = {"--relation"}, description = "Catalog relation to table mapping, e.g. columns=information_schema.columns")
    Map<String, String> relations = new LinkedHashMap<>();

    @Option(names = {"--pool-size"}, defaultValue = "2", description = "Maximum connection pool size")
    int poolSize;

    public CatalogConfig catalogConfig() {
        return CatalogConfig.builder()
                .catalogName(catalog)
                .schemaName(schema)
                .primaryKeyIndex(primaryKeyIndex)
                .relations(relations)
                .build();
    }

    public HikariDataSource dataSource() {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);

        if (username != null) {
            hikariConfig.setUsername(username);
        }
        if (password != null) {
            hikariConfig.setPassword(password);
        }

        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);

        return new HikariDataSource(hikariConfig);
    }
}

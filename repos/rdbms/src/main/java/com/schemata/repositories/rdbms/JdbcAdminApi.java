package com.schemata.repositories.rdbms;

import com.schemata.core.AdminApi;
import com.schemata.core.SchemaSubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Executes DDL statements in order on one connection.
 */
public class JdbcAdminApi implements AdminApi {
    private static final Logger logger = LoggerFactory.getLogger(JdbcAdminApi.class);

    private final DataSource dataSource;

    public JdbcAdminApi(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void updateSchema(List<String> ddl, String operationId) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String statement : ddl) {
                try {
                    stmt.execute(statement);
                } catch (SQLException e) {
                    logger.error("Schema update {} failed at {}: {}", operationId, statement, e.getMessage(), e);
                    throw new SchemaSubmissionException("Failed to apply " + statement, e);
                }
            }
            logger.info("Applied schema update {} ({} statements)", operationId, ddl.size());
        } catch (SQLException e) {
            logger.error("Schema update {} could not connect: {}", operationId, e.getMessage(), e);
            throw new SchemaSubmissionException("Failed to submit schema update " + operationId, e);
        }
    }
}

package com.schemata.repositories.rdbms;

import com.schemata.core.CatalogFetcher;
import com.schemata.core.CatalogReadException;
import com.schemata.core.CatalogRelation;
import com.schemata.core.Transaction;
import com.schemata.core.condition.Condition;
import com.schemata.core.config.CatalogConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static com.schemata.repositories.rdbms.Converters.resultSetToRow;
import static com.schemata.repositories.rdbms.Converters.rowToRecord;

/**
 * Reads catalog relations over JDBC. Ordering is left to the database's {@code ORDER BY}.
 */
public class JdbcCatalogFetcher implements CatalogFetcher {
    private static final Logger logger = LoggerFactory.getLogger(JdbcCatalogFetcher.class);

    private final DataSource dataSource;
    private final CatalogConfig config;

    /**
     * @param dataSource DataSource for database connections
     * @param config     maps catalog relations to the tables that hold them
     */
    public JdbcCatalogFetcher(DataSource dataSource, CatalogConfig config) {
        this.dataSource = dataSource;
        this.config = config;
    }

    @Override
    public <T> List<T> where(CatalogRelation<T> relation, Transaction transaction, List<Condition> conditions) {
        CatalogQuery query = CatalogQuery.of(config.relationTable(relation.name()), conditions);
        if (transaction == null) {
            try (Connection conn = dataSource.getConnection()) {
                return execute(conn, relation, query);
            } catch (SQLException e) {
                logger.error("Error reading {}: {}", relation.name(), e.getMessage(), e);
                throw new CatalogReadException("Failed to read " + relation.name(), e);
            }
        }

        if (!(transaction instanceof JdbcTransaction)) {
            throw new CatalogReadException("Transaction was not opened by a JDBC catalog: "
                    + transaction.getClass().getName());
        }
        JdbcTransaction jdbc = (JdbcTransaction) transaction;
        if (!jdbc.isOpen()) {
            throw new CatalogReadException("Snapshot is closed");
        }
        try {
            return execute(jdbc.connection(), relation, query);
        } catch (SQLException e) {
            logger.error("Error reading {}: {}", relation.name(), e.getMessage(), e);
            throw new CatalogReadException("Failed to read " + relation.name(), e);
        }
    }

    @Override
    public Transaction beginSnapshot() {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            conn.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
            return new JdbcTransaction(conn);
        } catch (SQLException e) {
            if (conn != null) {
                try {
                    conn.close();
                } catch (SQLException closeException) {
                    logger.error("Failed to close connection", closeException);
                }
            }
            throw new CatalogReadException("Failed to open catalog snapshot", e);
        }
    }

    private <T> List<T> execute(Connection conn, CatalogRelation<T> relation, CatalogQuery query) throws SQLException {
        List<T> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(query.sql())) {
            for (int i = 0; i < query.parameters().size(); i++) {
                stmt.setObject(i + 1, query.parameters().get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(rowToRecord(resultSetToRow(rs), relation));
                }
            }
        }
        logger.debug("Fetched {} rows with {}", result.size(), query.sql());
        return result;
    }
}

package com.schemata.repositories.rdbms;

import com.schemata.core.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A read transaction held open on one connection. Closing it rolls back and releases the connection.
 */
public class JdbcTransaction implements Transaction {
    private static final Logger logger = LoggerFactory.getLogger(JdbcTransaction.class);

    private final Connection connection;
    private boolean open = true;

    JdbcTransaction(Connection connection) {
        this.connection = connection;
    }

    Connection connection() {
        return connection;
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    @Override
    public synchronized void close() {
        if (!open) {
            return;
        }
        open = false;
        try {
            connection.rollback();
        } catch (SQLException e) {
            logger.error("Failed to roll back catalog snapshot", e);
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                logger.error("Failed to close connection", e);
            }
        }
    }
}

package com.schoolsync.service;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One connection with explicit commit boundaries. Each record is staged under
 * its own savepoint so that a failing record only discards its own writes;
 * anything not committed when the unit is closed is rolled back.
 */
public final class UnitOfWork implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private final Connection connection;
    private final boolean previousAutoCommit;

    private UnitOfWork(Connection connection) throws SQLException {
        this.connection = connection;
        this.previousAutoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
    }

    public static UnitOfWork begin(DataSource dataSource) throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            return new UnitOfWork(connection);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
    }

    public Connection connection() {
        return connection;
    }

    /**
     * Runs {@code work} under a savepoint. On failure the work is rolled back
     * to the savepoint and the exception is rethrown; earlier staged work in
     * the same unit is kept.
     */
    public <T> T inSavepoint(SqlWork<T> work) throws SQLException {
        Savepoint savepoint = connection.setSavepoint();
        try {
            T result = work.run(connection);
            connection.releaseSavepoint(savepoint);
            return result;
        } catch (SQLException | RuntimeException e) {
            connection.rollback(savepoint);
            throw e;
        }
    }

    public void commit() throws SQLException {
        connection.commit();
    }

    public void rollback() throws SQLException {
        connection.rollback();
    }

    /**
     * Rolls back after a failure that has already been reported; a failing
     * rollback is logged.
     */
    public void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() throws SQLException {
        try {
            connection.rollback();
            connection.setAutoCommit(previousAutoCommit);
        } catch (SQLException e) {
            log.warn("Unable to reset connection before closing: {}", e.getMessage());
            throw e;
        } finally {
            connection.close();
        }
    }
}

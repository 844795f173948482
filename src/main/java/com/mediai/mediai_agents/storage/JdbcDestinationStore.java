package com.mediai.mediai_agents.storage;

import com.mediai.mediai_agents.model.ingest.TableRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collections;
import java.util.List;

/**
 * Writes chunks with one prepared batch insert per chunk on a connection with
 * auto-commit off. Values are bound as text (empty cells as NULL); with PostgreSQL
 * the URL sets {@code stringtype=unspecified} so the server casts them to the column types.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcDestinationStore implements DestinationStore {

    private final DataSource dataSource;

    @Override
    public DestinationConnection open() {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new StorageConnectionException("Cannot connect to destination: " + e.getMessage(), e);
        }
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new StorageConnectionException("Cannot start transaction: " + e.getMessage(), e);
        }
        log.info("Database connection established");
        return new JdbcDestinationConnection(connection);
    }

    static String insertStatement(TableRef table, List<String> columns) {
        for (String column : columns) {
            if (!TableRef.isIdentifier(column)) {
                throw new BatchInsertException("Unsupported column name: '" + column + "'");
            }
        }
        return "INSERT INTO " + table.qualifiedName()
                + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection: {}", e.getMessage());
        }
    }

    @RequiredArgsConstructor
    private static final class JdbcDestinationConnection implements DestinationConnection {

        private final Connection connection;

        @Override
        public void insertBatch(TableRef table, List<String> columns, List<String[]> rows) {
            if (columns.isEmpty()) {
                throw new BatchInsertException("Source has no header columns");
            }
            String sql = insertStatement(table, columns);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                for (String[] row : rows) {
                    if (row.length != columns.size()) {
                        throw new BatchInsertException("Row has " + row.length
                                + " values but the header has " + columns.size() + " columns");
                    }
                    for (int i = 0; i < row.length; i++) {
                        String value = row[i];
                        if (value == null || value.isEmpty()) {
                            statement.setNull(i + 1, Types.VARCHAR);
                        } else {
                            statement.setString(i + 1, value);
                        }
                    }
                    statement.addBatch();
                }
                statement.executeBatch();
                log.debug("Inserted {} rows into {}", rows.size(), table);
            } catch (SQLException e) {
                throw new BatchInsertException("Insert into " + table + " failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void commit() {
            try {
                connection.commit();
            } catch (SQLException e) {
                throw new BatchInsertException("Commit failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void rollback() {
            try {
                connection.rollback();
            } catch (SQLException e) {
                throw new BatchInsertException("Rollback failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            closeQuietly(connection);
            log.info("Database connection closed");
        }
    }
}

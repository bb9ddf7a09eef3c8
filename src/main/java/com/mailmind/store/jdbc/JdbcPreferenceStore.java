package com.mailmind.store.jdbc;

import com.mailmind.exception.StoreException;
import com.mailmind.store.PreferenceStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PreferenceStore} backed by a single key/value table.
 *
 * <p>{@link #set} updates first and inserts when no row matched. Concurrent first
 * writes of the same key are serialized by the caller (the classifier writes a
 * sender's profile under that sender's lock).
 */
public class JdbcPreferenceStore implements PreferenceStore {

    public static final String DEFAULT_TABLE = "mailmind_preference";

    private final DataSource dataSource;
    private final String tableName;

    public JdbcPreferenceStore(DataSource dataSource) {
        this(dataSource, DEFAULT_TABLE);
    }

    public JdbcPreferenceStore(DataSource dataSource, String tableName) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.tableName = JdbcTemplate.validTableName(tableName);
    }

    /**
     * Create the table if it does not exist.
     */
    public void createSchema() {
        try (Connection conn = dataSource.getConnection()) {
            JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS " + tableName + " ("
                    + "pref_key VARCHAR(255) PRIMARY KEY,"
                    + "pref_value VARCHAR(4000) NOT NULL,"
                    + "updated_at TIMESTAMP WITH TIME ZONE NOT NULL"
                    + ")");
        } catch (SQLException e) {
            throw new StoreException("Failed to create preference table " + tableName, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try (Connection conn = dataSource.getConnection()) {
            List<String> rows = JdbcTemplate.query(conn,
                    "SELECT pref_value FROM " + tableName + " WHERE pref_key = ?",
                    rs -> rs.getString(1), key);
            return rows.stream().findFirst();
        } catch (SQLException e) {
            throw new StoreException("Failed to read preference " + key, e);
        }
    }

    @Override
    public void set(String key, String value) {
        OffsetDateTime now = JdbcTemplate.utc(Instant.now());
        try (Connection conn = dataSource.getConnection()) {
            int updated = JdbcTemplate.update(conn,
                    "UPDATE " + tableName + " SET pref_value = ?, updated_at = ? WHERE pref_key = ?",
                    value, now, key);
            if (updated == 0) {
                JdbcTemplate.update(conn,
                        "INSERT INTO " + tableName + " (pref_key, pref_value, updated_at) VALUES (?, ?, ?)",
                        key, value, now);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to write preference " + key, e);
        }
    }
}

package com.mailmind.store.jdbc;

import com.mailmind.exception.StoreException;
import com.mailmind.priority.ClassificationEvent;
import com.mailmind.priority.CorrectionEvent;
import com.mailmind.priority.CorrectionType;
import com.mailmind.priority.Priority;
import com.mailmind.store.ClassificationLog;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link ClassificationLog} stored in two append-only tables.
 */
public class JdbcClassificationLog implements ClassificationLog {

    public static final String CLASSIFICATION_TABLE = "mailmind_classification";
    public static final String CORRECTION_TABLE = "mailmind_correction";

    private static final JdbcTemplate.RowMapper<ClassificationEvent> CLASSIFICATION_ROW_MAPPER = rs -> new ClassificationEvent(
            rs.getString("message_id"),
            rs.getString("sender"),
            Priority.fromLabel(rs.getString("priority")),
            Priority.fromLabel(rs.getString("base_priority")),
            rs.getDouble("confidence"),
            JdbcTemplate.instant(rs, "created_at"));

    private static final JdbcTemplate.RowMapper<CorrectionEvent> CORRECTION_ROW_MAPPER = rs -> new CorrectionEvent(
            rs.getString("message_id"),
            rs.getString("sender"),
            Priority.fromLabel(rs.getString("original_priority")),
            rs.getDouble("original_confidence"),
            Priority.fromLabel(rs.getString("user_priority")),
            rs.getString("reason"),
            CorrectionType.valueOf(rs.getString("correction_type")),
            JdbcTemplate.instant(rs, "created_at"));

    private final DataSource dataSource;

    public JdbcClassificationLog(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Create both tables and their time/sender indexes if they do not exist.
     */
    public void createSchema() {
        try (Connection conn = dataSource.getConnection()) {
            JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS " + CLASSIFICATION_TABLE + " ("
                    + "message_id VARCHAR(255) NOT NULL,"
                    + "sender VARCHAR(320) NOT NULL,"
                    + "priority VARCHAR(16) NOT NULL,"
                    + "base_priority VARCHAR(16) NOT NULL,"
                    + "confidence DOUBLE PRECISION NOT NULL,"
                    + "created_at TIMESTAMP WITH TIME ZONE NOT NULL"
                    + ")");
            JdbcTemplate.execute(conn, "CREATE INDEX IF NOT EXISTS idx_classification_created ON "
                    + CLASSIFICATION_TABLE + " (created_at)");
            JdbcTemplate.execute(conn, "CREATE INDEX IF NOT EXISTS idx_classification_sender ON "
                    + CLASSIFICATION_TABLE + " (sender)");

            JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS " + CORRECTION_TABLE + " ("
                    + "message_id VARCHAR(255) NOT NULL,"
                    + "sender VARCHAR(320) NOT NULL,"
                    + "original_priority VARCHAR(16) NOT NULL,"
                    + "original_confidence DOUBLE PRECISION NOT NULL,"
                    + "user_priority VARCHAR(16) NOT NULL,"
                    + "reason VARCHAR(1000),"
                    + "correction_type VARCHAR(32) NOT NULL,"
                    + "created_at TIMESTAMP WITH TIME ZONE NOT NULL"
                    + ")");
            JdbcTemplate.execute(conn, "CREATE INDEX IF NOT EXISTS idx_correction_created ON "
                    + CORRECTION_TABLE + " (created_at)");
            JdbcTemplate.execute(conn, "CREATE INDEX IF NOT EXISTS idx_correction_sender ON "
                    + CORRECTION_TABLE + " (sender)");
        } catch (SQLException e) {
            throw new StoreException("Failed to create classification log tables", e);
        }
    }

    @Override
    public void appendClassification(ClassificationEvent event) {
        try (Connection conn = dataSource.getConnection()) {
            JdbcTemplate.update(conn, "INSERT INTO " + CLASSIFICATION_TABLE
                            + " (message_id, sender, priority, base_priority, confidence, created_at)"
                            + " VALUES (?, ?, ?, ?, ?, ?)",
                    event.messageId(), event.sender(), event.priority().label(), event.basePriority().label(),
                    event.confidence(), JdbcTemplate.utc(event.timestamp()));
        } catch (SQLException e) {
            throw new StoreException("Failed to append classification for " + event.messageId(), e);
        }
    }

    @Override
    public void appendCorrection(CorrectionEvent event) {
        try (Connection conn = dataSource.getConnection()) {
            JdbcTemplate.update(conn, "INSERT INTO " + CORRECTION_TABLE
                            + " (message_id, sender, original_priority, original_confidence, user_priority,"
                            + " reason, correction_type, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    event.messageId(), event.sender(), event.originalPriority().label(), event.originalConfidence(),
                    event.userPriority().label(), event.reason(), event.correctionType().name(),
                    JdbcTemplate.utc(event.timestamp()));
        } catch (SQLException e) {
            throw new StoreException("Failed to append correction for " + event.messageId(), e);
        }
    }

    @Override
    public long countClassifications(Instant after, Instant until) {
        return countBetween(CLASSIFICATION_TABLE, after, until);
    }

    @Override
    public long countCorrections(Instant after, Instant until) {
        return countBetween(CORRECTION_TABLE, after, until);
    }

    private long countBetween(String table, Instant after, Instant until) {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcTemplate.count(conn,
                    "SELECT COUNT(*) FROM " + table + " WHERE created_at > ? AND created_at <= ?",
                    JdbcTemplate.utc(after), JdbcTemplate.utc(until));
        } catch (SQLException e) {
            throw new StoreException("Failed to count rows in " + table, e);
        }
    }

    @Override
    public List<CorrectionEvent> correctionsForSender(String sender, Instant after, Instant until) {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcTemplate.query(conn, "SELECT * FROM " + CORRECTION_TABLE
                            + " WHERE sender = ? AND created_at > ? AND created_at <= ? ORDER BY created_at",
                    CORRECTION_ROW_MAPPER, sender, JdbcTemplate.utc(after), JdbcTemplate.utc(until));
        } catch (SQLException e) {
            throw new StoreException("Failed to query corrections for " + sender, e);
        }
    }

    @Override
    public List<ClassificationEvent> classificationsForSender(String sender, Instant after, Instant until) {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcTemplate.query(conn, "SELECT * FROM " + CLASSIFICATION_TABLE
                            + " WHERE sender = ? AND created_at > ? AND created_at <= ? ORDER BY created_at",
                    CLASSIFICATION_ROW_MAPPER, sender, JdbcTemplate.utc(after), JdbcTemplate.utc(until));
        } catch (SQLException e) {
            throw new StoreException("Failed to query classifications for " + sender, e);
        }
    }
}

package io.shopsync.jdbc;

import io.shopsync.model.SyncOperation;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.spi.SyncQueueStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * {@link SyncQueueStore} over plain JDBC.
 *
 * <p>An entry is pending while {@code synced = FALSE}, and exhausted once
 * {@code attempts >= max_attempts} as well. FIFO order is {@code created_at}, then id.
 */
public final class JdbcSyncQueueStore implements SyncQueueStore {
  public static final String DEFAULT_TABLE = "sync_queue";
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS = "id, operation_key, table_name, record_id, operation_type, data, " +
      "attempts, max_attempts, synced, error_message, created_at, updated_at";
  private static final String RETRYABLE = "synced=FALSE AND attempts < max_attempts";
  private static final String EXHAUSTED = "synced=FALSE AND attempts >= max_attempts";

  private static final JdbcTemplate.RowMapper<SyncQueueEntry> ENTRY_ROW_MAPPER = rs -> new SyncQueueEntry(
      rs.getString("id"),
      rs.getString("operation_key"),
      rs.getString("table_name"),
      rs.getString("record_id"),
      SyncOperation.valueOf(rs.getString("operation_type")),
      rs.getString("data"),
      rs.getInt("attempts"),
      rs.getInt("max_attempts"),
      rs.getBoolean("synced"),
      rs.getString("error_message"),
      toInstant(rs.getTimestamp("created_at")),
      toInstant(rs.getTimestamp("updated_at")));

  private final String tableName;

  public JdbcSyncQueueStore() {
    this(DEFAULT_TABLE);
  }

  public JdbcSyncQueueStore(String tableName) {
    this.tableName = SqlIdentifiers.require(Objects.requireNonNull(tableName, "tableName"));
  }

  @Override
  public void upsert(Connection conn, SyncQueueEntry entry) {
    String update = "UPDATE " + tableName +
        " SET table_name=?, record_id=?, operation_type=?, data=?, attempts=0, max_attempts=?," +
        " error_message=NULL," +
        " created_at=CASE WHEN synced THEN CAST(? AS TIMESTAMP) ELSE created_at END," +
        " synced=FALSE, updated_at=?" +
        " WHERE operation_key=?";
    int updated = JdbcTemplate.update(conn, update,
        entry.tableName(), entry.recordId(), entry.operation(), entry.data(), entry.maxAttempts(),
        entry.createdAt(), entry.updatedAt(), entry.operationKey());
    if (updated > 0) {
      return;
    }
    String insert = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, insert,
        entry.id(), entry.operationKey(), entry.tableName(), entry.recordId(), entry.operation(),
        entry.data(), entry.attempts(), entry.maxAttempts(), entry.synced(),
        truncateError(entry.errorMessage()), entry.createdAt(), entry.updatedAt());
  }

  @Override
  public List<SyncQueueEntry> pollPending(Connection conn, int limit) {
    return select(conn, RETRYABLE, limit);
  }

  @Override
  public List<SyncQueueEntry> listPending(Connection conn, int limit) {
    return select(conn, "synced=FALSE", limit);
  }

  private List<SyncQueueEntry> select(Connection conn, String condition, int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE " + condition +
        " ORDER BY created_at, id";
    if (limit == 0) {
      return JdbcTemplate.query(conn, sql, ENTRY_ROW_MAPPER);
    }
    return JdbcTemplate.query(conn, sql + " LIMIT ?", ENTRY_ROW_MAPPER, limit);
  }

  @Override
  public Optional<SyncQueueEntry> findByOperationKey(Connection conn, String operationKey) {
    List<SyncQueueEntry> rows = JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE operation_key=?", ENTRY_ROW_MAPPER, operationKey);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public int markCompleted(Connection conn, String id) {
    String sql = "UPDATE " + tableName + " SET synced=TRUE, error_message=NULL, updated_at=?" +
        " WHERE id=? AND synced=FALSE";
    return JdbcTemplate.update(conn, sql, Instant.now(), id);
  }

  @Override
  public int recordFailure(Connection conn, String id, String error) {
    String sql = "UPDATE " + tableName + " SET attempts=attempts+1, error_message=?, updated_at=?" +
        " WHERE id=? AND synced=FALSE";
    return JdbcTemplate.update(conn, sql, truncateError(error), Instant.now(), id);
  }

  @Override
  public int markExhausted(Connection conn, String id, String error) {
    String sql = "UPDATE " + tableName + " SET attempts=max_attempts, error_message=?, updated_at=?" +
        " WHERE id=? AND synced=FALSE";
    return JdbcTemplate.update(conn, sql, truncateError(error), Instant.now(), id);
  }

  @Override
  public int cancel(Connection conn, String operationKey) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tableName + " WHERE operation_key=? AND synced=FALSE", operationKey);
  }

  @Override
  public int countPending(Connection conn) {
    return JdbcTemplate.queryForInt(conn, "SELECT COUNT(*) FROM " + tableName + " WHERE " + RETRYABLE);
  }

  @Override
  public int countPendingFor(Connection conn, String table, Collection<String> recordIds) {
    if (recordIds.isEmpty()) {
      return 0;
    }
    List<Object> params = new ArrayList<>();
    params.add(table);
    StringJoiner marks = new StringJoiner(",", "(", ")");
    for (String recordId : recordIds) {
      marks.add("?");
      params.add(recordId);
    }
    String sql = "SELECT COUNT(*) FROM " + tableName +
        " WHERE synced=FALSE AND table_name=? AND record_id IN " + marks;
    return JdbcTemplate.queryForInt(conn, sql, params.toArray());
  }

  @Override
  public int countExhausted(Connection conn) {
    return JdbcTemplate.queryForInt(conn, "SELECT COUNT(*) FROM " + tableName + " WHERE " + EXHAUSTED);
  }

  @Override
  public int completeExhausted(Connection conn) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET synced=TRUE, updated_at=? WHERE " + EXHAUSTED, Instant.now());
  }

  @Override
  public int clear(Connection conn) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName);
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  private static String truncateError(String error) {
    if (error == null) {
      return null;
    }
    return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
  }
}

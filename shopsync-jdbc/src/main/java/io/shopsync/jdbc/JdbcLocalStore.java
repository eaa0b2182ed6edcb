package io.shopsync.jdbc;

import io.shopsync.LocalStoreException;
import io.shopsync.spi.LocalStore;
import io.shopsync.spi.Row;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link LocalStore} over plain JDBC.
 *
 * <p>SQL text only ever contains validated identifiers; values are bound as parameters.
 * {@link #initialize} runs the classpath script {@value #DEFAULT_SCHEMA}, which must be
 * idempotent ({@code CREATE ... IF NOT EXISTS}).
 */
public final class JdbcLocalStore implements LocalStore {
  private static final Logger logger = Logger.getLogger(JdbcLocalStore.class.getName());

  public static final String DEFAULT_SCHEMA = "io/shopsync/jdbc/schema.sql";

  private final String schemaResource;

  public JdbcLocalStore() {
    this(DEFAULT_SCHEMA);
  }

  /**
   * @param schemaResource classpath location of the schema script
   */
  public JdbcLocalStore(String schemaResource) {
    this.schemaResource = Objects.requireNonNull(schemaResource, "schemaResource");
  }

  @Override
  public void initialize(Connection conn) {
    List<String> statements = SchemaScript.parse(loadSchema());
    try (Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new LocalStoreException("Failed to initialize local schema", e);
    }
    logger.log(Level.FINE, "Applied {0} schema statement(s) from {1}",
        new Object[] {statements.size(), schemaResource});
  }

  private String loadSchema() {
    ClassLoader loader = JdbcLocalStore.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(schemaResource)) {
      if (in == null) {
        throw new LocalStoreException("Schema resource not found: " + schemaResource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new LocalStoreException("Failed to read schema resource " + schemaResource, e);
    }
  }

  @Override
  public void insert(Connection conn, String table, Map<String, ?> values) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Nothing to insert into " + table);
    }
    StringJoiner columns = new StringJoiner(", ");
    StringJoiner marks = new StringJoiner(", ");
    for (String column : values.keySet()) {
      columns.add(SqlIdentifiers.require(column));
      marks.add("?");
    }
    String sql = "INSERT INTO " + SqlIdentifiers.require(table) + " (" + columns + ") VALUES (" + marks + ")";
    JdbcTemplate.update(conn, sql, values.values().toArray());
  }

  @Override
  public int update(Connection conn, String table, String id, Map<String, ?> changes) {
    Objects.requireNonNull(id, "id");
    Map<String, Object> where = new LinkedHashMap<>();
    where.put("id", id);
    return updateWhere(conn, table, where, changes);
  }

  @Override
  public int updateWhere(Connection conn, String table, Map<String, ?> where, Map<String, ?> changes) {
    if (changes.isEmpty()) {
      return 0;
    }
    List<Object> params = new ArrayList<>();
    StringJoiner assignments = new StringJoiner(", ");
    for (Map.Entry<String, ?> change : changes.entrySet()) {
      assignments.add(SqlIdentifiers.require(change.getKey()) + "=?");
      params.add(change.getValue());
    }
    String sql = "UPDATE " + SqlIdentifiers.require(table) + " SET " + assignments + whereClause(where, params);
    return JdbcTemplate.update(conn, sql, params.toArray());
  }

  @Override
  public int delete(Connection conn, String table, String id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + SqlIdentifiers.require(table) + " WHERE id=?", id);
  }

  @Override
  public Optional<Row> findById(Connection conn, String table, String id) {
    List<Row> rows = JdbcTemplate.query(conn,
        "SELECT * FROM " + SqlIdentifiers.require(table) + " WHERE id=?", JdbcLocalStore::toRow, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<Row> find(Connection conn, String table, Map<String, ?> where, String orderBy, int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT * FROM ").append(SqlIdentifiers.require(table))
        .append(whereClause(where, params));
    if (orderBy != null && !orderBy.isBlank()) {
      sql.append(" ORDER BY ").append(SqlIdentifiers.orderBy(orderBy));
    }
    if (limit > 0) {
      sql.append(" LIMIT ?");
      params.add(limit);
    }
    return JdbcTemplate.query(conn, sql.toString(), JdbcLocalStore::toRow, params.toArray());
  }

  @Override
  public int count(Connection conn, String table, Map<String, ?> where) {
    List<Object> params = new ArrayList<>();
    String sql = "SELECT COUNT(*) FROM " + SqlIdentifiers.require(table) + whereClause(where, params);
    return JdbcTemplate.queryForInt(conn, sql, params.toArray());
  }

  @Override
  public void upsert(Connection conn, String table, String keyColumn, Map<String, ?> values) {
    Object key = values.get(keyColumn);
    if (key == null) {
      throw new IllegalArgumentException("Upsert into " + table + " needs a value for " + keyColumn);
    }
    Map<String, Object> changes = new LinkedHashMap<>(values);
    changes.remove(keyColumn);
    Map<String, Object> where = new LinkedHashMap<>();
    where.put(keyColumn, key);
    if (updateWhere(conn, table, where, changes) == 0 && count(conn, table, where) == 0) {
      insert(conn, table, values);
    }
  }

  @Override
  public int clearTable(Connection conn, String table) {
    return JdbcTemplate.update(conn, "DELETE FROM " + SqlIdentifiers.require(table));
  }

  private static String whereClause(Map<String, ?> where, List<Object> params) {
    if (where == null || where.isEmpty()) {
      return "";
    }
    StringJoiner conditions = new StringJoiner(" AND ", " WHERE ", "");
    for (Map.Entry<String, ?> condition : where.entrySet()) {
      String column = SqlIdentifiers.require(condition.getKey());
      if (condition.getValue() == null) {
        conditions.add(column + " IS NULL");
      } else {
        conditions.add(column + "=?");
        params.add(condition.getValue());
      }
    }
    return conditions.toString();
  }

  private static Row toRow(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      Object value = rs.getObject(i);
      if (value instanceof Clob clob) {
        value = clob.getSubString(1, (int) clob.length());
      }
      values.put(meta.getColumnLabel(i), value);
    }
    return new Row(values);
  }
}

package io.shopsync.spi;

import java.sql.Connection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic table access over the local embedded database.
 *
 * <p>Every method takes the caller's {@link Connection}, so several calls can share one
 * transaction (see {@link LocalTransactions}). Table and column names must be plain SQL
 * identifiers; values are always bound as parameters. Every table has a string primary
 * key column named {@code id}.
 *
 * <p>Implementations throw {@link io.shopsync.LocalStoreException} on database failures.
 */
public interface LocalStore {

    /**
     * Creates the schema if it does not exist yet. Safe to call repeatedly.
     */
    void initialize(Connection conn);

    void insert(Connection conn, String table, Map<String, ?> values);

    /**
     * Updates the row with primary key {@code id}. {@code changes} may include {@code id}
     * itself to re-key the row.
     *
     * @return rows affected
     */
    int update(Connection conn, String table, String id, Map<String, ?> changes);

    /**
     * Updates every row matching all {@code where} equalities.
     *
     * @return rows affected
     */
    int updateWhere(Connection conn, String table, Map<String, ?> where, Map<String, ?> changes);

    int delete(Connection conn, String table, String id);

    Optional<Row> findById(Connection conn, String table, String id);

    /**
     * Returns rows matching all {@code where} equalities ({@code null} values match SQL NULL).
     *
     * @param orderBy optional {@code column [ASC|DESC]} list, may be {@code null}
     * @param limit   max rows, or {@code 0} for no limit
     */
    List<Row> find(Connection conn, String table, Map<String, ?> where, String orderBy, int limit);

    default Optional<Row> findOne(Connection conn, String table, Map<String, ?> where) {
        List<Row> rows = find(conn, table, where, null, 1);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    default boolean exists(Connection conn, String table, String id) {
        return findById(conn, table, id).isPresent();
    }

    int count(Connection conn, String table, Map<String, ?> where);

    /**
     * Inserts {@code values}, or updates the existing row whose {@code keyColumn} matches.
     */
    void upsert(Connection conn, String table, String keyColumn, Map<String, ?> values);

    /**
     * Deletes every row of {@code table}.
     *
     * @return rows deleted
     */
    int clearTable(Connection conn, String table);
}

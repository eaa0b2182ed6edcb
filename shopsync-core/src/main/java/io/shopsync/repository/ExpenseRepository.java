package io.shopsync.repository;

import io.shopsync.Identifier;
import io.shopsync.model.AccessScope;
import io.shopsync.model.ExpenseDraft;
import io.shopsync.model.ExpenseRecord;
import io.shopsync.model.IdResolution;
import io.shopsync.spi.LocalStore;
import io.shopsync.spi.Row;

import java.sql.Connection;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Local persistence of expenses. Expenses have no dependents.
 */
public final class ExpenseRepository {
    private final LocalStore store;

    public ExpenseRepository(LocalStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Outcome of {@link #add}: the stored expense and whether this call created it.
     */
    public record AddResult(ExpenseRecord expense, boolean created) {
    }

    /**
     * Inserts the expense. If the draft carries the id of an existing expense, that expense is
     * returned unchanged.
     */
    public AddResult add(Connection conn, ExpenseDraft draft) {
        if (draft.id() != null) {
            Optional<ExpenseRecord> existing = find(conn, draft.id());
            if (existing.isPresent()) {
                return new AddResult(existing.get(), false);
            }
        }
        Identifier id = draft.id() != null ? draft.id() : Identifier.mintTemporary();
        Instant now = Instant.now();
        LocalDate expenseDate = draft.expenseDate() != null ? draft.expenseDate() : LocalDate.now(ZoneOffset.UTC);
        ExpenseRecord expense = new ExpenseRecord(id, RecordMappers.tempIdOf(id), draft.userId(), draft.storeId(),
                draft.category(), draft.description(), draft.amount(), expenseDate, draft.vendor(),
                draft.paymentMethod(), false, now, now);
        store.insert(conn, Tables.EXPENSES, RecordMappers.expenseColumns(expense));
        return new AddResult(expense, true);
    }

    public Optional<ExpenseRecord> find(Connection conn, Identifier id) {
        Optional<Row> row = store.findById(conn, Tables.EXPENSES, id.value());
        if (row.isEmpty() && id instanceof Identifier.Temporary) {
            row = store.findOne(conn, Tables.EXPENSES, Map.of("temp_id", id.value()));
        }
        return row.map(RecordMappers::expense);
    }

    public List<ExpenseRecord> list(Connection conn, AccessScope scope) {
        Map<String, Object> where = new LinkedHashMap<>();
        where.put(scope.filterColumn(), scope.filterValue());
        return store.find(conn, Tables.EXPENSES, where, "expense_date DESC, created_at DESC", 0).stream()
                .map(RecordMappers::expense)
                .toList();
    }

    /**
     * @return the deleted expense, or empty if it did not exist
     */
    public Optional<ExpenseRecord> delete(Connection conn, Identifier id) {
        Optional<ExpenseRecord> existing = find(conn, id);
        existing.ifPresent(expense -> store.delete(conn, Tables.EXPENSES, expense.id().value()));
        return existing;
    }

    public boolean applyResolution(Connection conn, IdResolution resolution) {
        String tempId = resolution.temporary().value();
        if (!store.exists(conn, Tables.EXPENSES, tempId)) {
            return false;
        }
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("id", resolution.persistent().value());
        changes.put("temp_id", tempId);
        changes.put("updated_at", Instant.now());
        store.update(conn, Tables.EXPENSES, tempId, changes);
        return true;
    }

    public boolean markSynced(Connection conn, String id) {
        return store.update(conn, Tables.EXPENSES, id, Map.of("synced", true)) > 0;
    }
}

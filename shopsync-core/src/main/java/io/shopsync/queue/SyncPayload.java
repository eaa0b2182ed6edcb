package io.shopsync.queue;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.shopsync.Identifier;
import io.shopsync.model.ExpenseRecord;
import io.shopsync.model.InventoryChanges;
import io.shopsync.model.InventoryItem;
import io.shopsync.model.SaleLineItem;
import io.shopsync.model.SaleRecord;
import io.shopsync.model.SyncOperation;
import io.shopsync.model.UserProfile;
import io.shopsync.repository.Tables;

import java.util.List;
import java.util.Objects;

/**
 * Data carried by a sync queue entry: everything its handler needs to replay the
 * mutation remotely. Serialized by {@link PayloadCodec} with a {@code type} tag.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SyncPayload.InventoryCreated.class, name = "inventory.created"),
        @JsonSubTypes.Type(value = SyncPayload.InventoryUpdated.class, name = "inventory.updated"),
        @JsonSubTypes.Type(value = SyncPayload.InventoryDeleted.class, name = "inventory.deleted"),
        @JsonSubTypes.Type(value = SyncPayload.SaleCreated.class, name = "sale.created"),
        @JsonSubTypes.Type(value = SyncPayload.ExpenseCreated.class, name = "expense.created"),
        @JsonSubTypes.Type(value = SyncPayload.ExpenseDeleted.class, name = "expense.deleted"),
        @JsonSubTypes.Type(value = SyncPayload.ProfileUpserted.class, name = "profile.upserted")
})
public sealed interface SyncPayload {

    /**
     * Local table the payload belongs to.
     */
    String table();

    SyncOperation operation();

    record InventoryCreated(InventoryItem item) implements SyncPayload {
        public InventoryCreated {
            Objects.requireNonNull(item, "item");
        }

        @Override
        public String table() {
            return Tables.INVENTORY;
        }

        @Override
        public SyncOperation operation() {
            return SyncOperation.INSERT;
        }
    }

    record InventoryUpdated(Identifier itemId, InventoryChanges changes) implements SyncPayload {
        public InventoryUpdated {
            Objects.requireNonNull(itemId, "itemId");
            Objects.requireNonNull(changes, "changes");
        }

        @Override
        public String table() {
            return Tables.INVENTORY;
        }

        @Override
        public SyncOperation operation() {
            return SyncOperation.UPDATE;
        }
    }

    record InventoryDeleted(Identifier itemId) implements SyncPayload {
        public InventoryDeleted {
            Objects.requireNonNull(itemId, "itemId");
        }

        @Override
        public String table() {
            return Tables.INVENTORY;
        }

        @Override
        public SyncOperation operation() {
            return SyncOperation.DELETE;
        }
    }

    record SaleCreated(SaleRecord sale, List<SaleLineItem> lines) implements SyncPayload {
        public SaleCreated {
            Objects.requireNonNull(sale, "sale");
            lines = lines == null ? List.of() : List.copyOf(lines);
        }

        @Override
        public String table() {
            return Tables.SALES;
        }

        @Override
        public SyncOperation operation() {
            return SyncOperation.INSERT;
        }
    }

    record ExpenseCreated(ExpenseRecord expense) implements SyncPayload {
        public ExpenseCreated {
            Objects.requireNonNull(expense, "expense");
        }

        @Override
        public String table() {
            return Tables.EXPENSES;
        }

        @Override
        public SyncOperation operation() {
            return SyncOperation.INSERT;
        }
    }

    record ExpenseDeleted(Identifier expenseId) implements SyncPayload {
        public ExpenseDeleted {
            Objects.requireNonNull(expenseId, "expenseId");
        }

        @Override
        public String table() {
            return Tables.EXPENSES;
        }

        @Override
        public SyncOperation operation() {
            return SyncOperation.DELETE;
        }
    }

    record ProfileUpserted(UserProfile profile) implements SyncPayload {
        public ProfileUpserted {
            Objects.requireNonNull(profile, "profile");
        }

        @Override
        public String table() {
            return Tables.USER_PROFILES;
        }

        @Override
        public SyncOperation operation() {
            return SyncOperation.UPDATE;
        }
    }
}

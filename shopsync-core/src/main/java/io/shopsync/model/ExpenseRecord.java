package io.shopsync.model;

import io.shopsync.Identifier;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

public record ExpenseRecord(
        Identifier id,
        String tempId,
        String userId,
        String storeId,
        String category,
        String description,
        BigDecimal amount,
        LocalDate expenseDate,
        String vendor,
        String paymentMethod,
        boolean synced,
        Instant createdAt,
        Instant updatedAt) {

    public ExpenseRecord {
        Objects.requireNonNull(id, "id");
    }
}

package io.shopsync.model;

import io.shopsync.Identifier;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

public record ExpenseDraft(
        Identifier id,
        String userId,
        String storeId,
        String category,
        String description,
        BigDecimal amount,
        LocalDate expenseDate,
        String vendor,
        String paymentMethod) {

    public ExpenseDraft {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        category = category == null ? "general" : category;
    }
}

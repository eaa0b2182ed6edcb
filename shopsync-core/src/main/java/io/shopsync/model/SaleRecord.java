package io.shopsync.model;

import io.shopsync.Identifier;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Sale header as persisted locally. {@code subtotal} is the sum of the line totals and
 * {@code totalAmount = subtotal + taxAmount - discountAmount}.
 */
public record SaleRecord(
        Identifier id,
        String tempId,
        String userId,
        String storeId,
        BigDecimal subtotal,
        BigDecimal taxAmount,
        BigDecimal discountAmount,
        BigDecimal totalAmount,
        String paymentMethod,
        String paymentStatus,
        String customerName,
        String notes,
        Instant saleDate,
        boolean synced,
        Instant createdAt,
        Instant updatedAt) {

    public SaleRecord {
        Objects.requireNonNull(id, "id");
    }
}

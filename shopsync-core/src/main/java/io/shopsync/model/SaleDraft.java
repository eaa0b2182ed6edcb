package io.shopsync.model;

import io.shopsync.Identifier;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Header fields of a sale about to be recorded.
 *
 * <p>{@code id} is optional. When the caller replays a sale it already submitted it passes the
 * same id, and the repository returns the stored sale instead of recording it twice.
 */
public record SaleDraft(
        Identifier id,
        String userId,
        String storeId,
        BigDecimal taxAmount,
        BigDecimal discountAmount,
        String paymentMethod,
        String paymentStatus,
        String customerName,
        String notes,
        Instant saleDate) {

    public SaleDraft {
        Objects.requireNonNull(userId, "userId");
        taxAmount = taxAmount == null ? BigDecimal.ZERO : taxAmount;
        discountAmount = discountAmount == null ? BigDecimal.ZERO : discountAmount;
        paymentMethod = paymentMethod == null ? "cash" : paymentMethod;
        paymentStatus = paymentStatus == null ? "completed" : paymentStatus;
    }

    public static SaleDraft of(String userId, String storeId) {
        return new SaleDraft(null, userId, storeId, null, null, null, null, null, null, null);
    }

    public SaleDraft withId(Identifier id) {
        return new SaleDraft(id, userId, storeId, taxAmount, discountAmount, paymentMethod,
                paymentStatus, customerName, notes, saleDate);
    }
}

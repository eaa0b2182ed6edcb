package io.shopsync.repository;

import io.shopsync.model.SaleReceipt;

import java.sql.Connection;

/**
 * Runs inside the sale transaction after the sale, its line items and the inventory
 * decrements are written. Throwing rolls the whole sale back.
 */
@FunctionalInterface
public interface SaleWriteHook {

    SaleWriteHook NOOP = (conn, receipt) -> {
    };

    void afterWrite(Connection conn, SaleReceipt receipt);
}

/**
 * Local record tables: inventory, sales with their line items, expenses and user profiles.
 *
 * <p>Repository methods take the caller's {@link java.sql.Connection}; the one exception is
 * {@link io.shopsync.repository.SaleRepository#processSale}, which owns its transaction so it
 * can hold the sale lock around it.
 */
package io.shopsync.repository;

package io.shopsync.repository;

/**
 * Row counts of one local table.
 */
public record TableStats(String table, int total, int unsynced) {
}

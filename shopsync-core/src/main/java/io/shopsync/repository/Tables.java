package io.shopsync.repository;

import java.util.List;

/**
 * Local table names, plus the remote table names that differ from them.
 */
public final class Tables {
    public static final String INVENTORY = "inventory";
    public static final String SALES = "sales";
    public static final String SALE_ITEMS = "sale_items";
    public static final String EXPENSES = "expenses";
    public static final String USER_PROFILES = "user_profiles";
    public static final String SYNC_QUEUE = "sync_queue";

    /** Remote table holding user profiles. */
    public static final String REMOTE_PROFILES = "profiles";

    /**
     * Record tables in deletion order (children first).
     */
    public static final List<String> DATA_TABLES = List.of(SALE_ITEMS, SALES, INVENTORY, EXPENSES, USER_PROFILES);

    private Tables() {}
}

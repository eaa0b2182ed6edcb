package io.shopsync.model;

import java.util.List;

/**
 * Result of recording a sale.
 *
 * @param duplicate {@code true} when the sale id already existed and nothing was written
 */
public record SaleReceipt(SaleRecord sale, List<SaleLineItem> lines, boolean duplicate) {

    public SaleReceipt {
        lines = List.copyOf(lines);
    }
}

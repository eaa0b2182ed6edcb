package io.shopsync.spi;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Row returned by the remote backend.
 */
public record RemoteRecord(String id, Map<String, Object> values) {

    public RemoteRecord {
        Objects.requireNonNull(id, "id");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        return values.get(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public int getInt(String column) {
        Object value = values.get(column);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        return new BigDecimal(value.toString()).intValue();
    }
}

package io.shopsync.spi;

import io.shopsync.Identifier;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of one local store row. Column names are case-insensitive.
 */
public final class Row {
    private final Map<String, Object> values;

    public Row(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(k.toLowerCase(Locale.ROOT), v));
        this.values = Collections.unmodifiableMap(copy);
    }

    public boolean has(String column) {
        return values.containsKey(key(column));
    }

    public Object get(String column) {
        return values.get(key(column));
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    /**
     * Returns the column as an int; {@code null} reads as 0.
     */
    public int getInt(String column) {
        Object value = get(column);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        return Integer.parseInt(value.toString());
    }

    public BigDecimal getDecimal(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal d) {
            return d;
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        return new BigDecimal(value.toString());
    }

    /**
     * Returns the column as a boolean. Numeric columns are {@code true} when non-zero.
     */
    public boolean getBoolean(String column) {
        Object value = get(column);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        return Boolean.parseBoolean(value.toString());
    }

    public Instant getInstant(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp ts) {
            return ts.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return Timestamp.valueOf(ldt).toInstant();
        }
        return Instant.parse(value.toString());
    }

    public LocalDate getLocalDate(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        return LocalDate.parse(value.toString());
    }

    /**
     * Returns the column parsed as an {@link Identifier}, or {@code null} when empty.
     */
    public Identifier getIdentifier(String column) {
        String value = getString(column);
        return value == null || value.isBlank() ? null : Identifier.parse(value);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static String key(String column) {
        return column.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}

package io.shopsync;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Identifier of a syncable record: either minted locally and not yet confirmed by the
 * remote backend ({@link Temporary}), or assigned by the remote backend ({@link Persistent}).
 *
 * <p>The string form is what the local store and the remote backend see. {@link #parse}
 * is the only place that interprets it; everything else switches on the two variants.
 *
 * <pre>{@code
 * Identifier id = Identifier.parse(row.getString("id"));
 * if (id instanceof Identifier.Temporary temp) {
 *     id = resolver.resolve(temp);
 * }
 * }</pre>
 */
public sealed interface Identifier permits Identifier.Temporary, Identifier.Persistent {

    String TEMPORARY_PREFIX = "temp_";

    /**
     * Returns the storage form of this identifier.
     *
     * @return the identifier string
     */
    String value();

    /**
     * Parses the storage form of an identifier.
     *
     * @param value the stored identifier string
     * @return a {@link Temporary} for locally minted ids, otherwise a {@link Persistent}
     * @throws IllegalArgumentException if {@code value} is null or blank
     */
    static Identifier parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be blank");
        }
        return value.startsWith(TEMPORARY_PREFIX) ? new Temporary(value) : new Persistent(value);
    }

    /**
     * Mints a new temporary identifier of the form {@code temp_<epochMillis>_<9 base-36 chars>}.
     *
     * @return a fresh temporary identifier
     */
    static Temporary mintTemporary() {
        StringBuilder suffix = new StringBuilder(9);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 9; i++) {
            suffix.append(Character.forDigit(random.nextInt(36), 36));
        }
        return new Temporary(TEMPORARY_PREFIX + System.currentTimeMillis() + "_" + suffix);
    }

    /**
     * Locally minted identifier that has not been confirmed by the remote backend.
     */
    record Temporary(String value) implements Identifier {
        public Temporary {
            Objects.requireNonNull(value, "value");
            if (!value.startsWith(TEMPORARY_PREFIX)) {
                throw new IllegalArgumentException("Temporary identifier must start with "
                        + TEMPORARY_PREFIX + ": " + value);
            }
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * Identifier assigned by the remote backend; authoritative once assigned.
     */
    record Persistent(String value) implements Identifier {
        public Persistent {
            Objects.requireNonNull(value, "value");
            if (value.isBlank()) {
                throw new IllegalArgumentException("Persistent identifier cannot be blank");
            }
            if (value.startsWith(TEMPORARY_PREFIX)) {
                throw new IllegalArgumentException("Persistent identifier cannot use the temporary prefix: " + value);
            }
        }

        @Override
        public String toString() {
            return value;
        }
    }
}

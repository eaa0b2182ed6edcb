package io.shopsync;

import java.util.Arrays;
import java.util.Objects;
import java.util.Properties;

/**
 * Tunable settings for the sync engine. Mutable, with fluent setters.
 *
 * <p>{@link #fromProperties(Properties)} reads the same settings from {@code shopsync.*} keys:
 * {@code shopsync.batch-size}, {@code shopsync.max-attempts}, {@code shopsync.retry-schedule-ms}
 * (comma separated), {@code shopsync.sale-lock-timeout-ms} and {@code shopsync.drain-on-reconnect}.
 */
public final class SyncConfig {
    static final String PREFIX = "shopsync.";

    private int batchSize = 50;
    private int maxAttempts = 3;
    private long[] retryScheduleMs = {1000L, 2000L, 5000L, 10000L, 30000L};
    private long saleLockTimeoutMs = 100L;
    private boolean drainOnReconnect = true;

    public int getBatchSize() {
        return batchSize;
    }

    public SyncConfig setBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.batchSize = batchSize;
        return this;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public SyncConfig setMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    public long[] getRetryScheduleMs() {
        return retryScheduleMs.clone();
    }

    public SyncConfig setRetryScheduleMs(long... retryScheduleMs) {
        Objects.requireNonNull(retryScheduleMs, "retryScheduleMs");
        if (retryScheduleMs.length == 0) {
            throw new IllegalArgumentException("retryScheduleMs must not be empty");
        }
        for (long delay : retryScheduleMs) {
            if (delay < 0) {
                throw new IllegalArgumentException("retryScheduleMs entries must be >= 0");
            }
        }
        this.retryScheduleMs = retryScheduleMs.clone();
        return this;
    }

    public long getSaleLockTimeoutMs() {
        return saleLockTimeoutMs;
    }

    public SyncConfig setSaleLockTimeoutMs(long saleLockTimeoutMs) {
        if (saleLockTimeoutMs < 0) {
            throw new IllegalArgumentException("saleLockTimeoutMs must be >= 0");
        }
        this.saleLockTimeoutMs = saleLockTimeoutMs;
        return this;
    }

    public boolean isDrainOnReconnect() {
        return drainOnReconnect;
    }

    public SyncConfig setDrainOnReconnect(boolean drainOnReconnect) {
        this.drainOnReconnect = drainOnReconnect;
        return this;
    }

    /**
     * Builds a config from {@code shopsync.*} properties. Missing keys keep their defaults.
     *
     * @param properties source properties
     * @return a new config
     * @throws IllegalArgumentException if a present value cannot be parsed or is out of range
     */
    public static SyncConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        SyncConfig config = new SyncConfig();
        String batchSize = properties.getProperty(PREFIX + "batch-size");
        if (batchSize != null) {
            config.setBatchSize(parseInt("batch-size", batchSize));
        }
        String maxAttempts = properties.getProperty(PREFIX + "max-attempts");
        if (maxAttempts != null) {
            config.setMaxAttempts(parseInt("max-attempts", maxAttempts));
        }
        String schedule = properties.getProperty(PREFIX + "retry-schedule-ms");
        if (schedule != null) {
            String[] parts = schedule.split(",");
            long[] delays = new long[parts.length];
            for (int i = 0; i < parts.length; i++) {
                delays[i] = parseLong("retry-schedule-ms", parts[i]);
            }
            config.setRetryScheduleMs(delays);
        }
        String lockTimeout = properties.getProperty(PREFIX + "sale-lock-timeout-ms");
        if (lockTimeout != null) {
            config.setSaleLockTimeoutMs(parseLong("sale-lock-timeout-ms", lockTimeout));
        }
        String drainOnReconnect = properties.getProperty(PREFIX + "drain-on-reconnect");
        if (drainOnReconnect != null) {
            config.setDrainOnReconnect(Boolean.parseBoolean(drainOnReconnect.trim()));
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + PREFIX + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + PREFIX + key + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "SyncConfig{batchSize=" + batchSize
                + ", maxAttempts=" + maxAttempts
                + ", retryScheduleMs=" + Arrays.toString(retryScheduleMs)
                + ", saleLockTimeoutMs=" + saleLockTimeoutMs
                + ", drainOnReconnect=" + drainOnReconnect + '}';
    }
}

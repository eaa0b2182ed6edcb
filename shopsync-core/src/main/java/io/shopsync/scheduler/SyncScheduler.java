package io.shopsync.scheduler;

import io.shopsync.dispatch.DrainResult;
import io.shopsync.dispatch.SyncDispatcher;
import io.shopsync.spi.ConnectivityListener;
import io.shopsync.spi.ConnectivityMonitor;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs {@link SyncDispatcher#drain()} on a background daemon thread whenever there is a reason
 * to: the device came back online, the scheduler started while online, or a new entry was
 * enqueued while online.
 *
 * <p>After each drain the scheduler decides what comes next. A full batch that made progress
 * is followed by another drain right away; failures with an advisory {@code retryAfter} are
 * retried after that delay. Nothing runs while the monitor reports offline.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see SyncScheduler.Builder
 */
public final class SyncScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(SyncScheduler.class.getName());

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(1);

    private final SyncDispatcher dispatcher;
    private final ConnectivityMonitor connectivity;
    private final boolean drainOnReconnect;
    private final ConnectivityListener listener = this::onConnectivityChanged;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pending;
    private long pendingAtNanos;
    private volatile boolean closed;

    private SyncScheduler(Builder builder) {
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        this.connectivity = builder.connectivity != null ? builder.connectivity : ConnectivityMonitor.ALWAYS_ONLINE;
        this.drainOnReconnect = builder.drainOnReconnect;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts listening for connectivity changes and drains at once if online. Subsequent calls
     * are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("SyncScheduler has been closed");
        }
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "shopsync-sync-" + THREAD_COUNTER.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        connectivity.addListener(listener);
        if (connectivity.isOnline()) {
            schedule(0L);
        }
    }

    public synchronized boolean isStarted() {
        return executor != null && !closed;
    }

    /**
     * Requests a drain as soon as possible. Requests made while a drain is already scheduled
     * are coalesced into it. Ignored while offline or before {@link #start()}.
     */
    public void requestDrain() {
        if (!connectivity.isOnline()) {
            return;
        }
        schedule(0L);
    }

    private void onConnectivityChanged(boolean online) {
        if (online && drainOnReconnect) {
            logger.fine("Back online, scheduling sync");
            schedule(0L);
        }
    }

    /**
     * Schedules a drain after {@code delayMs}, unless one is already due no later than that.
     */
    private synchronized void schedule(long delayMs) {
        if (closed || executor == null) {
            return;
        }
        long dueAt = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs);
        if (pending != null && !pending.isDone()) {
            if (pendingAtNanos - dueAt <= 0) {
                return;
            }
            pending.cancel(false);
        }
        pendingAtNanos = dueAt;
        pending = executor.schedule(this::runDrain, delayMs, TimeUnit.MILLISECONDS);
    }

    private void runDrain() {
        synchronized (this) {
            pending = null;
        }
        if (closed || !connectivity.isOnline()) {
            return;
        }
        try {
            DrainResult result = dispatcher.drain();
            if (result.alreadyInProgress()) {
                return;
            }
            if (result.processed() >= dispatcher.batchSize() && result.succeeded() > 0) {
                schedule(0L);
            } else if (result.retryAfter() != null) {
                Duration delay = result.retryAfter();
                schedule(delay.toMillis());
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Scheduled sync drain failed", t);
        }
    }

    /**
     * Stops listening for connectivity changes and shuts down the drain thread. A drain in
     * progress is allowed to finish its current batch.
     */
    @Override
    public void close() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            connectivity.removeListener(listener);
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            toStop = executor;
        }
        if (toStop != null) {
            toStop.shutdown();
            try {
                if (!toStop.awaitTermination(5, TimeUnit.SECONDS)) {
                    toStop.shutdownNow();
                }
            } catch (InterruptedException e) {
                toStop.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link SyncScheduler}.
     */
    public static final class Builder {
        private SyncDispatcher dispatcher;
        private ConnectivityMonitor connectivity;
        private boolean drainOnReconnect = true;

        private Builder() {
        }

        /**
         * Sets the dispatcher to run.
         *
         * <p><b>Required.</b>
         *
         * @param dispatcher the sync dispatcher
         * @return this builder
         */
        public Builder dispatcher(SyncDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Sets the connectivity monitor gating drains.
         *
         * <p>Optional. Defaults to {@link ConnectivityMonitor#ALWAYS_ONLINE}.
         *
         * @param connectivity the connectivity monitor
         * @return this builder
         */
        public Builder connectivity(ConnectivityMonitor connectivity) {
            this.connectivity = connectivity;
            return this;
        }

        /**
         * Sets whether coming back online triggers a drain.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param drainOnReconnect drain on offline to online transitions
         * @return this builder
         */
        public Builder drainOnReconnect(boolean drainOnReconnect) {
            this.drainOnReconnect = drainOnReconnect;
            return this;
        }

        /**
         * Builds the scheduler. Call {@link SyncScheduler#start()} to begin.
         *
         * @return a new {@link SyncScheduler}
         * @throws NullPointerException if {@code dispatcher} is null
         */
        public SyncScheduler build() {
            return new SyncScheduler(this);
        }
    }
}

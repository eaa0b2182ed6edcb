package io.shopsync.dispatch;

import io.shopsync.model.IdResolution;
import io.shopsync.model.RecordRef;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.queue.MalformedPayloadException;
import io.shopsync.queue.SyncPayload;
import io.shopsync.queue.SyncQueue;
import io.shopsync.registry.HandlerRegistry;
import io.shopsync.repository.RecordRepository;
import io.shopsync.spi.LocalTransactions;
import io.shopsync.spi.MetricsExporter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains the sync queue against the remote backend, one batch per call.
 *
 * <p>Entries are replayed in FIFO order by the handler registered for their table and
 * operation. A successful replay completes the entry in one local transaction together
 * with the identifier resolutions and synced flags the handler reported. A failed replay
 * increments the entry's attempts; once attempts reach the entry's budget it is no longer
 * drained. Undecodable and unroutable entries can never succeed and are exhausted at once.
 *
 * <p>Drains are single-flight: a call made while another drain runs returns immediately
 * with {@link DrainResult#alreadyInProgress()} set.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see SyncDispatcher.Builder
 * @see io.shopsync.scheduler.SyncScheduler
 */
public final class SyncDispatcher {
  private static final Logger logger = Logger.getLogger(SyncDispatcher.class.getName());

  static final String DISPATCHER_ERROR_KEY = "dispatcher";

  private final LocalTransactions transactions;
  private final SyncQueue syncQueue;
  private final RecordRepository records;
  private final HandlerRegistry handlerRegistry;
  private final RetryPolicy retryPolicy;
  private final int batchSize;
  private final MetricsExporter metrics;

  private final AtomicBoolean processing = new AtomicBoolean(false);
  private volatile Instant lastProcessed;

  private SyncDispatcher(Builder builder) {
    this.transactions = Objects.requireNonNull(builder.transactions, "transactions");
    this.syncQueue = Objects.requireNonNull(builder.syncQueue, "syncQueue");
    this.records = Objects.requireNonNull(builder.records, "records");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new BackoffScheduleRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = builder.batchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int batchSize() {
    return batchSize;
  }

  public boolean isProcessing() {
    return processing.get();
  }

  /**
   * Replays up to one batch of pending entries.
   *
   * @return what happened; never {@code null}
   */
  public DrainResult drain() {
    if (!processing.compareAndSet(false, true)) {
      logger.fine("Drain already in progress, skipping");
      return DrainResult.inProgress();
    }
    long started = System.nanoTime();
    try {
      return drainBatch();
    } finally {
      lastProcessed = Instant.now();
      metrics.recordDrainDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
      processing.set(false);
    }
  }

  private DrainResult drainBatch() {
    List<SyncQueueEntry> batch;
    try {
      batch = syncQueue.dequeueBatch(batchSize);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch pending sync operations", e);
      return new DrainResult(0, 0, 0, List.of(new SyncError(DISPATCHER_ERROR_KEY, messageOf(e))), false, null);
    }
    if (batch.isEmpty()) {
      metrics.recordPendingDepth(0);
      return new DrainResult(0, 0, 0, List.of(), false, null);
    }

    int succeeded = 0;
    List<SyncError> errors = new ArrayList<>();
    long retryAfterMs = -1L;
    for (SyncQueueEntry entry : batch) {
      try {
        replay(entry);
        succeeded++;
        metrics.incrementSyncSuccess();
      } catch (MalformedPayloadException | UnroutableOperationException e) {
        errors.add(new SyncError(entry.operationKey(), messageOf(e)));
        exhaust(entry, e);
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        errors.add(new SyncError(entry.operationKey(), messageOf(e)));
        long delayMs = handleFailure(entry, e);
        if (delayMs >= 0 && (retryAfterMs < 0 || delayMs < retryAfterMs)) {
          retryAfterMs = delayMs;
        }
      }
    }

    recordPendingDepth();
    int failed = batch.size() - succeeded;
    DrainResult result = new DrainResult(batch.size(), succeeded, failed, errors, false,
        retryAfterMs < 0 ? null : Duration.ofMillis(retryAfterMs));
    logger.log(failed > 0 ? Level.INFO : Level.FINE, "Drained {0} sync operation(s): {1} succeeded, {2} failed",
        new Object[] {result.processed(), result.succeeded(), result.failed()});
    return result;
  }

  private void replay(SyncQueueEntry entry) throws Exception {
    SyncPayload payload = syncQueue.decode(entry);
    SyncHandler handler = handlerRegistry.handlerFor(entry.tableName(), entry.operation());
    if (handler == null) {
      throw new UnroutableOperationException("No handler for table=" + entry.tableName()
          + ", operation=" + entry.operation());
    }
    SyncOutcome outcome = handler.handle(entry, payload);
    complete(entry, outcome == null ? SyncOutcome.none() : outcome);
  }

  private void complete(SyncQueueEntry entry, SyncOutcome outcome) {
    transactions.inTransaction(conn -> {
      for (IdResolution resolution : outcome.resolutions()) {
        records.applyResolution(conn, resolution);
      }
      if (!syncQueue.completeIfUnchanged(conn, entry)) {
        logger.log(Level.FINE, "Sync operation {0} was re-enqueued while replaying, left pending",
            entry.operationKey());
      }
      for (RecordRef ref : outcome.synced()) {
        Set<String> ids = records.knownIds(conn, ref);
        // a later local change to the same row is still queued
        if (!ids.isEmpty() && !syncQueue.hasPending(conn, ref.table(), ids)) {
          records.markSynced(conn, ref);
        }
      }
      return null;
    });
  }

  private void exhaust(SyncQueueEntry entry, Exception failure) {
    metrics.incrementSyncExhausted();
    logger.log(Level.SEVERE, "Sync operation cannot be replayed, marked exhausted: " + entry.operationKey(), failure);
    try {
      syncQueue.markExhausted(entry.id(), messageOf(failure));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to mark exhausted: " + entry.operationKey(), e);
    }
  }

  /**
   * Records a retryable failure.
   *
   * @return the advisory retry delay, or {@code -1} if the entry is now exhausted
   */
  private long handleFailure(SyncQueueEntry entry, Exception failure) {
    try {
      syncQueue.recordFailure(entry.id(), messageOf(failure));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record failure for " + entry.operationKey(), e);
    }
    int attempts = entry.attempts() + 1;
    if (attempts >= entry.maxAttempts()) {
      metrics.incrementSyncExhausted();
      logger.log(Level.SEVERE, "Sync operation exhausted after " + attempts + " attempt(s): "
          + entry.operationKey(), failure);
      return -1L;
    }
    metrics.incrementSyncFailure();
    long delayMs = retryPolicy.computeDelayMs(entry.attempts());
    logger.log(Level.WARNING, "Sync operation failed (attempt " + attempts + " of " + entry.maxAttempts()
        + "), retry in " + delayMs + " ms: " + entry.operationKey(), failure);
    return delayMs;
  }

  private void recordPendingDepth() {
    try {
      metrics.recordPendingDepth(syncQueue.countPending());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to count pending sync operations", e);
    }
  }

  /**
   * Returns a snapshot of the queue and of this dispatcher.
   */
  public SyncStats stats() {
    int retryable = syncQueue.countPending();
    int exhausted = syncQueue.countExhausted();
    return new SyncStats(retryable + exhausted, exhausted, retryable, processing.get(), lastProcessed);
  }

  /**
   * Marks every exhausted entry completed without replaying it.
   *
   * @return entries cleared
   */
  public int clearFailedOperations() {
    return syncQueue.clearExhausted();
  }

  private static String messageOf(Throwable failure) {
    String message = failure.getMessage();
    return message != null ? message : failure.getClass().getName();
  }

  /**
   * Builder for {@link SyncDispatcher}.
   */
  public static final class Builder {
    private LocalTransactions transactions;
    private SyncQueue syncQueue;
    private RecordRepository records;
    private HandlerRegistry handlerRegistry;
    private RetryPolicy retryPolicy;
    private int batchSize = 50;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Sets the local transaction scope used to complete entries.
     *
     * <p><b>Required.</b>
     *
     * @param transactions the transaction scope
     * @return this builder
     */
    public Builder transactions(LocalTransactions transactions) {
      this.transactions = transactions;
      return this;
    }

    /**
     * Sets the queue to drain.
     *
     * <p><b>Required.</b>
     *
     * @param syncQueue the sync queue
     * @return this builder
     */
    public Builder syncQueue(SyncQueue syncQueue) {
      this.syncQueue = syncQueue;
      return this;
    }

    /**
     * Sets the repository used to apply identifier resolutions and synced flags.
     *
     * <p><b>Required.</b>
     *
     * @param records the record repository
     * @return this builder
     */
    public Builder records(RecordRepository records) {
      this.records = records;
      return this;
    }

    /**
     * Sets the registry that routes entries to handlers.
     *
     * <p><b>Required.</b>
     *
     * @param handlerRegistry the handler registry
     * @return this builder
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets the policy computing the advisory retry delay.
     *
     * <p>Optional. Defaults to {@link BackoffScheduleRetryPolicy} with 1s, 2s, 5s, 10s, 30s.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the maximum number of entries replayed per drain.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
     *
     * @param batchSize max entries per drain
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the dispatcher.
     *
     * @return a new {@link SyncDispatcher}
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if {@code batchSize <= 0}
     */
    public SyncDispatcher build() {
      return new SyncDispatcher(this);
    }
  }
}

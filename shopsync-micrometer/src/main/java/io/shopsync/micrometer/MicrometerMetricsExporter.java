package io.shopsync.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.shopsync.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code shopsync.sync.success} - queue entries replayed successfully</li>
 *   <li>{@code shopsync.sync.failure} - failed replays that will be retried</li>
 *   <li>{@code shopsync.sync.exhausted} - entries that ran out of attempts or failed permanently</li>
 *   <li>{@code shopsync.sale.processed} - sales recorded locally</li>
 *   <li>{@code shopsync.sale.busy} - sales rejected because the sale lock was held</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code shopsync.queue.pending} - entries waiting to be replayed</li>
 *   <li>{@code shopsync.drain.last.ms} - duration of the last drain in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter syncSuccess;
  private final Counter syncFailure;
  private final Counter syncExhausted;
  private final Counter saleProcessed;
  private final Counter saleBusy;
  private final Gauge pendingGauge;
  private final Gauge drainGauge;

  private final AtomicInteger pendingDepth = new AtomicInteger();
  private final AtomicLong lastDrainMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "shopsync"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "shopsync");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "pos.shopsync"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.syncSuccess = Counter.builder(namePrefix + ".sync.success")
        .description("Queue entries replayed successfully")
        .register(registry);
    this.syncFailure = Counter.builder(namePrefix + ".sync.failure")
        .description("Failed replays that will be retried")
        .register(registry);
    this.syncExhausted = Counter.builder(namePrefix + ".sync.exhausted")
        .description("Entries that ran out of attempts or failed permanently")
        .register(registry);
    this.saleProcessed = Counter.builder(namePrefix + ".sale.processed")
        .description("Sales recorded locally")
        .register(registry);
    this.saleBusy = Counter.builder(namePrefix + ".sale.busy")
        .description("Sales rejected because the sale lock was held")
        .register(registry);

    this.pendingGauge = Gauge.builder(namePrefix + ".queue.pending", pendingDepth, AtomicInteger::get)
        .register(registry);
    this.drainGauge = Gauge.builder(namePrefix + ".drain.last.ms", lastDrainMs, AtomicLong::get)
        .register(registry);
  }

  @Override
  public void incrementSyncSuccess() {
    if (closed) return;
    syncSuccess.increment();
  }

  @Override
  public void incrementSyncFailure() {
    if (closed) return;
    syncFailure.increment();
  }

  @Override
  public void incrementSyncExhausted() {
    if (closed) return;
    syncExhausted.increment();
  }

  @Override
  public void recordPendingDepth(int depth) {
    if (closed) return;
    pendingDepth.set(depth);
  }

  @Override
  public void incrementSaleProcessed() {
    if (closed) return;
    saleProcessed.increment();
  }

  @Override
  public void incrementSaleBusy() {
    if (closed) return;
    saleBusy.increment();
  }

  @Override
  public void recordDrainDurationMs(long durationMs) {
    if (closed) return;
    lastDrainMs.set(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(syncSuccess, syncFailure, syncExhausted,
        saleProcessed, saleBusy, pendingGauge, drainGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

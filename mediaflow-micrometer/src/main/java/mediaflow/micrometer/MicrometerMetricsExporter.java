package mediaflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import mediaflow.SubmitResult;
import mediaflow.guard.CircuitState;
import mediaflow.spi.MetricsExporter;
import mediaflow.stage.StageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code <prefix>.submissions}, tag {@code result}: submissions by outcome</li>
 *   <li>{@code <prefix>.stage.jobs}, tags {@code stage} and {@code outcome}
 *       ({@code completed}, {@code retried}, {@code failed})</li>
 *   <li>{@code <prefix>.delivery}, tag {@code outcome} ({@code delivered}, {@code deferred},
 *       {@code recovered}, {@code abandoned})</li>
 *   <li>{@code <prefix>.circuit.opened}: transitions of the breaker into OPEN</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code <prefix>.stage.depth}, tag {@code stage}: jobs waiting in each queue</li>
 *   <li>{@code <prefix>.circuit.state}: 0 closed, 1 open, 2 half-open</li>
 *   <li>{@code <prefix>.stage.duration}, tag {@code stage}: handler run time per job</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final List<Meter> meters = new ArrayList<>();
  private final Map<SubmitResult, Counter> submissions = new EnumMap<>(SubmitResult.class);
  private final Map<StageName, Counter> completed = new EnumMap<>(StageName.class);
  private final Map<StageName, Counter> retried = new EnumMap<>(StageName.class);
  private final Map<StageName, Counter> failed = new EnumMap<>(StageName.class);
  private final Map<StageName, Timer> durations = new EnumMap<>(StageName.class);
  private final Map<StageName, AtomicInteger> depths = new EnumMap<>(StageName.class);
  private final Counter delivered;
  private final Counter deferred;
  private final Counter recovered;
  private final Counter abandoned;
  private final Counter circuitOpened;
  private final AtomicInteger circuitState = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "mediaflow"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "mediaflow");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "chatbot.media"})
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

    for (SubmitResult result : SubmitResult.values()) {
      submissions.put(result, track(Counter.builder(namePrefix + ".submissions")
          .description("Submissions by outcome")
          .tag("result", result.name().toLowerCase(Locale.ROOT))
          .register(registry)));
    }
    for (StageName stage : StageName.values()) {
      completed.put(stage, stageCounter(namePrefix, stage, "completed"));
      retried.put(stage, stageCounter(namePrefix, stage, "retried"));
      failed.put(stage, stageCounter(namePrefix, stage, "failed"));
      durations.put(stage, track(Timer.builder(namePrefix + ".stage.duration")
          .description("Stage handler run time per job")
          .tag("stage", stage.key())
          .register(registry)));
      AtomicInteger depth = new AtomicInteger();
      depths.put(stage, depth);
      track(Gauge.builder(namePrefix + ".stage.depth", depth, AtomicInteger::get)
          .description("Jobs waiting in the stage queue")
          .tag("stage", stage.key())
          .register(registry));
    }
    this.delivered = deliveryCounter(namePrefix, "delivered");
    this.deferred = deliveryCounter(namePrefix, "deferred");
    this.recovered = deliveryCounter(namePrefix, "recovered");
    this.abandoned = deliveryCounter(namePrefix, "abandoned");
    this.circuitOpened = track(Counter.builder(namePrefix + ".circuit.opened")
        .description("Circuit breaker transitions into OPEN")
        .register(registry));
    track(Gauge.builder(namePrefix + ".circuit.state", circuitState, AtomicInteger::get)
        .description("Circuit breaker state: 0 closed, 1 open, 2 half-open")
        .register(registry));
  }

  private Counter stageCounter(String prefix, StageName stage, String outcome) {
    return track(Counter.builder(prefix + ".stage.jobs")
        .description("Stage jobs by outcome")
        .tag("stage", stage.key())
        .tag("outcome", outcome)
        .register(registry));
  }

  private Counter deliveryCounter(String prefix, String outcome) {
    return track(Counter.builder(prefix + ".delivery")
        .description("Outbound messages by outcome")
        .tag("outcome", outcome)
        .register(registry));
  }

  private <M extends Meter> M track(M meter) {
    meters.add(meter);
    return meter;
  }

  @Override
  public void incrementSubmission(SubmitResult result) {
    if (closed) return;
    submissions.get(result).increment();
  }

  @Override
  public void incrementStageCompleted(StageName stage) {
    if (closed) return;
    completed.get(stage).increment();
  }

  @Override
  public void incrementStageRetried(StageName stage) {
    if (closed) return;
    retried.get(stage).increment();
  }

  @Override
  public void incrementStageFailed(StageName stage) {
    if (closed) return;
    failed.get(stage).increment();
  }

  @Override
  public void recordStageDepth(StageName stage, int waiting) {
    if (closed) return;
    depths.get(stage).set(waiting);
  }

  @Override
  public void recordStageDurationMs(StageName stage, long durationMs) {
    if (closed) return;
    durations.get(stage).record(Duration.ofMillis(durationMs));
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementDeliveryDeferred() {
    if (closed) return;
    deferred.increment();
  }

  @Override
  public void incrementNotificationRecovered() {
    if (closed) return;
    recovered.increment();
  }

  @Override
  public void incrementNotificationAbandoned() {
    if (closed) return;
    abandoned.increment();
  }

  @Override
  public void incrementCircuitOpened() {
    if (closed) return;
    circuitOpened.increment();
  }

  @Override
  public void recordCircuitState(CircuitState state) {
    if (closed) return;
    circuitState.set(state.ordinal());
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

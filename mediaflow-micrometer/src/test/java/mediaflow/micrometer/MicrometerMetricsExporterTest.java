package mediaflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import mediaflow.SubmitResult;
import mediaflow.guard.CircuitState;
import mediaflow.stage.StageName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void submissionsAreTaggedByResult() {
    exporter.incrementSubmission(SubmitResult.ACCEPTED);
    exporter.incrementSubmission(SubmitResult.ACCEPTED);
    exporter.incrementSubmission(SubmitResult.DUPLICATE);

    assertEquals(2.0, registry.get("mediaflow.submissions").tag("result", "accepted").counter().count());
    assertEquals(1.0, registry.get("mediaflow.submissions").tag("result", "duplicate").counter().count());
    assertEquals(0.0, registry.get("mediaflow.submissions").tag("result", "rejected").counter().count());
  }

  @Test
  void stageOutcomesAreSeparated() {
    exporter.incrementStageCompleted(StageName.UPLOAD);
    exporter.incrementStageRetried(StageName.UPLOAD);
    exporter.incrementStageRetried(StageName.UPLOAD);
    exporter.incrementStageFailed(StageName.ANALYSIS);

    assertEquals(1.0, stageJobs("upload", "completed").count());
    assertEquals(2.0, stageJobs("upload", "retried").count());
    assertEquals(1.0, stageJobs("analysis", "failed").count());
    assertEquals(0.0, stageJobs("processingCheck", "completed").count());
  }

  @Test
  void stageDepthGaugeFollowsLatestValue() {
    exporter.recordStageDepth(StageName.PROCESSING_CHECK, 7);
    assertEquals(7.0, depth("processingCheck").value());

    exporter.recordStageDepth(StageName.PROCESSING_CHECK, 0);
    assertEquals(0.0, depth("processingCheck").value());
  }

  @Test
  void stageDurationsAreTimed() {
    exporter.recordStageDurationMs(StageName.ANALYSIS, 250);
    exporter.recordStageDurationMs(StageName.ANALYSIS, 750);

    assertEquals(2L, registry.get("mediaflow.stage.duration").tag("stage", "analysis").timer().count());
  }

  @Test
  void deliveryOutcomes() {
    exporter.incrementDelivered();
    exporter.incrementDeliveryDeferred();
    exporter.incrementNotificationRecovered();
    exporter.incrementNotificationAbandoned();
    exporter.incrementNotificationAbandoned();

    assertEquals(1.0, delivery("delivered").count());
    assertEquals(1.0, delivery("deferred").count());
    assertEquals(1.0, delivery("recovered").count());
    assertEquals(2.0, delivery("abandoned").count());
  }

  @Test
  void circuitMetrics() {
    exporter.incrementCircuitOpened();
    exporter.recordCircuitState(CircuitState.OPEN);

    assertEquals(1.0, registry.get("mediaflow.circuit.opened").counter().count());
    assertEquals(1.0, registry.get("mediaflow.circuit.state").gauge().value());

    exporter.recordCircuitState(CircuitState.HALF_OPEN);
    assertEquals(2.0, registry.get("mediaflow.circuit.state").gauge().value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry other = new SimpleMeterRegistry();
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(other, "bot.media");
    custom.incrementDelivered();

    assertEquals(1.0, other.get("bot.media.delivery").tag("outcome", "delivered").counter().count());
    assertNull(other.find("mediaflow.delivery").counter());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "media."));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.incrementDelivered();
    exporter.recordStageDepth(StageName.UPLOAD, 3);
    assertNull(registry.find("mediaflow.delivery").counter());
  }

  private Counter stageJobs(String stage, String outcome) {
    return registry.get("mediaflow.stage.jobs").tag("stage", stage).tag("outcome", outcome).counter();
  }

  private Gauge depth(String stage) {
    return registry.get("mediaflow.stage.depth").tag("stage", stage).gauge();
  }

  private Counter delivery(String outcome) {
    return registry.get("mediaflow.delivery").tag("outcome", outcome).counter();
  }
}

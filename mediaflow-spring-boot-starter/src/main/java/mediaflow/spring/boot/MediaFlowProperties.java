package mediaflow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the media pipeline.
 *
 * @see MediaFlowAutoConfiguration
 */
@ConfigurationProperties(prefix = "mediaflow")
public class MediaFlowProperties {

  /**
   * Table holding transaction records.
   */
  private String transactionTable = "media_transaction";

  /**
   * Table holding transaction history entries.
   */
  private String historyTable = "transaction_history";

  /**
   * Table holding pending and abandoned notifications.
   */
  private String notificationTable = "pending_notification";

  /**
   * Directory receiving files blocked by content safety. Unset disables archiving.
   */
  private String auditDirectory;

  private final Stages stages = new Stages();
  private final ProcessingCheck processingCheck = new ProcessingCheck();
  private final Analysis analysis = new Analysis();
  private final Dedup dedup = new Dedup();
  private final CircuitBreaker circuitBreaker = new CircuitBreaker();
  private final ModelCache modelCache = new ModelCache();
  private final Notifications notifications = new Notifications();
  private final Retention retention = new Retention();
  private final Recovery recovery = new Recovery();
  private final Metrics metrics = new Metrics();

  public String getTransactionTable() {
    return transactionTable;
  }

  public void setTransactionTable(String transactionTable) {
    this.transactionTable = transactionTable;
  }

  public String getHistoryTable() {
    return historyTable;
  }

  public void setHistoryTable(String historyTable) {
    this.historyTable = historyTable;
  }

  public String getNotificationTable() {
    return notificationTable;
  }

  public void setNotificationTable(String notificationTable) {
    this.notificationTable = notificationTable;
  }

  public String getAuditDirectory() {
    return auditDirectory;
  }

  public void setAuditDirectory(String auditDirectory) {
    this.auditDirectory = auditDirectory;
  }

  public Stages getStages() {
    return stages;
  }

  public ProcessingCheck getProcessingCheck() {
    return processingCheck;
  }

  public Analysis getAnalysis() {
    return analysis;
  }

  public Dedup getDedup() {
    return dedup;
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  public ModelCache getModelCache() {
    return modelCache;
  }

  public Notifications getNotifications() {
    return notifications;
  }

  public Retention getRetention() {
    return retention;
  }

  public Recovery getRecovery() {
    return recovery;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Stages {
    private int workerCount = 3;
    private int queueCapacity = 1000;
    private int maxAttempts = 3;
    private Duration baseDelay = Duration.ofSeconds(30);
    private Duration maxDelay = Duration.ofMinutes(5);
    private long drainTimeoutMs = 5000;
    private int permanentFailureThreshold = 3;

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }

    public int getPermanentFailureThreshold() {
      return permanentFailureThreshold;
    }

    public void setPermanentFailureThreshold(int permanentFailureThreshold) {
      this.permanentFailureThreshold = permanentFailureThreshold;
    }
  }

  public static class ProcessingCheck {
    private Duration baseDelay = Duration.ofSeconds(2);
    private Duration maxDelay = Duration.ofSeconds(30);
    private Duration progressInterval = Duration.ofSeconds(20);
    private int slowNoticeAt = 5;
    private Duration maxElapsed = Duration.ofSeconds(120);
    private int minChecksForElapsed = 3;
    private int maxChecks = 12;

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public Duration getProgressInterval() {
      return progressInterval;
    }

    public void setProgressInterval(Duration progressInterval) {
      this.progressInterval = progressInterval;
    }

    public int getSlowNoticeAt() {
      return slowNoticeAt;
    }

    public void setSlowNoticeAt(int slowNoticeAt) {
      this.slowNoticeAt = slowNoticeAt;
    }

    public Duration getMaxElapsed() {
      return maxElapsed;
    }

    public void setMaxElapsed(Duration maxElapsed) {
      this.maxElapsed = maxElapsed;
    }

    public int getMinChecksForElapsed() {
      return minChecksForElapsed;
    }

    public void setMinChecksForElapsed(int minChecksForElapsed) {
      this.minChecksForElapsed = minChecksForElapsed;
    }

    public int getMaxChecks() {
      return maxChecks;
    }

    public void setMaxChecks(int maxChecks) {
      this.maxChecks = maxChecks;
    }
  }

  public static class Analysis {
    private Duration uploadTimeout = Duration.ofSeconds(120);
    private Duration videoTimeout = Duration.ofSeconds(120);
    private Duration imageTimeout = Duration.ofSeconds(45);

    public Duration getUploadTimeout() {
      return uploadTimeout;
    }

    public void setUploadTimeout(Duration uploadTimeout) {
      this.uploadTimeout = uploadTimeout;
    }

    public Duration getVideoTimeout() {
      return videoTimeout;
    }

    public void setVideoTimeout(Duration videoTimeout) {
      this.videoTimeout = videoTimeout;
    }

    public Duration getImageTimeout() {
      return imageTimeout;
    }

    public void setImageTimeout(Duration imageTimeout) {
      this.imageTimeout = imageTimeout;
    }
  }

  public static class Dedup {
    private Duration window = Duration.ofMinutes(15);
    private Duration sweepInterval = Duration.ofMinutes(1);

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }

    public Duration getSweepInterval() {
      return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
    }
  }

  public static class CircuitBreaker {
    private int failureLimit = 5;
    private Duration resetWindow = Duration.ofSeconds(60);

    public int getFailureLimit() {
      return failureLimit;
    }

    public void setFailureLimit(int failureLimit) {
      this.failureLimit = failureLimit;
    }

    public Duration getResetWindow() {
      return resetWindow;
    }

    public void setResetWindow(Duration resetWindow) {
      this.resetWindow = resetWindow;
    }
  }

  public static class ModelCache {
    private int maxSize = 10;

    public int getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(int maxSize) {
      this.maxSize = maxSize;
    }
  }

  public static class Notifications {
    private Duration sweepInterval = Duration.ofSeconds(30);
    private int batchSize = 50;
    private int maxAttempts = 5;
    private Duration skipRecent = Duration.ofSeconds(5);

    public Duration getSweepInterval() {
      return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getSkipRecent() {
      return skipRecent;
    }

    public void setSkipRecent(Duration skipRecent) {
      this.skipRecent = skipRecent;
    }
  }

  public static class Retention {
    private boolean enabled = true;
    private Duration retention = Duration.ofDays(7);
    private Duration notificationRetention;
    private int batchSize = 500;
    private long intervalSeconds = 3600;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }

    /** Abandoned notifications; unset keeps them as long as terminal transactions. */
    public Duration getNotificationRetention() {
      return notificationRetention;
    }

    public void setNotificationRetention(Duration notificationRetention) {
      this.notificationRetention = notificationRetention;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public long getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }
  }

  public static class Recovery {
    private boolean runOnStart = true;

    public boolean isRunOnStart() {
      return runOnStart;
    }

    public void setRunOnStart(boolean runOnStart) {
      this.runOnStart = runOnStart;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "mediaflow";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}

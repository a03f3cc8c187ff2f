package mediaflow.spring.boot;

import mediaflow.MediaPipeline;
import mediaflow.ai.PromptTemplates;
import mediaflow.error.UserMessages;
import mediaflow.jdbc.DataSourceConnectionProvider;
import mediaflow.jdbc.purge.H2TransactionPurger;
import mediaflow.jdbc.purge.JdbcNotificationPurger;
import mediaflow.jdbc.purge.MySqlNotificationPurger;
import mediaflow.jdbc.purge.MySqlTransactionPurger;
import mediaflow.jdbc.purge.PostgresTransactionPurger;
import mediaflow.jdbc.store.AbstractJdbcTransactionStore;
import mediaflow.jdbc.store.H2TransactionStore;
import mediaflow.jdbc.store.JdbcNotificationStore;
import mediaflow.jdbc.store.JdbcTransactionStores;
import mediaflow.jdbc.store.MySqlTransactionStore;
import mediaflow.jdbc.store.PostgresTransactionStore;
import mediaflow.spi.ConnectionProvider;
import mediaflow.spi.ConversationConfigSource;
import mediaflow.spi.InferenceClient;
import mediaflow.spi.MetricsExporter;
import mediaflow.spi.NotificationStore;
import mediaflow.spi.RecordPurger;
import mediaflow.spi.Transport;
import mediaflow.stage.AnalysisPolicy;
import mediaflow.stage.ExponentialBackoffRetryPolicy;
import mediaflow.stage.JobOptions;
import mediaflow.stage.ProblemJobSink;
import mediaflow.stage.ProcessingCheckPolicy;
import mediaflow.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Auto-configuration for the media pipeline.
 *
 * <p>Wires a {@link MediaPipeline} from a {@link DataSource} and {@link MediaFlowProperties}.
 * The application supplies the {@link InferenceClient} and {@link Transport} beans; a
 * {@link ConversationConfigSource}, {@link UserMessages}, {@link PromptTemplates},
 * {@link ProblemJobSink}, {@link MetricsExporter} or {@link JsonCodec} bean replaces the
 * corresponding default.
 *
 * @see MediaFlowProperties
 * @see MediaFlowMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, SqlInitializationAutoConfiguration.class})
@ConditionalOnClass(MediaPipeline.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MediaFlowProperties.class)
public class MediaFlowAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcTransactionStore transactionStore(DataSource dataSource, MediaFlowProperties props,
      ObjectProvider<JsonCodec> jsonCodecProvider) {
    JsonCodec codec = jsonCodecProvider.getIfAvailable(JsonCodec::getDefault);
    AbstractJdbcTransactionStore detected = JdbcTransactionStores.detect(dataSource);
    String table = props.getTransactionTable();
    String history = props.getHistoryTable();
    return switch (detected.name()) {
      case "h2" -> new H2TransactionStore(table, history, codec);
      case "mysql" -> new MySqlTransactionStore(table, history, codec);
      case "postgresql" -> new PostgresTransactionStore(table, history, codec);
      default -> detected.withJsonCodec(codec);
    };
  }

  @Bean
  @ConditionalOnMissingBean(NotificationStore.class)
  public JdbcNotificationStore notificationStore(MediaFlowProperties props,
      ObjectProvider<JsonCodec> jsonCodecProvider) {
    return new JdbcNotificationStore(props.getNotificationTable(),
        jsonCodecProvider.getIfAvailable(JsonCodec::getDefault));
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean({InferenceClient.class, Transport.class})
  @DependsOnDatabaseInitialization
  public MediaPipeline mediaPipeline(MediaFlowProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcTransactionStore transactionStore,
      NotificationStore notificationStore,
      InferenceClient inferenceClient,
      Transport transport,
      ObjectProvider<ConversationConfigSource> configSourceProvider,
      ObjectProvider<UserMessages> messagesProvider,
      ObjectProvider<PromptTemplates> promptTemplatesProvider,
      ObjectProvider<ProblemJobSink> problemJobsProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<JsonCodec> jsonCodecProvider) {

    MediaFlowProperties.Stages stages = props.getStages();
    MediaFlowProperties.ProcessingCheck check = props.getProcessingCheck();
    MediaFlowProperties.Analysis analysis = props.getAnalysis();
    MediaFlowProperties.Notifications notifications = props.getNotifications();

    var builder = MediaPipeline.builder()
        .connectionProvider(connectionProvider)
        .transactionStore(transactionStore)
        .notificationStore(notificationStore)
        .inferenceClient(inferenceClient)
        .transport(transport)
        .workerCount(stages.getWorkerCount())
        .queueCapacity(stages.getQueueCapacity())
        .drainTimeoutMs(stages.getDrainTimeoutMs())
        .jobOptions(JobOptions.defaults()
            .withMaxAttempts(stages.getMaxAttempts())
            .withBackoff(new ExponentialBackoffRetryPolicy(
                stages.getBaseDelay().toMillis(), stages.getMaxDelay().toMillis())))
        .permanentFailureThreshold(stages.getPermanentFailureThreshold())
        .processingCheckPolicy(ProcessingCheckPolicy.builder()
            .baseDelay(check.getBaseDelay())
            .maxDelay(check.getMaxDelay())
            .progressInterval(check.getProgressInterval())
            .slowNoticeAt(check.getSlowNoticeAt())
            .maxElapsed(check.getMaxElapsed())
            .minChecksForElapsed(check.getMinChecksForElapsed())
            .maxChecks(check.getMaxChecks())
            .build())
        .analysisPolicy(new AnalysisPolicy(
            analysis.getUploadTimeout(), analysis.getVideoTimeout(), analysis.getImageTimeout()))
        .dedup(props.getDedup().getWindow(), props.getDedup().getSweepInterval())
        .circuitBreaker(props.getCircuitBreaker().getFailureLimit(), props.getCircuitBreaker().getResetWindow())
        .modelCacheSize(props.getModelCache().getMaxSize())
        .notificationIntervalMs(notifications.getSweepInterval().toMillis())
        .notificationBatchSize(notifications.getBatchSize())
        .notificationMaxAttempts(notifications.getMaxAttempts())
        .notificationSkipRecent(notifications.getSkipRecent())
        .recoverOnStart(props.getRecovery().isRunOnStart());

    if (props.getAuditDirectory() != null && !props.getAuditDirectory().isEmpty()) {
      builder.auditDirectory(Path.of(props.getAuditDirectory()));
    }
    configSourceProvider.ifAvailable(builder::configSource);
    messagesProvider.ifAvailable(builder::messages);
    promptTemplatesProvider.ifAvailable(builder::promptTemplates);
    problemJobsProvider.ifAvailable(builder::problemJobs);
    metricsProvider.ifAvailable(builder::metrics);
    jsonCodecProvider.ifAvailable(builder::jsonCodec);

    MediaFlowProperties.Retention retention = props.getRetention();
    if (retention.isEnabled()) {
      String dbName = transactionStore.name();
      builder.transactionPurger(transactionPurger(dbName, props.getTransactionTable()))
          .notificationPurger(notificationPurger(dbName, props.getNotificationTable()))
          .retention(retention.getRetention(), retention.getBatchSize(), retention.getIntervalSeconds());
      if (retention.getNotificationRetention() != null) {
        builder.notificationRetention(retention.getNotificationRetention());
      }
    }
    return builder.build();
  }

  private static RecordPurger transactionPurger(String dbName, String table) {
    return switch (dbName) {
      case "h2" -> new H2TransactionPurger(table);
      case "mysql" -> new MySqlTransactionPurger(table);
      case "postgresql" -> new PostgresTransactionPurger(table);
      default -> throw new IllegalStateException("No transaction purger available for database: " + dbName);
    };
  }

  private static RecordPurger notificationPurger(String dbName, String table) {
    return "mysql".equals(dbName) ? new MySqlNotificationPurger(table) : new JdbcNotificationPurger(table);
  }
}

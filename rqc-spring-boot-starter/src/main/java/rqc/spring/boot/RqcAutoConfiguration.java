package rqc.spring.boot;

import rqc.RqcAdapter;
import rqc.delivery.DeliveryClient;
import rqc.http.HttpDeliveryClient;
import rqc.jdbc.DataSourceConnectionProvider;
import rqc.jdbc.JdbcConsentStore;
import rqc.jdbc.JdbcCredentialStore;
import rqc.jdbc.JdbcDeliveryRecordStore;
import rqc.jdbc.RqcSchema;
import rqc.jdbc.store.AbstractJdbcDeliveryTaskStore;
import rqc.jdbc.store.JdbcDeliveryTaskStores;
import rqc.spi.ConnectionProvider;
import rqc.spi.ConsentStore;
import rqc.spi.CredentialStore;
import rqc.spi.DeliveryRecordStore;
import rqc.spi.MetricsExporter;
import rqc.spi.OperatorNotifier;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Auto-configuration for the RQC adapter.
 *
 * <p>Wires JDBC stores, the HTTP delivery client and an {@link RqcAdapter} from a
 * {@link DataSource} and {@link RqcProperties}. Every bean backs off when the application
 * defines its own.
 *
 * @see RqcProperties
 * @see RqcMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(RqcAdapter.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RqcProperties.class)
public class RqcAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcDeliveryTaskStore rqcTaskStore(DataSource dataSource, RqcProperties props) {
    AbstractJdbcDeliveryTaskStore store = JdbcDeliveryTaskStores.detect(dataSource);
    if (props.getJdbc().isInitializeSchema()) {
      try (Connection conn = dataSource.getConnection()) {
        RqcSchema.create(conn, store.name());
      } catch (SQLException e) {
        throw new IllegalStateException("Failed to create RQC tables", e);
      }
    }
    return store;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider rqcConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(CredentialStore.class)
  public JdbcCredentialStore rqcCredentialStore() {
    return new JdbcCredentialStore();
  }

  @Bean
  @ConditionalOnMissingBean(ConsentStore.class)
  public JdbcConsentStore rqcConsentStore() {
    return new JdbcConsentStore();
  }

  @Bean
  @ConditionalOnMissingBean(DeliveryRecordStore.class)
  public JdbcDeliveryRecordStore rqcDeliveryRecordStore() {
    return new JdbcDeliveryRecordStore();
  }

  @Bean
  @ConditionalOnMissingBean(DeliveryClient.class)
  public HttpDeliveryClient rqcDeliveryClient(RqcProperties props) {
    if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) {
      throw new IllegalStateException("rqc.base-url must be set");
    }
    return HttpDeliveryClient.builder()
        .baseUrl(props.getBaseUrl())
        .connectTimeout(props.getConnectTimeout())
        .requestTimeout(props.getRequestTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public RqcAdapter rqcAdapter(RqcProperties props,
      ConnectionProvider connectionProvider,
      CredentialStore credentialStore,
      ConsentStore consentStore,
      AbstractJdbcDeliveryTaskStore taskStore,
      DeliveryRecordStore recordStore,
      DeliveryClient deliveryClient,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<OperatorNotifier> notifierProvider) {

    var builder = RqcAdapter.builder()
        .connectionProvider(connectionProvider)
        .credentialStore(credentialStore)
        .consentStore(consentStore)
        .taskStore(taskStore)
        .recordStore(recordStore)
        .deliveryClient(deliveryClient)
        .retryInterval(props.getRetry().getInterval())
        .maxAttempts(props.getRetry().getMaxAttempts())
        .maxAge(props.getRetry().getMaxAge())
        .batchSize(props.getDrain().getBatchSize())
        .drainWorkers(props.getDrain().getWorkers())
        .lockTimeout(props.getDrain().getLockTimeout())
        .withholdAnonymousContent(props.getPrivacy().isWithholdAnonymousContent());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    OperatorNotifier notifier = notifierProvider.getIfAvailable();
    if (notifier != null) {
      builder.notifier(notifier);
    }
    return builder.build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "rqc.drain.schedule", name = "enabled", havingValue = "true")
  public RqcDrainScheduler rqcDrainScheduler(RqcAdapter adapter, RqcProperties props) {
    return new RqcDrainScheduler(adapter, props.getDrain().getSchedule().getCron(),
        props.getDrain().getSchedule().getZone());
  }
}

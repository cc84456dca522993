package rqc.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import rqc.micrometer.MicrometerMetricsExporter;
import rqc.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code rqc.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link RqcAutoConfiguration} so the exporter is injected into the adapter.
 */
@AutoConfiguration(before = RqcAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "rqc.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RqcProperties.class)
public class RqcMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter rqcMetricsExporter(MeterRegistry meterRegistry, RqcProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}

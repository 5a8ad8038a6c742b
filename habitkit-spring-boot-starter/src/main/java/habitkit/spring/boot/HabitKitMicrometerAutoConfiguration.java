package habitkit.spring.boot;

import habitkit.micrometer.MicrometerMetricsExporter;
import habitkit.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when habitkit-micrometer is on the classpath
 * and {@code habitkit.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link HabitKitAutoConfiguration} so the {@link MetricsExporter} bean
 * reaches the dispatcher and the health aggregator.
 */
@AutoConfiguration(before = HabitKitAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "habitkit.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(HabitKitProperties.class)
public class HabitKitMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, HabitKitProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}

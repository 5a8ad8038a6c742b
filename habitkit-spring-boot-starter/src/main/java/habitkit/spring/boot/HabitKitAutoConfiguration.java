package habitkit.spring.boot;

import habitkit.HabitEventPublisher;
import habitkit.dispatch.DispatchInterceptor;
import habitkit.dispatch.EventDispatcher;
import habitkit.health.HealthAggregator;
import habitkit.jdbc.store.JdbcIntegrationStores;
import habitkit.registry.DefaultExtensionRegistry;
import habitkit.registry.ExtensionRegistry;
import habitkit.spi.IntegrationStore;
import habitkit.spi.MetricsExporter;
import habitkit.store.InMemoryIntegrationStore;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Auto-configuration for habitkit.
 *
 * <p>Wires an {@link ExtensionRegistry}, an {@link IntegrationStore}, an
 * {@link EventDispatcher}, a {@link HabitEventPublisher} and a {@link HealthAggregator}
 * from {@link HabitKitProperties}. Extensions are contributed as
 * {@link habitkit.ExtensionDescriptor} beans or {@link HabitExtension} beans.
 *
 * <p>The store is JDBC-backed when habitkit-jdbc is on the classpath and a
 * {@link DataSource} exists (unless {@code habitkit.store.type=MEMORY}); otherwise it is
 * an {@link InMemoryIntegrationStore}.
 *
 * @see HabitKitProperties
 * @see HabitKitMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventDispatcher.class)
@EnableConfigurationProperties(HabitKitProperties.class)
public class HabitKitAutoConfiguration {

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcIntegrationStores.class)
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnExpression("!'${habitkit.store.type:AUTO}'.equalsIgnoreCase('MEMORY')")
  static class JdbcStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(IntegrationStore.class)
    public IntegrationStore jdbcIntegrationStore(DataSource dataSource, HabitKitProperties props) {
      return JdbcIntegrationStores.detect(dataSource, props.getStore().getTableName());
    }
  }

  @Bean
  @ConditionalOnMissingBean(IntegrationStore.class)
  public IntegrationStore integrationStore(HabitKitProperties props) {
    if (props.getStore().getType() == HabitKitProperties.StoreType.JDBC) {
      throw new IllegalStateException(
          "habitkit.store.type=JDBC requires habitkit-jdbc on the classpath and a DataSource bean");
    }
    return new InMemoryIntegrationStore();
  }

  @Bean
  @ConditionalOnMissingBean(ExtensionRegistry.class)
  public DefaultExtensionRegistry extensionRegistry() {
    return new DefaultExtensionRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public ExtensionRegistrar extensionRegistrar(ListableBeanFactory beanFactory, ExtensionRegistry registry) {
    return new ExtensionRegistrar(beanFactory, registry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventDispatcher eventDispatcher(HabitKitProperties props,
      ExtensionRegistry registry,
      IntegrationStore integrationStore,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<DispatchInterceptor> interceptorProvider) {

    HabitKitProperties.Dispatcher dispatcher = props.getDispatcher();
    List<DispatchInterceptor> interceptors = interceptorProvider.orderedStream().toList();
    EventDispatcher.Builder builder = EventDispatcher.builder()
        .registry(registry)
        .store(integrationStore)
        .workerCount(dispatcher.getWorkerCount())
        .hookTimeoutMs(dispatcher.getHookTimeout().toMillis())
        .drainTimeoutMs(dispatcher.getDrainTimeout().toMillis())
        .removeOnDelete(dispatcher.isRemoveOnDelete())
        .interceptors(interceptors);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public HabitEventPublisher habitEventPublisher(EventDispatcher eventDispatcher) {
    return new HabitEventPublisher(eventDispatcher);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public HealthAggregator healthAggregator(HabitKitProperties props,
      ExtensionRegistry registry,
      ObjectProvider<MetricsExporter> metricsProvider) {
    HealthAggregator.Builder builder = HealthAggregator.builder()
        .registry(registry)
        .timeoutMs(props.getHealth().getTimeout().toMillis())
        .workerCount(props.getHealth().getWorkerCount());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}

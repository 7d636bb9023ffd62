package storedb.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import storedb.Database;
import storedb.micrometer.MicrometerDatabaseMetrics;
import storedb.spi.DatabaseMetrics;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerDatabaseMetrics} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code storedb.metrics.enabled} is true (default).
 * Once all singletons are ready, the pool gauges are bound to the {@link Database} bean.
 *
 * <p>Runs before {@link StoreDbAutoConfiguration} so the {@link DatabaseMetrics} bean is
 * available for injection into the facade.
 */
@AutoConfiguration(before = StoreDbAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerDatabaseMetrics.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "storedb.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(StoreDbProperties.class)
public class StoreDbMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(DatabaseMetrics.class)
  public MicrometerDatabaseMetrics micrometerDatabaseMetrics(MeterRegistry meterRegistry, StoreDbProperties props) {
    return new MicrometerDatabaseMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }

  @Bean
  public SmartInitializingSingleton storeDbPoolMetricsBinder(ObjectProvider<MicrometerDatabaseMetrics> metrics,
      ObjectProvider<Database> databases) {
    return () -> metrics.ifAvailable(m -> databases.ifUnique(db -> m.bindPoolStats(db::stats)));
  }
}

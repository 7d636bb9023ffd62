package storedb.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import storedb.Database;
import storedb.RetryPolicy;
import storedb.jdbc.JdbcDatabase;
import storedb.spi.DatabaseMetrics;

import javax.sql.DataSource;

/**
 * Auto-configuration for the storedb database facade.
 *
 * <p>Wraps the application's {@link DataSource} in a {@link JdbcDatabase} configured from
 * {@link StoreDbProperties}. The pool stays owned by Spring: closing the facade does not
 * close it. Backs off when the application defines its own {@link Database}.
 *
 * @see StoreDbProperties
 * @see StoreDbMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcDatabase.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(StoreDbProperties.class)
public class StoreDbAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(Database.class)
  public JdbcDatabase storeDatabase(DataSource dataSource, StoreDbProperties props,
      ObjectProvider<DatabaseMetrics> metricsProvider) {
    var builder = JdbcDatabase.builder()
        .dataSource(dataSource)
        .closeDataSource(false)
        .retryPolicy(RetryPolicy.of(props.getRetry().getMaxAttempts(), props.getRetry().getBackoffUnit()))
        .slowQueryThreshold(props.getSlowQueryThreshold());
    DatabaseMetrics metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}

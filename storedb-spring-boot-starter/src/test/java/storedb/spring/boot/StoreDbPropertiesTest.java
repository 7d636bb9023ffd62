package storedb.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class StoreDbPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(StoreDbProperties.class);
      assertEquals(10, props.getRetry().getMaxAttempts());
      assertEquals(Duration.ofMillis(2), props.getRetry().getBackoffUnit());
      assertEquals(Duration.ofMillis(100), props.getSlowQueryThreshold());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("storedb", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "storedb.retry.max-attempts=4",
        "storedb.retry.backoff-unit=15ms",
        "storedb.slow-query-threshold=1s",
        "storedb.metrics.enabled=false",
        "storedb.metrics.name-prefix=registry.db"
    ).run(ctx -> {
      var props = ctx.getBean(StoreDbProperties.class);
      assertEquals(4, props.getRetry().getMaxAttempts());
      assertEquals(Duration.ofMillis(15), props.getRetry().getBackoffUnit());
      assertEquals(Duration.ofSeconds(1), props.getSlowQueryThreshold());
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("registry.db", props.getMetrics().getNamePrefix());
    });
  }

  @Configuration
  @EnableConfigurationProperties(StoreDbProperties.class)
  static class PropsConfig {
  }
}

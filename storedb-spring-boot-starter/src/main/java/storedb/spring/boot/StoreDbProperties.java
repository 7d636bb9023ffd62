package storedb.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the storedb database facade.
 *
 * @see StoreDbAutoConfiguration
 */
@ConfigurationProperties(prefix = "storedb")
public class StoreDbProperties {

  /**
   * Queries slower than this are logged with their arguments.
   */
  private Duration slowQueryThreshold = Duration.ofMillis(100);

  private final Retry retry = new Retry();
  private final Metrics metrics = new Metrics();

  public Duration getSlowQueryThreshold() {
    return slowQueryThreshold;
  }

  public void setSlowQueryThreshold(Duration slowQueryThreshold) {
    this.slowQueryThreshold = slowQueryThreshold;
  }

  public Retry getRetry() {
    return retry;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Retry {
    /**
     * Total attempts per transaction, including the first.
     */
    private int maxAttempts = 10;

    /**
     * Attempt n waits n times this long before it begins.
     */
    private Duration backoffUnit = Duration.ofMillis(2);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffUnit() {
      return backoffUnit;
    }

    public void setBackoffUnit(Duration backoffUnit) {
      this.backoffUnit = backoffUnit;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "storedb";

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

package storedb.jdbc;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread between transaction attempts. Swapped out in tests to
 * record the delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

  void sleep(Duration duration) throws InterruptedException;
}

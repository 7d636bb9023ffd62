package storedb;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline scope for database calls, plus the structured fields that
 * every log entry emitted under it carries (request id, user, ...).
 *
 * <p>Contexts form a tree. A derived context is done as soon as it or any ancestor is
 * cancelled or past its deadline; cancelling a derived context never affects its parent.
 * Instances are immutable apart from the cancellation flag, and safe to share between
 * threads.
 */
public final class OperationContext {
  private static final OperationContext BACKGROUND = new OperationContext(null, null, Map.of());

  private final OperationContext parent;
  private final Instant deadline;
  private final Map<String, Object> fields;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> cancelCallbacks = new CopyOnWriteArrayList<>();

  private OperationContext(OperationContext parent, Instant deadline, Map<String, Object> fields) {
    this.parent = parent;
    this.deadline = deadline;
    this.fields = fields;
  }

  /**
   * The root context: never cancelled, no deadline, no fields.
   */
  public static OperationContext background() {
    return BACKGROUND;
  }

  /**
   * Derives a context that can be cancelled independently of this one.
   */
  public OperationContext withCancel() {
    return new OperationContext(this, deadline, fields);
  }

  /**
   * Derives a context whose deadline is the earlier of this context's and {@code deadline}.
   */
  public OperationContext withDeadline(Instant deadline) {
    Objects.requireNonNull(deadline, "deadline");
    Instant effective = this.deadline != null && this.deadline.isBefore(deadline) ? this.deadline : deadline;
    return new OperationContext(this, effective, fields);
  }

  /**
   * Derives a context that expires {@code timeout} from now.
   */
  public OperationContext withTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    return withDeadline(Instant.now().plus(timeout));
  }

  /**
   * Derives a context carrying an extra log field.
   */
  public OperationContext withField(String key, Object value) {
    Objects.requireNonNull(key, "key");
    Map<String, Object> merged = new LinkedHashMap<>(fields);
    merged.put(key, value);
    return new OperationContext(this, deadline, Collections.unmodifiableMap(merged));
  }

  /**
   * Cancels this context and every context derived from it, then runs the registered
   * cancellation callbacks. Repeated calls are no-ops.
   *
   * @throws IllegalStateException on the background context
   */
  public void cancel() {
    if (this == BACKGROUND) {
      throw new IllegalStateException("background context cannot be cancelled");
    }
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    for (Runnable callback : cancelCallbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  /**
   * @return {@code true} if this context or an ancestor was cancelled
   */
  public boolean isCancelled() {
    for (OperationContext c = this; c != null; c = c.parent) {
      if (c.cancelled.get()) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return {@code true} if cancelled or past the deadline
   */
  public boolean isDone() {
    return isCancelled() || (deadline != null && !Instant.now().isBefore(deadline));
  }

  /**
   * Fails fast when the context is done.
   *
   * @throws OperationCancelledException if cancelled or past the deadline
   */
  public void checkActive() throws OperationCancelledException {
    if (isCancelled()) {
      throw new OperationCancelledException("context cancelled");
    }
    if (deadline != null && !Instant.now().isBefore(deadline)) {
      throw new OperationCancelledException("context deadline exceeded");
    }
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  /**
   * Time left until the deadline, {@link Duration#ZERO} once it passed, empty without one.
   */
  public Optional<Duration> remaining() {
    if (deadline == null) {
      return Optional.empty();
    }
    Duration left = Duration.between(Instant.now(), deadline);
    return Optional.of(left.isNegative() ? Duration.ZERO : left);
  }

  /**
   * Structured log fields, in insertion order.
   */
  public Map<String, Object> fields() {
    return fields;
  }

  /**
   * Registers a callback run when this context, or any ancestor, is cancelled. If the
   * context is already cancelled the callback runs immediately.
   *
   * @return a handle that removes the callback when closed
   */
  public Registration onCancel(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    if (this == BACKGROUND) {
      return Registration.NONE;
    }
    if (isCancelled()) {
      callback.run();
      return Registration.NONE;
    }
    List<OperationContext> registered = new CopyOnWriteArrayList<>();
    for (OperationContext c = this; c != null && c != BACKGROUND; c = c.parent) {
      c.cancelCallbacks.add(callback);
      registered.add(c);
    }
    if (isCancelled()) {
      // lost the race with cancel(); statement cancellation tolerates a second call
      callback.run();
    }
    return () -> registered.forEach(c -> c.cancelCallbacks.remove(callback));
  }

  /**
   * Handle returned by {@link #onCancel(Runnable)}.
   */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    Registration NONE = () -> { };

    @Override
    void close();
  }
}

package storedb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Settings for one transactional call: isolation level, read-only hint, logger and
 * operation context.
 *
 * <p>Built from defaults and then overridden by {@link TxOption}s in order, the last one
 * winning per field. Immutable; one instance per {@link Transactor#execute} call.
 */
public final class TxOptions {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger("storedb");

  private final IsolationLevel isolationLevel;
  private final boolean readOnly;
  private final Logger logger;
  private final OperationContext context;

  private TxOptions(Builder builder) {
    this.isolationLevel = Objects.requireNonNull(builder.isolationLevel, "isolationLevel");
    this.readOnly = builder.readOnly;
    this.logger = Objects.requireNonNull(builder.logger, "logger");
    this.context = Objects.requireNonNull(builder.context, "context");
  }

  /**
   * Serializable, read-write, default logger, background context.
   */
  public static TxOptions defaults() {
    return builder().build();
  }

  /**
   * Applies {@code options} over the defaults.
   */
  public static TxOptions of(TxOption... options) {
    return builder().apply(options).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public IsolationLevel isolationLevel() {
    return isolationLevel;
  }

  public boolean readOnly() {
    return readOnly;
  }

  public Logger logger() {
    return logger;
  }

  public OperationContext context() {
    return context;
  }

  @Override
  public String toString() {
    return "TxOptions{isolationLevel=" + isolationLevel + ", readOnly=" + readOnly
        + ", logger=" + logger.getName() + '}';
  }

  /**
   * Mutable accumulator the {@link TxOption}s write into.
   */
  public static final class Builder {
    private IsolationLevel isolationLevel = IsolationLevel.SERIALIZABLE;
    private boolean readOnly;
    private Logger logger = DEFAULT_LOGGER;
    private OperationContext context = OperationContext.background();

    private Builder() {
    }

    public Builder isolationLevel(IsolationLevel isolationLevel) {
      this.isolationLevel = Objects.requireNonNull(isolationLevel, "isolationLevel");
      return this;
    }

    public Builder readOnly(boolean readOnly) {
      this.readOnly = readOnly;
      return this;
    }

    public Builder logger(Logger logger) {
      this.logger = Objects.requireNonNull(logger, "logger");
      return this;
    }

    public Builder context(OperationContext context) {
      this.context = Objects.requireNonNull(context, "context");
      return this;
    }

    /**
     * Applies options in order.
     */
    public Builder apply(TxOption... options) {
      Objects.requireNonNull(options, "options");
      for (TxOption option : options) {
        Objects.requireNonNull(option, "option").applyTo(this);
      }
      return this;
    }

    public TxOptions build() {
      return new TxOptions(this);
    }
  }
}

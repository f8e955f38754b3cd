package express.mvp.myra.shutdown;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Configuration for a {@link ShutdownCoordinator}.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Shutdown Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>name</td><td>shutdown</td><td>Name used in log messages</td></tr>
 *   <tr><td>wakeupExecutor</td><td>none</td><td>Executor that completes waiter futures</td></tr>
 *   <tr><td>warnOnAbandonedTokens</td><td>true</td><td>Log tokens released by the GC</td></tr>
 * </table>
 *
 * <h2>Wake-up Executor</h2>
 *
 * <p>Without an executor, waiter futures are completed on the thread that triggered the shutdown
 * or released the last delay token, and their dependent stages run there too. Supply an executor
 * when those stages are slow or must not run on the triggering thread.
 *
 * <p>A token that is dropped without being closed is released on {@link
 * java.util.concurrent.ForkJoinPool#commonPool()}; with inline wake-up, the waiters, wrapped
 * operations and listeners it triggers run on that pool.
 *
 * <p>Inline wake-up completes every trigger waiter before any completion waiter. An executor
 * completes them in the order it runs the submitted tasks, which only a single-threaded executor
 * keeps.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ShutdownConfig config = ShutdownConfig.builder()
 *     .name("order-service")
 *     .wakeupExecutor(ForkJoinPool.commonPool())
 *     .build();
 *
 * ShutdownCoordinator<String> coordinator = new ShutdownCoordinator<>(config);
 * }</pre>
 */
public final class ShutdownConfig {

    private static final ShutdownConfig DEFAULTS = builder().build();

    /** Coordinator name used in log messages. */
    private final String name;

    /** Executor used to complete waiter futures, or null to complete them inline. */
    private final Executor wakeupExecutor;

    /** Whether abandoned tokens are reported with a warning. */
    private final boolean warnOnAbandonedTokens;

    private ShutdownConfig(Builder builder) {
        this.name = builder.name;
        this.wakeupExecutor = builder.wakeupExecutor;
        this.warnOnAbandonedTokens = builder.warnOnAbandonedTokens;
    }

    /**
     * Returns the default configuration.
     *
     * @return the defaults
     */
    public static ShutdownConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new builder for constructing configuration.
     *
     * @return a new builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the coordinator name.
     *
     * @return the name (never null or blank)
     */
    public String name() {
        return name;
    }

    /**
     * Returns the executor that completes waiter futures.
     *
     * @return the executor, or empty when futures are completed inline
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "The executor is owned by the caller and shared on purpose.")
    public Optional<Executor> wakeupExecutor() {
        return Optional.ofNullable(wakeupExecutor);
    }

    /**
     * Returns whether abandoned tokens are logged.
     *
     * @return true if a warning is logged for each abandoned token
     */
    public boolean warnOnAbandonedTokens() {
        return warnOnAbandonedTokens;
    }

    @Override
    public String toString() {
        return "ShutdownConfig{"
                + "name=" + name
                + ", wakeupExecutor=" + (wakeupExecutor == null ? "inline" : wakeupExecutor)
                + ", warnOnAbandonedTokens=" + warnOnAbandonedTokens
                + '}';
    }

    /** Builder for constructing {@link ShutdownConfig} instances. */
    public static final class Builder {
        private String name = "shutdown";
        private Executor wakeupExecutor;
        private boolean warnOnAbandonedTokens = true;

        private Builder() {}

        /**
         * Sets the coordinator name.
         *
         * @param name the name used in log messages
         * @return this builder
         * @throws IllegalArgumentException if name is blank
         */
        public Builder name(String name) {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            return this;
        }

        /**
         * Sets the executor that completes waiter futures.
         *
         * @param executor the executor
         * @return this builder
         */
        @SuppressFBWarnings(
                value = "EI_EXPOSE_REP2",
                justification = "The executor is owned by the caller and shared on purpose.")
        public Builder wakeupExecutor(Executor executor) {
            this.wakeupExecutor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        /**
         * Completes waiter futures on the thread that causes the transition (the default).
         *
         * @return this builder
         */
        public Builder inlineWakeup() {
            this.wakeupExecutor = null;
            return this;
        }

        /**
         * Sets whether abandoned tokens are logged.
         *
         * @param warn true to log a warning per abandoned token
         * @return this builder
         */
        public Builder warnOnAbandonedTokens(boolean warn) {
            this.warnOnAbandonedTokens = warn;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new immutable configuration
         */
        public ShutdownConfig build() {
            return new ShutdownConfig(this);
        }
    }
}

package express.mvp.myra.shutdown.error;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a coordinator request that the coordinator may refuse.
 *
 * <p>A result is either a success, optionally carrying a value, or a {@link ShutdownRejection}.
 * Refusals such as "shutdown already triggered" are normal operating conditions, not errors, so
 * they are returned rather than thrown.
 *
 * <h2>Usage Pattern</h2>
 *
 * <pre>{@code
 * ShutdownResult<DelayToken<String>, String> result = coordinator.delayShutdownToken();
 * if (result.isSuccess()) {
 *     try (DelayToken<String> token = result.value()) {
 *         flushBuffers();
 *     }
 * } else {
 *     logger.info(result.rejection().orElseThrow().message());
 * }
 *
 * coordinator.triggerShutdown("sigterm")
 *         .ifRejected(r -> logger.fine("already shutting down: " + r.reason()));
 * }</pre>
 *
 * @param <V> the success value type ({@link Void} when there is no value)
 * @param <T> the shutdown reason type
 */
public final class ShutdownResult<V, T> {

    private final V value;
    private final ShutdownRejection<T> rejection;

    private ShutdownResult(V value, ShutdownRejection<T> rejection) {
        this.value = value;
        this.rejection = rejection;
    }

    /**
     * Creates a successful result without a value.
     *
     * @param <T> the shutdown reason type
     * @return a successful result whose value is null
     */
    public static <T> ShutdownResult<Void, T> success() {
        return new ShutdownResult<>(null, null);
    }

    /**
     * Creates a successful result carrying a value.
     *
     * @param value the value
     * @param <V> the value type
     * @param <T> the shutdown reason type
     * @return a successful result
     */
    public static <V, T> ShutdownResult<V, T> success(V value) {
        return new ShutdownResult<>(Objects.requireNonNull(value, "value must not be null"), null);
    }

    /**
     * Creates a rejected result.
     *
     * @param rejection the rejection
     * @param <V> the value type the request would have produced
     * @param <T> the shutdown reason type
     * @return a rejected result
     */
    public static <V, T> ShutdownResult<V, T> rejected(ShutdownRejection<T> rejection) {
        return new ShutdownResult<>(
                null, Objects.requireNonNull(rejection, "rejection must not be null"));
    }

    /**
     * Checks if the request succeeded.
     *
     * @return true if the coordinator accepted the request
     */
    public boolean isSuccess() {
        return rejection == null;
    }

    /**
     * Checks if the request was refused.
     *
     * @return true if the coordinator rejected the request
     */
    public boolean isRejected() {
        return rejection != null;
    }

    /**
     * Returns the success value.
     *
     * @return the value (null for results without a value)
     * @throws ShutdownRejectedException if the request was rejected
     */
    public V value() {
        if (rejection != null) {
            throw new ShutdownRejectedException(rejection);
        }
        return value;
    }

    /**
     * Returns the success value, or a fallback if the request was rejected.
     *
     * @param other the fallback
     * @return the value or the fallback
     */
    public V orElse(V other) {
        return rejection == null ? value : other;
    }

    /**
     * Returns the rejection.
     *
     * @return the rejection, or empty on success
     */
    public Optional<ShutdownRejection<T>> rejection() {
        return Optional.ofNullable(rejection);
    }

    /**
     * Transforms the success value, keeping a rejection as it is.
     *
     * @param mapper function applied to the value on success
     * @param <U> the new value type
     * @return the mapped result
     */
    public <U> ShutdownResult<U, T> map(Function<? super V, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        if (rejection != null) {
            return new ShutdownResult<>(null, rejection);
        }
        return new ShutdownResult<>(mapper.apply(value), null);
    }

    /**
     * Runs an action with the value if the request succeeded.
     *
     * @param action the action
     * @return this result
     */
    public ShutdownResult<V, T> ifSuccess(Consumer<? super V> action) {
        if (rejection == null) {
            action.accept(value);
        }
        return this;
    }

    /**
     * Runs an action with the rejection if the request was refused.
     *
     * @param action the action
     * @return this result
     */
    public ShutdownResult<V, T> ifRejected(Consumer<? super ShutdownRejection<T>> action) {
        if (rejection != null) {
            action.accept(rejection);
        }
        return this;
    }

    @Override
    public String toString() {
        return rejection == null
                ? "ShutdownResult[success" + (value == null ? "" : ": " + value) + "]"
                : "ShutdownResult[rejected: " + rejection.message() + "]";
    }
}

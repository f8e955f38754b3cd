package express.mvp.myra.shutdown;

import express.mvp.myra.shutdown.cleanup.TokenCleaner;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Token that triggers shutdown when it is closed or abandoned.
 *
 * <p>Obtained from {@link ShutdownCoordinator#triggerShutdownToken(Object)}. Give one to every
 * task whose end should bring the process down; whichever token is closed first triggers shutdown
 * with its reason, the rest are no-ops. A token that is dropped without being closed triggers
 * shutdown once {@link TokenCleaner} finds it unreachable.
 *
 * <pre>{@code
 * TriggerToken<String> vital = coordinator.triggerShutdownToken("acceptor stopped");
 * executor.execute(() -> {
 *     try (vital) {
 *         acceptLoop();
 *     }
 * });
 * }</pre>
 *
 * @param <T> the shutdown reason type
 */
public final class TriggerToken<T> implements AutoCloseable {

    private final ShutdownState<T> state;

    private final T reason;

    private final TokenCleaner.Registration registration;

    TriggerToken(ShutdownState<T> state, T reason) {
        this.state = state;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.registration =
                TokenCleaner.register(
                        this,
                        "TriggerToken[" + state.name() + "]",
                        state.config().warnOnAbandonedTokens(),
                        () -> state.trigger(reason));
    }

    /**
     * Returns the reason this token triggers shutdown with.
     *
     * @return the reason
     */
    public T reason() {
        return reason;
    }

    /**
     * Wraps an operation so that shutdown is triggered when it finishes.
     *
     * <p>Ownership of this token moves to the returned adapter: the token fires when the operation
     * completes, fails, or the adapter is abandoned. The caller must not close the token
     * afterwards.
     *
     * @param operation the operation to wrap
     * @param <R> the operation's result type
     * @return the adapter
     * @throws IllegalStateException if this token was already released
     */
    public <R> TriggerOnCompletion<R, T> wrapFuture(CompletionStage<R> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        if (isReleased()) {
            throw new IllegalStateException("Trigger token has already been released");
        }
        return TriggerOnCompletion.start(this, operation);
    }

    /**
     * Checks if the token has been released.
     *
     * @return true after close or after release by the cleaner
     */
    public boolean isReleased() {
        return registration.isReleased();
    }

    /**
     * Triggers shutdown with this token's reason, unless shutdown was already triggered.
     * Subsequent calls have no effect.
     */
    @Override
    public void close() {
        registration.release();
    }

    @Override
    public String toString() {
        return "TriggerToken["
                + state.name()
                + ", reason="
                + reason
                + (isReleased() ? ":released" : ":open")
                + "]";
    }
}

package express.mvp.myra.shutdown;

import express.mvp.myra.shutdown.cleanup.TokenCleaner;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Token that keeps shutdown from completing while it is open.
 *
 * <p>Obtained from {@link ShutdownCoordinator#delayShutdownToken()}. Closing the token gives its
 * delay back; once every delay token is closed and shutdown has been triggered, shutdown
 * completes. A token that is dropped without being closed is released by {@link TokenCleaner}
 * once it becomes unreachable.
 *
 * <pre>{@code
 * ShutdownResult<DelayToken<String>, String> delay = coordinator.delayShutdownToken();
 * if (delay.isRejected()) {
 *     return; // too late to run cleanup
 * }
 * try (DelayToken<String> token = delay.value()) {
 *     coordinator.awaitShutdownTriggered();
 *     flushPendingWrites();
 * }
 * }</pre>
 *
 * <p>Tokens can be handed to other threads but not copied; each token accounts for exactly one
 * delay. Closing is idempotent.
 *
 * @param <T> the shutdown reason type
 */
public final class DelayToken<T> implements AutoCloseable {

    private final ShutdownState<T> state;

    private final TokenCleaner.Registration registration;

    /** Must only be called after the state accepted {@link ShutdownState#acquireDelay()}. */
    DelayToken(ShutdownState<T> state) {
        this.state = state;
        this.registration =
                TokenCleaner.register(
                        this,
                        "DelayToken[" + state.name() + "]",
                        state.config().warnOnAbandonedTokens(),
                        state::releaseDelay);
    }

    /**
     * Wraps an operation so that shutdown can not complete before it finishes.
     *
     * <p>Ownership of this token moves to the returned adapter: the adapter releases it when the
     * operation finishes or the adapter is abandoned. The caller must not close the token
     * afterwards. Unlike {@link ShutdownCoordinator#wrapDelayShutdown(CompletionStage)} this can
     * not be rejected, since an open token proves shutdown has not completed.
     *
     * @param operation the operation to wrap
     * @param <R> the operation's result type
     * @return the adapter
     * @throws IllegalStateException if this token was already released
     */
    public <R> DelayShutdown<R, T> wrapFuture(CompletionStage<R> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        if (isReleased()) {
            throw new IllegalStateException("Delay token has already been released");
        }
        return DelayShutdown.start(this, operation);
    }

    /**
     * Checks if the token has been released.
     *
     * @return true after close or after release by the cleaner
     */
    public boolean isReleased() {
        return registration.isReleased();
    }

    /** Releases the delay. Subsequent calls have no effect. */
    @Override
    public void close() {
        registration.release();
    }

    @Override
    public String toString() {
        return "DelayToken[" + state.name() + (isReleased() ? ":released" : ":open") + "]";
    }
}

package express.mvp.myra.shutdown;

import express.mvp.myra.shutdown.error.AlreadyCompleted;
import express.mvp.myra.shutdown.error.AlreadyTriggered;
import express.mvp.myra.shutdown.error.ShutdownResult;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Coordinates graceful shutdown across concurrent tasks.
 *
 * <p>The coordinator solves three related problems:
 *
 * <ul>
 *   <li>broadcasting a shutdown signal so running operations can stop,
 *   <li>letting operations hold off shutdown completion while they clean up,
 *   <li>triggering shutdown automatically when a vital operation ends.
 * </ul>
 *
 * <h2>Shutdown Flow</h2>
 *
 * <pre>
 * 1. triggerShutdown(reason)            (first caller wins)
 *    └─▶ Phase: RUNNING → TRIGGERED
 *        └─▶ waitShutdownTriggered() futures complete with the reason
 *        └─▶ wrapCancel(...) operations are cancelled
 *
 * 2. Last delay token released          (immediately, if none is outstanding)
 *    └─▶ Phase: TRIGGERED → COMPLETED
 *        └─▶ waitShutdownComplete() futures complete with the reason
 *        └─▶ no new delay tokens are handed out
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ShutdownCoordinator<String> shutdown = new ShutdownCoordinator<>();
 *
 * // A vital task: when it ends, the whole service shuts down
 * shutdown.wrapTriggerShutdown(CompletableFuture.runAsync(this::acceptLoop), "acceptor ended");
 *
 * // Per connection: stop on shutdown, but finish the goodbye message first
 * ShutdownResult<DelayToken<String>, String> delay = shutdown.delayShutdownToken();
 * if (delay.isSuccess()) {
 *     DelayToken<String> token = delay.value();
 *     shutdown.wrapCancel(connection.serveAsync())
 *             .future()
 *             .whenComplete((v, e) -> {
 *                 try (token) {
 *                     connection.sendGoodbye();
 *                 }
 *             });
 * }
 *
 * // Signal handler
 * Runtime.getRuntime().addShutdownHook(new Thread(() -> {
 *     shutdown.triggerShutdown("SIGTERM");
 *     shutdown.awaitShutdownComplete(Duration.ofSeconds(10));
 * }));
 * }</pre>
 *
 * <h2>Handles</h2>
 *
 * <p>A coordinator is a handle on shared state. {@link #copy()} returns another handle on the same
 * state; handles are equal when they share state. Tokens and adapters keep the state alive on
 * their own, so handles can be dropped freely.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Transitions are serialized by one lock; waiter futures, adapters
 * and listeners are completed and notified outside of it.
 *
 * @param <T> the shutdown reason type; reasons must be non-null and should be immutable, since
 *     every waiter receives the same instance
 * @see DelayToken
 * @see TriggerToken
 * @see ShutdownListener
 */
public final class ShutdownCoordinator<T> {

    private final ShutdownState<T> state;

    /** Creates a coordinator with the default configuration. */
    public ShutdownCoordinator() {
        this(ShutdownConfig.defaults());
    }

    /**
     * Creates a coordinator.
     *
     * @param config the configuration
     */
    public ShutdownCoordinator(ShutdownConfig config) {
        this(new ShutdownState<>(config));
    }

    private ShutdownCoordinator(ShutdownState<T> state) {
        this.state = state;
    }

    /**
     * Returns another handle on the same shutdown state.
     *
     * @return a new handle; never changes state
     */
    public ShutdownCoordinator<T> copy() {
        return new ShutdownCoordinator<>(state);
    }

    /**
     * Triggers shutdown.
     *
     * <p>The first call records the reason, completes every trigger waiter and cancels every
     * cancel-on-shutdown operation. If no delay token is outstanding, shutdown also completes
     * immediately. Later calls change nothing and are rejected with the reason of the first.
     *
     * @param reason the shutdown reason
     * @return success, or {@link AlreadyTriggered} carrying the existing reason
     */
    public ShutdownResult<Void, T> triggerShutdown(T reason) {
        Optional<AlreadyTriggered<T>> rejection = state.trigger(reason);
        if (rejection.isPresent()) {
            return ShutdownResult.rejected(rejection.get());
        }
        return ShutdownResult.success();
    }

    /**
     * Checks if shutdown has been triggered.
     *
     * @return true once triggered
     */
    public boolean isTriggered() {
        return state.isTriggered();
    }

    /**
     * Checks if shutdown has completed.
     *
     * @return true once triggered and no delay token is outstanding
     */
    public boolean isCompleted() {
        return state.isCompleted();
    }

    /**
     * Returns the shutdown reason.
     *
     * @return the reason, or empty if shutdown has not been triggered
     */
    public Optional<T> shutdownReason() {
        return state.reason();
    }

    /**
     * Returns the current phase.
     *
     * @return the phase
     */
    public ShutdownPhase phase() {
        return state.phase();
    }

    /**
     * Returns the number of outstanding delay tokens, including those held by adapters.
     *
     * @return the delay count
     */
    public long delayCount() {
        return state.delayCount();
    }

    /**
     * Returns a future that completes with the reason once shutdown is triggered.
     *
     * <p>The future is already complete if shutdown was triggered. Cancelling it, or completing it
     * in any other way, removes its registration.
     *
     * <p>The coordinator holds the future weakly: dropping every reference to it, and to every
     * stage derived from it, abandons the wait and frees its registration once the future is
     * garbage collected. Keep a reference for as long as the result matters; for a callback that
     * must run on shutdown without anyone holding it, use a {@link ShutdownListener}.
     *
     * @return the waiter
     */
    public CompletableFuture<T> waitShutdownTriggered() {
        return state.newTriggerWaiter();
    }

    /**
     * Returns a future that completes with the reason once shutdown has completed.
     *
     * <p>Never completes before shutdown is triggered, even when no delay token was ever taken,
     * and never before every trigger waiter registered ahead of the trigger has been woken.
     * Cancelling or dropping the future removes its registration, as for {@link
     * #waitShutdownTriggered()}.
     *
     * @return the waiter
     */
    public CompletableFuture<T> waitShutdownComplete() {
        return state.newCompleteWaiter();
    }

    /**
     * Blocks until shutdown is triggered.
     *
     * @return the shutdown reason
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public T awaitShutdownTriggered() throws InterruptedException {
        return await(state.newTriggerWaiter());
    }

    /**
     * Blocks until shutdown is triggered or the timeout expires.
     *
     * @param timeout maximum time to wait
     * @return the shutdown reason, or empty on timeout
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public Optional<T> awaitShutdownTriggered(Duration timeout) throws InterruptedException {
        return await(state.newTriggerWaiter(), timeout);
    }

    /**
     * Blocks until shutdown has completed.
     *
     * @return the shutdown reason
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public T awaitShutdownComplete() throws InterruptedException {
        return await(state.newCompleteWaiter());
    }

    /**
     * Blocks until shutdown has completed or the timeout expires.
     *
     * @param timeout maximum time to wait
     * @return the shutdown reason, or empty on timeout
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public Optional<T> awaitShutdownComplete(Duration timeout) throws InterruptedException {
        return await(state.newCompleteWaiter(), timeout);
    }

    /**
     * Takes a token that keeps shutdown from completing until it is closed.
     *
     * <p>Succeeds while shutdown is running or triggered; only a completed shutdown rejects it.
     *
     * @return the token, or {@link AlreadyCompleted} if shutdown has completed
     */
    public ShutdownResult<DelayToken<T>, T> delayShutdownToken() {
        Optional<AlreadyCompleted<T>> rejection = state.acquireDelay();
        if (rejection.isPresent()) {
            return ShutdownResult.rejected(rejection.get());
        }
        return ShutdownResult.success(new DelayToken<>(state));
    }

    /**
     * Creates a token that triggers shutdown with the given reason when it is closed.
     *
     * @param reason the reason to trigger shutdown with
     * @return the token
     */
    public TriggerToken<T> triggerShutdownToken(T reason) {
        return new TriggerToken<>(state, reason);
    }

    /**
     * Wraps an operation so that it is cancelled when shutdown is triggered.
     *
     * @param operation the operation
     * @param <R> the operation's result type
     * @return the adapter
     * @see CancelOnShutdown
     */
    public <R> CancelOnShutdown<R, T> wrapCancel(CompletionStage<R> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        return CancelOnShutdown.start(state, operation);
    }

    /**
     * Wraps an operation so that shutdown can not complete before it finishes.
     *
     * @param operation the operation
     * @param <R> the operation's result type
     * @return the adapter, or {@link AlreadyCompleted} if shutdown has completed
     * @see DelayShutdown
     */
    public <R> ShutdownResult<DelayShutdown<R, T>, T> wrapDelayShutdown(
            CompletionStage<R> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        return delayShutdownToken().map(token -> token.wrapFuture(operation));
    }

    /**
     * Wraps an operation so that shutdown is triggered when it ends.
     *
     * @param operation the operation
     * @param reason the reason to trigger shutdown with
     * @param <R> the operation's result type
     * @return the adapter
     * @see TriggerOnCompletion
     */
    public <R> TriggerOnCompletion<R, T> wrapTriggerShutdown(
            CompletionStage<R> operation, T reason) {
        Objects.requireNonNull(operation, "operation must not be null");
        return triggerShutdownToken(reason).wrapFuture(operation);
    }

    /**
     * Registers a listener for shutdown events.
     *
     * <p>A listener added after a transition does not see it.
     *
     * @param listener the listener
     */
    public void addListener(ShutdownListener<? super T> listener) {
        state.addListener(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener
     * @return true if the listener was found and removed
     */
    public boolean removeListener(ShutdownListener<? super T> listener) {
        return state.removeListener(listener);
    }

    /** Exposes the shared state to tests in this package. */
    ShutdownState<T> state() {
        return state;
    }

    private static <T> T await(CompletableFuture<T> waiter) throws InterruptedException {
        try {
            return waiter.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Shutdown waiter failed", e.getCause());
        } finally {
            // Drops the registration when interrupted
            waiter.cancel(false);
        }
    }

    private static <T> Optional<T> await(CompletableFuture<T> waiter, Duration timeout)
            throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        try {
            return Optional.of(waiter.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Shutdown waiter failed", e.getCause());
        } finally {
            waiter.cancel(false);
        }
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ShutdownCoordinator<?> that && this.state == that.state;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(state);
    }

    @Override
    public String toString() {
        return "ShutdownCoordinator[" + state.name() + ":" + state.phase() + "]";
    }
}

package express.mvp.myra.shutdown;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An operation wrapped by a shutdown coordinator.
 *
 * <p>The adapter listens to one inner {@link CompletionStage} and exposes its own result through
 * {@link #future()}. Exactly one of these ends the adapter, decided by an atomic transition out of
 * {@link WrapState#PENDING}:
 *
 * <ul>
 *   <li>the inner operation finishes: {@link WrapState#INNER_DONE}, outcome passed through
 *   <li>shutdown cancels it (cancel-on-shutdown only): {@link WrapState#CANCELLED}
 *   <li>the adapter is abandoned through {@link #close()} or by cancelling {@link #future()}:
 *       {@link WrapState#CANCELLED}
 * </ul>
 *
 * <p>Leaving {@code PENDING} runs the adapter's settle step (release a delay token, fire a trigger
 * token, drop the shutdown registration) before the future completes. Giving up on the inner
 * operation cancels it with {@code cancel(true)} when it is a {@link Future}; other stages are
 * simply no longer listened to.
 *
 * @param <R> the operation's result type
 */
public abstract class WrappedOperation<R> implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(WrappedOperation.class.getName());

    private final AtomicReference<WrapState> state = new AtomicReference<>(WrapState.PENDING);

    private final CompletableFuture<R> result = new CompletableFuture<>();

    private final CompletionStage<R> operation;

    WrappedOperation(CompletionStage<R> operation) {
        this.operation = operation;
    }

    /** Starts listening to the operation and the result. Called once, after construction. */
    final void attach() {
        result.whenComplete(
                (value, error) -> {
                    if (result.isCancelled()) {
                        finishCancelled(null);
                    }
                });
        operation.whenComplete(this::operationDone);
    }

    /**
     * Returns the adapter's result.
     *
     * <p>Cancelling this future abandons the adapter, exactly like {@link #close()}.
     *
     * @return the result future
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "The result future is the adapter's output and is meant to be shared.")
    public CompletableFuture<R> future() {
        return result;
    }

    /**
     * Returns the current state.
     *
     * @return the state
     */
    public WrapState state() {
        return state.get();
    }

    /**
     * Checks if the adapter has settled.
     *
     * @return true once the state is terminal
     */
    public boolean isDone() {
        return state.get().isTerminal();
    }

    /**
     * Abandons the adapter.
     *
     * <p>If the operation is still pending, the adapter cancels it, settles, and cancels {@link
     * #future()}. Has no effect once the adapter has settled.
     */
    @Override
    public void close() {
        finishCancelled(null);
    }

    /**
     * Runs when the adapter leaves {@code PENDING}, before the result completes.
     *
     * <p>Runs exactly once, on whichever thread performed the transition.
     */
    abstract void settle();

    /** Checks if the inner operation has already produced its outcome. */
    final boolean operationFinished() {
        if (!(operation instanceof Future<?> future)) {
            return false;
        }
        try {
            return future.isDone();
        } catch (UnsupportedOperationException e) {
            // Minimal stages refuse the Future methods; only the callback reports completion
            return false;
        }
    }

    /**
     * Gives up on the inner operation.
     *
     * @param failure failure for the result, or null to cancel the result
     * @return true if this call performed the transition
     */
    final boolean finishCancelled(Throwable failure) {
        if (!state.compareAndSet(WrapState.PENDING, WrapState.CANCELLED)) {
            return false;
        }
        cancelOperation();
        settleQuietly();
        if (failure == null) {
            result.cancel(false);
        } else {
            result.completeExceptionally(failure);
        }
        return true;
    }

    private void cancelOperation() {
        if (!(operation instanceof Future<?> future)) {
            return;
        }
        try {
            future.cancel(true);
        } catch (UnsupportedOperationException e) {
            LOGGER.log(Level.FINE, "Operation of {0} can not be cancelled; abandoning it", this);
        }
    }

    private void operationDone(R value, Throwable error) {
        if (!state.compareAndSet(WrapState.PENDING, WrapState.INNER_DONE)) {
            return;
        }
        settleQuietly();
        if (error == null) {
            result.complete(value);
        } else {
            result.completeExceptionally(error);
        }
    }

    private void settleQuietly() {
        try {
            settle();
        } catch (RuntimeException e) {
            // The result must still complete; the failure has no other caller to go to
            LOGGER.log(Level.WARNING, "Settling " + this + " failed", e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + state.get() + "]";
    }
}

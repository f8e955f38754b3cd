package express.mvp.myra.shutdown;

import express.mvp.myra.shutdown.error.ShutdownCancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Operation that is cancelled when shutdown is triggered.
 *
 * <p>If the operation finishes first, its outcome is passed through unchanged. If shutdown is
 * triggered first, the operation is cancelled and {@link #future()} fails with a {@link
 * ShutdownCancellationException} carrying the shutdown reason. An operation that has already
 * produced its result when the trigger is observed keeps that result.
 *
 * <pre>{@code
 * while (true) {
 *     try {
 *         Socket client = coordinator.wrapCancel(acceptAsync(server)).future().join();
 *         handle(client);
 *     } catch (ShutdownCancellationException e) {
 *         break;
 *     }
 * }
 * }</pre>
 *
 * @param <R> the operation's result type
 * @param <T> the shutdown reason type
 * @see ShutdownCoordinator#wrapCancel(CompletionStage)
 */
public final class CancelOnShutdown<R, T> extends WrappedOperation<R> {

    /** Registration for the trigger; set once after construction. */
    private volatile CompletableFuture<T> signal;

    private CancelOnShutdown(CompletionStage<R> operation) {
        super(operation);
    }

    static <R, T> CancelOnShutdown<R, T> start(
            ShutdownState<T> state, CompletionStage<R> operation) {
        CancelOnShutdown<R, T> adapter = new CancelOnShutdown<>(operation);

        // Listen to the operation first, so an operation that is already done wins
        adapter.attach();
        if (adapter.isDone()) {
            return adapter;
        }

        CompletableFuture<T> trigger = state.newTriggerWaiter();
        adapter.signal = trigger;
        trigger.thenAccept(adapter::shutdownTriggered);
        if (adapter.isDone()) {
            // Settled while the registration was being made
            trigger.cancel(false);
        }
        return adapter;
    }

    private void shutdownTriggered(T reason) {
        if (operationFinished()) {
            return;
        }
        finishCancelled(new ShutdownCancellationException(reason));
    }

    @Override
    void settle() {
        CompletableFuture<T> trigger = signal;
        if (trigger != null) {
            trigger.cancel(false);
        }
    }
}

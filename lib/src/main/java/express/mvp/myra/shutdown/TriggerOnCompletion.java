package express.mvp.myra.shutdown;

import java.util.concurrent.CompletionStage;

/**
 * Operation whose end triggers shutdown.
 *
 * <p>Use it for vital work: when the operation completes, fails, or the adapter is abandoned,
 * shutdown is triggered with the adapter's reason (no-op if already triggered). The operation's
 * outcome is passed through unchanged.
 *
 * @param <R> the operation's result type
 * @param <T> the shutdown reason type
 * @see ShutdownCoordinator#wrapTriggerShutdown(CompletionStage, Object)
 * @see TriggerToken#wrapFuture(CompletionStage)
 */
public final class TriggerOnCompletion<R, T> extends WrappedOperation<R> {

    private final TriggerToken<T> token;

    private TriggerOnCompletion(TriggerToken<T> token, CompletionStage<R> operation) {
        super(operation);
        this.token = token;
    }

    static <R, T> TriggerOnCompletion<R, T> start(
            TriggerToken<T> token, CompletionStage<R> operation) {
        TriggerOnCompletion<R, T> adapter = new TriggerOnCompletion<>(token, operation);
        adapter.attach();
        return adapter;
    }

    /**
     * Returns the reason shutdown is triggered with.
     *
     * @return the reason
     */
    public T reason() {
        return token.reason();
    }

    @Override
    void settle() {
        token.close();
    }
}

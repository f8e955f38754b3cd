package express.mvp.myra.shutdown;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.CompletionStage;

/**
 * Operation that keeps shutdown from completing until it finishes.
 *
 * <p>Holds a {@link DelayToken} for as long as the operation runs. When the operation completes,
 * normally or exceptionally, the token is released and the outcome is passed through unchanged.
 * Abandoning the adapter releases the token at once.
 *
 * @param <R> the operation's result type
 * @param <T> the shutdown reason type
 * @see ShutdownCoordinator#wrapDelayShutdown(CompletionStage)
 * @see DelayToken#wrapFuture(CompletionStage)
 */
public final class DelayShutdown<R, T> extends WrappedOperation<R> {

    private final DelayToken<T> token;

    private DelayShutdown(DelayToken<T> token, CompletionStage<R> operation) {
        super(operation);
        this.token = token;
    }

    static <R, T> DelayShutdown<R, T> start(DelayToken<T> token, CompletionStage<R> operation) {
        DelayShutdown<R, T> adapter = new DelayShutdown<>(token, operation);
        adapter.attach();
        return adapter;
    }

    /**
     * Returns the delay token held by this adapter.
     *
     * @return the token, released once the adapter is done
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "The token is exposed so callers can check whether it was released.")
    public DelayToken<T> token() {
        return token;
    }

    @Override
    void settle() {
        token.close();
    }
}

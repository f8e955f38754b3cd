package express.mvp.myra.shutdown;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.CompletableFuture;

/**
 * Future handed out for a shutdown wait.
 *
 * <p>The waiter registry holds waiters weakly, so a wait ends when its caller drops it. Stages
 * derived from a waiter ({@code thenApply}, {@code thenRun}, {@code whenComplete}, ...) hold the
 * waiter strongly, so a caller that keeps only the last stage of a chain still keeps the wait
 * alive.
 *
 * @param <T> the shutdown reason type
 */
final class WaiterFuture<T> extends CompletableFuture<T> {

    /** The registered waiter this stage derives from, or null for the waiter itself. */
    @SuppressFBWarnings(
            value = "URF_UNREAD_FIELD",
            justification = "Only held to keep the registered waiter reachable.")
    private final CompletableFuture<?> source;

    WaiterFuture() {
        this.source = null;
    }

    private WaiterFuture(CompletableFuture<?> source) {
        this.source = source;
    }

    @Override
    public <U> CompletableFuture<U> newIncompleteFuture() {
        return new WaiterFuture<>(source == null ? this : source);
    }
}

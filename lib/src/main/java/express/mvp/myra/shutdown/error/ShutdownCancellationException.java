package express.mvp.myra.shutdown.error;

import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Failure of an operation that was cancelled because shutdown was triggered.
 *
 * <p>A cancel-on-shutdown adapter completes its future exceptionally with this exception when the
 * shutdown signal arrives before the wrapped operation finishes. It extends {@link
 * CancellationException}, so {@code join()} and {@code get()} rethrow it directly and code that
 * already handles cancellation keeps working.
 *
 * <pre>{@code
 * coordinator.wrapCancel(connection.readAsync())
 *         .future()
 *         .exceptionally(e -> {
 *             if (e instanceof ShutdownCancellationException cancelled) {
 *                 logger.info("read aborted: " + cancelled.reason());
 *             }
 *             return null;
 *         });
 * }</pre>
 */
public class ShutdownCancellationException extends CancellationException {

    private static final long serialVersionUID = 1L;

    /** The shutdown reason. Not serialized. */
    private final transient Object reason;

    /**
     * Constructs the exception with the shutdown reason.
     *
     * @param reason the reason shutdown was triggered with
     */
    public ShutdownCancellationException(Object reason) {
        super("operation cancelled by shutdown (reason: " + reason + ")");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * Returns the reason shutdown was triggered with.
     *
     * @return the reason, or null after deserialization
     */
    public Object reason() {
        return reason;
    }

    /**
     * Returns the reason cast to the expected type.
     *
     * @param type the reason type the coordinator was created with
     * @param <T> the reason type
     * @return the reason
     * @throws ClassCastException if the reason is not of the given type
     */
    public <T> T reason(Class<T> type) {
        return type.cast(reason);
    }
}

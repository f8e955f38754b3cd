package express.mvp.myra.shutdown.error;

import java.util.Objects;

/**
 * Returned by {@code triggerShutdown} when shutdown had already been triggered.
 *
 * <p>Only the first trigger succeeds. Later callers receive this record with the reason of the
 * first trigger.
 *
 * @param reason the reason recorded by the first trigger
 * @param <T> the shutdown reason type
 */
public record AlreadyTriggered<T>(T reason) implements ShutdownRejection<T> {

    /**
     * Creates the rejection.
     *
     * @param reason the existing shutdown reason
     * @throws NullPointerException if reason is null
     */
    public AlreadyTriggered {
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String message() {
        return "shutdown has already been triggered (reason: " + reason + ")";
    }
}

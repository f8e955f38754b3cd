package express.mvp.myra.shutdown.error;

import java.util.Objects;

/**
 * Returned when a caller tries to delay a shutdown that has already completed.
 *
 * <p>It is too late to register cleanup work at this point. Callers usually give up on the cleanup
 * and let their unit of work end.
 *
 * @param reason the reason the shutdown was triggered with
 * @param <T> the shutdown reason type
 */
public record AlreadyCompleted<T>(T reason) implements ShutdownRejection<T> {

    /**
     * Creates the rejection.
     *
     * @param reason the existing shutdown reason
     * @throws NullPointerException if reason is null
     */
    public AlreadyCompleted {
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String message() {
        return "shutdown has already completed, can not delay shutdown completion (reason: "
                + reason
                + ")";
    }
}

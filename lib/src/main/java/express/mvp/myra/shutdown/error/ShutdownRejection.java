package express.mvp.myra.shutdown.error;

/**
 * Reason a coordinator refused a request.
 *
 * <p>A rejection is an ordinary value: the coordinator's state is unaffected by it, and the caller
 * decides what to do next. Every rejection carries the shutdown reason that was already recorded,
 * so the caller can see what actually happened instead of the reason it tried to use.
 *
 * @param <T> the shutdown reason type
 * @see AlreadyTriggered
 * @see AlreadyCompleted
 * @see ShutdownResult
 */
public interface ShutdownRejection<T> {

    /**
     * Returns the shutdown reason recorded by the coordinator.
     *
     * @return the existing reason (never null)
     */
    T reason();

    /**
     * Returns a human-readable description of the rejection.
     *
     * @return the description
     */
    String message();
}

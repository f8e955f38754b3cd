package express.mvp.myra.shutdown.error;

/**
 * Unchecked exception thrown when a rejected {@link ShutdownResult} is unwrapped.
 *
 * <p>The coordinator never throws this on its own. It only surfaces when a caller calls {@link
 * ShutdownResult#value()} without checking {@link ShutdownResult#isSuccess()} first, which is a
 * logic error in the caller.
 *
 * <pre>{@code
 * try (DelayToken<String> token = coordinator.delayShutdownToken().value()) {
 *     flushBuffers();
 * } catch (ShutdownRejectedException e) {
 *     logger.warning("Too late to flush: " + e.getMessage());
 * }
 * }</pre>
 */
public class ShutdownRejectedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /** The rejection that was unwrapped. Not serialized. */
    private final transient ShutdownRejection<?> rejection;

    /**
     * Constructs the exception for a rejection.
     *
     * @param rejection the rejection that was unwrapped
     */
    public ShutdownRejectedException(ShutdownRejection<?> rejection) {
        super(rejection.message());
        this.rejection = rejection;
    }

    /**
     * Returns the rejection this exception was created for.
     *
     * @return the rejection, or null after deserialization
     */
    public ShutdownRejection<?> rejection() {
        return rejection;
    }
}

package express.mvp.myra.shutdown;

/**
 * Callback interface for shutdown events.
 *
 * <p>Listeners are informational: they observe transitions but can not influence them.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ShutdownCoordinator<String> coordinator = new ShutdownCoordinator<>();
 * coordinator.addListener(new ShutdownListener<String>() {
 *     @Override
 *     public void onPhaseChange(ShutdownPhase previous, ShutdownPhase current, String reason) {
 *         logger.info("Shutdown phase: " + previous + " -> " + current + " (" + reason + ")");
 *     }
 *
 *     @Override
 *     public void onDrainProgress(long remainingDelays, String reason) {
 *         logger.fine("Waiting for " + remainingDelays + " cleanup tasks");
 *     }
 * });
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Callbacks run on whichever thread caused the event, outside the coordinator's lock. Events
 * raised by different threads are not ordered with respect to each other, so implementations must
 * be thread-safe. A listener that throws is logged and skipped.
 *
 * @param <T> the shutdown reason type
 * @see ShutdownCoordinator#addListener(ShutdownListener)
 */
public interface ShutdownListener<T> {

    /**
     * Called when the shutdown phase changes.
     *
     * <p>Called once for {@code RUNNING -> TRIGGERED} and once for {@code TRIGGERED -> COMPLETED}.
     *
     * @param previousPhase the phase being exited
     * @param currentPhase the phase being entered
     * @param reason the shutdown reason
     */
    void onPhaseChange(ShutdownPhase previousPhase, ShutdownPhase currentPhase, T reason);

    /**
     * Called when a delay token is released after shutdown was triggered.
     *
     * @param remainingDelays number of delay tokens still outstanding
     * @param reason the shutdown reason
     */
    default void onDrainProgress(long remainingDelays, T reason) {
        // Default: no-op - override to monitor drain progress
    }
}

package express.mvp.myra.shutdown;

/**
 * Represents the phases of a coordinated shutdown.
 *
 * <p>A coordinator moves through these phases in order and never goes back.
 *
 * <h2>Phase Transitions</h2>
 *
 * <pre>
 * RUNNING ──▶ TRIGGERED ──▶ COMPLETED
 *    │                          ▲
 *    └──────────────────────────┘  (trigger with no outstanding delay tokens)
 * </pre>
 *
 * <p>Even when a trigger completes the shutdown at once, listeners see both transitions.
 *
 * <h2>Phase Descriptions</h2>
 *
 * <ul>
 *   <li>{@link #RUNNING}: No shutdown yet - delay tokens can be taken freely
 *   <li>{@link #TRIGGERED}: Shutdown signalled - waiting for delay tokens to be released
 *   <li>{@link #COMPLETED}: All cleanup finished - terminal phase
 * </ul>
 *
 * @see ShutdownCoordinator
 */
public enum ShutdownPhase {

    /** Normal operation, no shutdown has been triggered. */
    RUNNING(0, "Running"),

    /**
     * Shutdown has been triggered.
     *
     * <p>During this phase:
     * <ul>
     *   <li>Trigger waiters have been woken and cancel-on-shutdown operations cancelled
     *   <li>Delay tokens can still be taken
     *   <li>Completion waits for every outstanding delay token
     * </ul>
     */
    TRIGGERED(1, "Triggered"),

    /**
     * Shutdown is complete.
     *
     * <p>No delay token is outstanding and none can be taken any more.
     */
    COMPLETED(2, "Completed");

    private final int order;
    private final String displayName;

    ShutdownPhase(int order, String displayName) {
        this.order = order;
        this.displayName = displayName;
    }

    /**
     * Returns the phase matching a pair of state flags.
     *
     * @param triggered whether shutdown has been triggered
     * @param completed whether shutdown has completed
     * @return the phase
     * @throws IllegalArgumentException if completed is set without triggered
     */
    public static ShutdownPhase of(boolean triggered, boolean completed) {
        if (completed && !triggered) {
            throw new IllegalArgumentException("Shutdown can not complete before it is triggered");
        }
        if (completed) {
            return COMPLETED;
        }
        return triggered ? TRIGGERED : RUNNING;
    }

    /**
     * Returns the numeric order of this phase for comparison.
     *
     * @return the phase order (0 = RUNNING, 2 = COMPLETED)
     */
    public int order() {
        return order;
    }

    /**
     * Returns a human-readable name for this phase.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if this phase is before the specified phase.
     *
     * @param other the phase to compare with
     * @return true if this phase comes before the other
     */
    public boolean isBefore(ShutdownPhase other) {
        return this.order < other.order;
    }

    /**
     * Checks if this phase is at or after the specified phase.
     *
     * @param other the phase to compare with
     * @return true if this phase is at or after the other
     */
    public boolean isAtOrAfter(ShutdownPhase other) {
        return this.order >= other.order;
    }

    /**
     * Checks if shutdown has been triggered.
     *
     * @return true in TRIGGERED and COMPLETED
     */
    public boolean isTriggered() {
        return this.order > RUNNING.order;
    }

    /**
     * Checks if shutdown is complete.
     *
     * @return true only in {@link #COMPLETED}
     */
    public boolean isCompleted() {
        return this == COMPLETED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

package express.mvp.myra.shutdown;

/**
 * State of a wrapped operation.
 *
 * <pre>
 * PENDING ──▶ INNER_DONE   (the wrapped operation finished first)
 *    │
 *    └─────▶ CANCELLED    (shutdown cancelled it, or the adapter was abandoned)
 * </pre>
 *
 * @see WrappedOperation
 */
public enum WrapState {

    /** The wrapped operation is still running. */
    PENDING,

    /** The wrapped operation finished and its outcome was passed through. */
    INNER_DONE,

    /** The adapter gave up on the wrapped operation. */
    CANCELLED;

    /**
     * Checks if this is a final state.
     *
     * @return true for INNER_DONE and CANCELLED
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}

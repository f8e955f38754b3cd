/**
 * Graceful shutdown coordination for concurrent programs.
 *
 * <p>A {@link express.mvp.myra.shutdown.ShutdownCoordinator} broadcasts a shutdown signal, waits
 * for registered cleanup work before declaring shutdown complete, and can trigger shutdown when a
 * vital operation ends. It does no I/O and runs no tasks itself; waiting is expressed with {@link
 * java.util.concurrent.CompletableFuture} or blocking {@code await} methods.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.shutdown.ShutdownCoordinator} - handle on the shared shutdown
 *       state
 *   <li>{@link express.mvp.myra.shutdown.DelayToken} - holds off shutdown completion while open
 *   <li>{@link express.mvp.myra.shutdown.TriggerToken} - triggers shutdown when closed or
 *       abandoned
 *   <li>{@link express.mvp.myra.shutdown.CancelOnShutdown}, {@link
 *       express.mvp.myra.shutdown.DelayShutdown}, {@link
 *       express.mvp.myra.shutdown.TriggerOnCompletion} - adapters around asynchronous operations
 *   <li>{@link express.mvp.myra.shutdown.ShutdownPhase} - RUNNING, TRIGGERED, COMPLETED
 *   <li>{@link express.mvp.myra.shutdown.ShutdownListener} - callbacks for phase changes
 * </ul>
 *
 * @see express.mvp.myra.shutdown.error.ShutdownResult
 */
package express.mvp.myra.shutdown;

/**
 * Results and failures reported by the shutdown coordinator.
 *
 * <p>Refused requests are values, not exceptions: {@link
 * express.mvp.myra.shutdown.error.ShutdownResult} holds either the requested value or a {@link
 * express.mvp.myra.shutdown.error.ShutdownRejection}.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.shutdown.error.AlreadyTriggered} - a second trigger lost to the
 *       first one
 *   <li>{@link express.mvp.myra.shutdown.error.AlreadyCompleted} - too late to delay completion
 *   <li>{@link express.mvp.myra.shutdown.error.ShutdownCancellationException} - failure of an
 *       operation cancelled by the shutdown signal
 *   <li>{@link express.mvp.myra.shutdown.error.ShutdownRejectedException} - thrown when a caller
 *       unwraps a rejected result
 * </ul>
 */
package express.mvp.myra.shutdown.error;

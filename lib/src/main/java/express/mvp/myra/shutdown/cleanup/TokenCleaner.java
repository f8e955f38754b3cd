package express.mvp.myra.shutdown.cleanup;

import java.lang.ref.Cleaner;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Releases shutdown tokens that were abandoned without being closed.
 *
 * <p>Tokens are {@link AutoCloseable} and should be closed explicitly, usually with
 * try-with-resources. A token that becomes unreachable while still open is released by this
 * cleaner instead, so an exception path or a forgotten {@code close()} can neither hold shutdown
 * completion forever nor lose a trigger.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * final class LeaseToken implements AutoCloseable {
 *     private final TokenCleaner.Registration registration;
 *
 *     LeaseToken(Lease lease) {
 *         // The action must not capture 'this'
 *         this.registration = TokenCleaner.register(this, "LeaseToken", true, lease::release);
 *     }
 *
 *     @Override
 *     public void close() {
 *         registration.release();
 *     }
 * }
 * }</pre>
 *
 * <h2>Important Constraints</h2>
 *
 * <ul>
 *   <li>Release actions <b>must not</b> reference the registered object (prevents GC)
 *   <li>A release action runs at most once, whichever of explicit release and GC comes first
 *   <li>Abandoned releases run on {@link ForkJoinPool#commonPool()}, not on the thread that
 *       created the token and not on the shared cleaner thread. A release that triggers shutdown
 *       completes waiters, cancels wrapped operations and notifies listeners there, so a slow
 *       callback ties up a pool thread instead of stalling every other token's cleanup
 * </ul>
 *
 * @see java.lang.ref.Cleaner
 */
public final class TokenCleaner {

    private static final Logger LOGGER = Logger.getLogger(TokenCleaner.class.getName());

    /** Shared cleaner for all tokens. */
    private static final Cleaner CLEANER = Cleaner.create();

    /** Counter for registrations. */
    private static final AtomicLong registrations = new AtomicLong(0);

    /** Counter for releases through {@link Registration#release()}. */
    private static final AtomicLong explicitReleases = new AtomicLong(0);

    /** Counter for releases run by the cleaner after the owner became unreachable. */
    private static final AtomicLong abandonedReleases = new AtomicLong(0);

    private TokenCleaner() {
        // Utility class
    }

    /**
     * Registers a release action for an owner object.
     *
     * <p>The action runs either when {@link Registration#release()} is called or after the owner
     * becomes phantom reachable, whichever happens first, and never more than once.
     *
     * @param owner the object whose abandonment should trigger the release
     * @param description short description used in log messages
     * @param warnOnAbandon whether to log a warning when the owner is abandoned
     * @param releaseAction the action to run (must not reference owner)
     * @return the registration used for explicit release
     */
    public static Registration register(
            Object owner, String description, boolean warnOnAbandon, Runnable releaseAction) {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(releaseAction, "releaseAction must not be null");

        ReleaseAction action = new ReleaseAction(description, warnOnAbandon, releaseAction);
        Cleaner.Cleanable cleanable = CLEANER.register(owner, action);
        registrations.incrementAndGet();
        return new Registration(cleanable, action);
    }

    /**
     * Returns the total number of registrations.
     *
     * @return registration count
     */
    public static long getRegistrationCount() {
        return registrations.get();
    }

    /**
     * Returns the number of explicit releases.
     *
     * @return explicit release count
     */
    public static long getExplicitReleaseCount() {
        return explicitReleases.get();
    }

    /**
     * Returns the number of releases run for abandoned owners.
     *
     * @return abandoned release count
     */
    public static long getAbandonedReleaseCount() {
        return abandonedReleases.get();
    }

    /**
     * Returns the number of registrations not released yet.
     *
     * @return active registration count
     */
    public static long getActiveCount() {
        return registrations.get() - explicitReleases.get() - abandonedReleases.get();
    }

    /** Resets all statistics (for testing). */
    public static void resetStatistics() {
        registrations.set(0);
        explicitReleases.set(0);
        abandonedReleases.set(0);
    }

    /** Wrapper that records whether the release was explicit or caused by abandonment. */
    private static final class ReleaseAction implements Runnable {
        private final String description;
        private final boolean warnOnAbandon;
        private final Runnable delegate;
        private final AtomicBoolean released = new AtomicBoolean(false);
        private volatile boolean explicit = false;

        ReleaseAction(String description, boolean warnOnAbandon, Runnable delegate) {
            this.description = description;
            this.warnOnAbandon = warnOnAbandon;
            this.delegate = delegate;
        }

        void markExplicit() {
            this.explicit = true;
        }

        boolean isReleased() {
            return released.get();
        }

        @Override
        public void run() {
            if (!released.compareAndSet(false, true)) {
                return;
            }

            if (explicit) {
                explicitReleases.incrementAndGet();
                delegate.run();
                return;
            }

            abandonedReleases.incrementAndGet();
            if (warnOnAbandon) {
                LOGGER.log(
                        Level.WARNING,
                        "{0} was abandoned without being closed; releasing it now",
                        description);
            }
            try {
                ForkJoinPool.commonPool().execute(this::runAbandoned);
            } catch (RejectedExecutionException e) {
                LOGGER.log(
                        Level.WARNING,
                        "Common pool rejected the release of abandoned " + description
                                + "; releasing on the cleaner thread",
                        e);
                runAbandoned();
            }
        }

        private void runAbandoned() {
            try {
                delegate.run();
            } catch (RuntimeException e) {
                // Nobody can observe a failure of an abandoned release
                LOGGER.log(Level.WARNING, "Release of abandoned " + description + " failed", e);
            }
        }
    }

    /** Handle for releasing a registered owner explicitly. */
    public static final class Registration implements AutoCloseable {
        private final Cleaner.Cleanable cleanable;
        private final ReleaseAction action;

        Registration(Cleaner.Cleanable cleanable, ReleaseAction action) {
            this.cleanable = cleanable;
            this.action = action;
        }

        /**
         * Runs the release action now, unless it already ran.
         *
         * <p>Exceptions thrown by the action propagate to the caller.
         */
        public void release() {
            action.markExplicit();
            cleanable.clean();
        }

        /**
         * Checks if the release action has run.
         *
         * @return true once released, explicitly or by the cleaner
         */
        public boolean isReleased() {
            return action.isReleased();
        }

        @Override
        public void close() {
            release();
        }
    }
}

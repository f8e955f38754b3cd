package express.mvp.myra.shutdown;

import express.mvp.myra.shutdown.error.AlreadyCompleted;
import express.mvp.myra.shutdown.error.AlreadyTriggered;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State shared by every handle, token and adapter of one coordinator.
 *
 * <p>All fields are guarded by a single lock. Transitions happen under the lock; waiter futures
 * and listeners are completed and notified after it is released, so no user code ever runs while
 * the lock is held.
 *
 * <h2>Transitions</h2>
 *
 * <pre>
 * trigger(reason)      triggered := true, reason := reason
 *                      delayCount == 0  ⇒ completed := true
 * releaseDelay()       delayCount -= 1
 *                      delayCount == 0 ∧ triggered  ⇒ completed := true
 * acquireDelay()       rejected once completed, otherwise delayCount += 1
 * </pre>
 *
 * <p>Completion is evaluated on both events that can cause it, so a completion waiter registered
 * before the trigger is woken even when no delay token was ever taken.
 *
 * <p>Completion is never delivered while trigger waiters are still being woken. If a trigger
 * waiter's callback (or a listener) releases the last delay token, the release only records the
 * completion; the triggering thread delivers it once every trigger waiter has been woken.
 *
 * @param <T> the shutdown reason type
 */
final class ShutdownState<T> {

    private static final Logger LOGGER = Logger.getLogger(ShutdownState.class.getName());

    private final ShutdownConfig config;

    private final ReentrantLock lock = new ReentrantLock();

    /** Waiters for the trigger. */
    private final WaiterList<T> triggerWaiters = new WaiterList<>();

    /** Waiters for completion. */
    private final WaiterList<T> completeWaiters = new WaiterList<>();

    /** Registered listeners. Thread-safe for concurrent modification. */
    private final List<ShutdownListener<? super T>> listeners = new CopyOnWriteArrayList<>();

    private boolean triggered;

    /** Set together with {@link #triggered}, never changed afterwards. */
    private T reason;

    private boolean completed;

    private long delayCount;

    /** Set while the triggering thread wakes trigger waiters and notifies listeners. */
    private boolean wakingTrigger;

    /** Completion happened while {@link #wakingTrigger}; its delivery is left to the trigger. */
    private boolean completionDeferred;

    ShutdownState(ShutdownConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    ShutdownConfig config() {
        return config;
    }

    String name() {
        return config.name();
    }

    /**
     * Triggers shutdown unless it was triggered before.
     *
     * @param reason the shutdown reason
     * @return empty on success, otherwise the rejection carrying the existing reason
     */
    Optional<AlreadyTriggered<T>> trigger(T reason) {
        Objects.requireNonNull(reason, "reason must not be null");

        List<CompletableFuture<T>> triggerWake;
        long outstanding;

        lock.lock();
        try {
            if (triggered) {
                return Optional.of(new AlreadyTriggered<>(this.reason));
            }
            triggered = true;
            this.reason = reason;
            triggerWake = triggerWaiters.drain();
            outstanding = delayCount;
            wakingTrigger = true;
            if (delayCount == 0) {
                completed = true;
                completionDeferred = true;
            }
        } finally {
            lock.unlock();
        }

        LOGGER.log(
                Level.INFO,
                "[{0}] Shutdown triggered: {1} ({2} delay token(s) outstanding)",
                new Object[] {name(), reason, outstanding});
        try {
            notifyPhaseChange(ShutdownPhase.RUNNING, ShutdownPhase.TRIGGERED, reason);
            wake(triggerWake, reason);
        } finally {
            finishTriggerWake(reason);
        }
        return Optional.empty();
    }

    /** Ends the trigger wake and delivers a completion that happened during it. */
    private void finishTriggerWake(T reason) {
        List<CompletableFuture<T>> completeWake = List.of();
        boolean deliver;

        lock.lock();
        try {
            wakingTrigger = false;
            deliver = completionDeferred;
            if (deliver) {
                completionDeferred = false;
                completeWake = completeWaiters.drain();
            }
        } finally {
            lock.unlock();
        }

        if (deliver) {
            deliverCompletion(completeWake, reason);
        }
    }

    private void deliverCompletion(List<CompletableFuture<T>> completeWake, T reason) {
        LOGGER.log(Level.INFO, "[{0}] Shutdown completed: {1}", new Object[] {name(), reason});
        notifyPhaseChange(ShutdownPhase.TRIGGERED, ShutdownPhase.COMPLETED, reason);
        wake(completeWake, reason);
    }

    /**
     * Takes one unit of delay unless shutdown has completed.
     *
     * @return empty on success, otherwise the rejection carrying the shutdown reason
     */
    Optional<AlreadyCompleted<T>> acquireDelay() {
        long outstanding;
        lock.lock();
        try {
            if (completed) {
                return Optional.of(new AlreadyCompleted<>(reason));
            }
            outstanding = ++delayCount;
        } finally {
            lock.unlock();
        }

        LOGGER.log(
                Level.FINE,
                "[{0}] Delay token acquired ({1} outstanding)",
                new Object[] {name(), outstanding});
        return Optional.empty();
    }

    /**
     * Gives back one unit of delay and completes shutdown if it was the last one.
     *
     * @throws IllegalStateException if no delay is outstanding
     */
    void releaseDelay() {
        List<CompletableFuture<T>> completeWake = List.of();
        boolean completedNow = false;
        boolean draining;
        long remaining;
        T currentReason;

        lock.lock();
        try {
            if (delayCount == 0) {
                throw new IllegalStateException("No delay token is outstanding");
            }
            remaining = --delayCount;
            draining = triggered;
            currentReason = reason;
            if (remaining == 0 && triggered && !completed) {
                completed = true;
                if (wakingTrigger) {
                    completionDeferred = true;
                } else {
                    completedNow = true;
                    completeWake = completeWaiters.drain();
                }
            }
        } finally {
            lock.unlock();
        }

        LOGGER.log(
                Level.FINE,
                "[{0}] Delay token released ({1} outstanding)",
                new Object[] {name(), remaining});
        if (draining) {
            notifyDrainProgress(remaining, currentReason);
        }
        if (completedNow) {
            deliverCompletion(completeWake, currentReason);
        }
    }

    /**
     * Creates a future that completes with the reason once shutdown is triggered.
     *
     * @return the waiter, already complete if shutdown was triggered
     */
    CompletableFuture<T> newTriggerWaiter() {
        return newWaiter(triggerWaiters, false);
    }

    /**
     * Creates a future that completes with the reason once shutdown has completed.
     *
     * @return the waiter, already complete if shutdown has completed
     */
    CompletableFuture<T> newCompleteWaiter() {
        return newWaiter(completeWaiters, true);
    }

    private CompletableFuture<T> newWaiter(WaiterList<T> waiters, boolean forCompletion) {
        CompletableFuture<T> waiter = new WaiterFuture<>();
        WaiterList.Key<T> key = null;
        T ready = null;

        // The predicate is checked under the same lock the transition takes, so a waiter is
        // either registered before the drain or sees the new state here.
        lock.lock();
        try {
            if (forCompletion ? completed && !completionDeferred : triggered) {
                ready = reason;
            } else {
                key = waiters.register(waiter);
            }
        } finally {
            lock.unlock();
        }

        if (ready != null) {
            waiter.complete(ready);
            return waiter;
        }

        // Cancelled, timed out or completed by the consumer: free the slot
        WaiterList.Key<T> registered = key;
        waiter.whenComplete((value, error) -> deregister(waiters, registered));
        return waiter;
    }

    private void deregister(WaiterList<T> waiters, WaiterList.Key<T> key) {
        lock.lock();
        try {
            waiters.deregister(key);
        } finally {
            lock.unlock();
        }
    }

    boolean isTriggered() {
        lock.lock();
        try {
            return triggered;
        } finally {
            lock.unlock();
        }
    }

    boolean isCompleted() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    Optional<T> reason() {
        lock.lock();
        try {
            return Optional.ofNullable(reason);
        } finally {
            lock.unlock();
        }
    }

    ShutdownPhase phase() {
        lock.lock();
        try {
            return ShutdownPhase.of(triggered, completed);
        } finally {
            lock.unlock();
        }
    }

    long delayCount() {
        lock.lock();
        try {
            return delayCount;
        } finally {
            lock.unlock();
        }
    }

    int triggerWaiterCount() {
        lock.lock();
        try {
            return triggerWaiters.size();
        } finally {
            lock.unlock();
        }
    }

    int completeWaiterCount() {
        lock.lock();
        try {
            return completeWaiters.size();
        } finally {
            lock.unlock();
        }
    }

    int triggerWaiterSlots() {
        lock.lock();
        try {
            return triggerWaiters.totalSlots();
        } finally {
            lock.unlock();
        }
    }

    void addListener(ShutdownListener<? super T> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    boolean removeListener(ShutdownListener<? super T> listener) {
        return listeners.remove(listener);
    }

    /** Completes waiters, on the wake-up executor if one is configured. */
    private void wake(List<CompletableFuture<T>> waiters, T value) {
        if (waiters.isEmpty()) {
            return;
        }
        Executor executor = config.wakeupExecutor().orElse(null);
        for (CompletableFuture<T> waiter : waiters) {
            if (executor == null) {
                waiter.complete(value);
                continue;
            }
            try {
                executor.execute(() -> waiter.complete(value));
            } catch (RejectedExecutionException e) {
                LOGGER.log(
                        Level.WARNING,
                        "[" + name() + "] Wake-up executor rejected a waiter; completing inline",
                        e);
                waiter.complete(value);
            }
        }
    }

    private void notifyPhaseChange(ShutdownPhase previous, ShutdownPhase current, T value) {
        for (ShutdownListener<? super T> listener : listeners) {
            try {
                listener.onPhaseChange(previous, current, value);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "[" + name() + "] Shutdown listener failed", e);
            }
        }
    }

    private void notifyDrainProgress(long remaining, T value) {
        for (ShutdownListener<? super T> listener : listeners) {
            try {
                listener.onDrainProgress(remaining, value);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "[" + name() + "] Shutdown listener failed", e);
            }
        }
    }
}

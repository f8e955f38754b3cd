package express.mvp.myra.shutdown;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.shutdown.error.AlreadyCompleted;
import express.mvp.myra.shutdown.error.AlreadyTriggered;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * Unit tests for {@link ShutdownState}.
 */
@DisplayName("ShutdownState")
class ShutdownStateTest {

    private static ShutdownState<String> newState() {
        return new ShutdownState<>(ShutdownConfig.defaults());
    }

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @Test
        @DisplayName("trigger returns the existing reason when repeated")
        void trigger_repeated_returnsExistingReason() {
            ShutdownState<String> state = newState();

            assertEquals(Optional.empty(), state.trigger("a"));
            Optional<AlreadyTriggered<String>> again = state.trigger("b");

            assertEquals(Optional.of(new AlreadyTriggered<>("a")), again);
        }

        @Test
        @DisplayName("acquireDelay is rejected only after completion")
        void acquireDelay_rejectedAfterCompletion() {
            ShutdownState<String> state = newState();
            assertEquals(Optional.empty(), state.acquireDelay());
            state.trigger("stop");
            assertEquals(Optional.empty(), state.acquireDelay());

            state.releaseDelay();
            state.releaseDelay();

            assertEquals(Optional.of(new AlreadyCompleted<>("stop")), state.acquireDelay());
        }

        @Test
        @DisplayName("releaseDelay without an outstanding delay throws")
        void releaseDelay_withoutDelay_throws() {
            ShutdownState<String> state = newState();

            assertThrows(IllegalStateException.class, state::releaseDelay);
            assertEquals(0, state.delayCount());
        }

        @Test
        @DisplayName("Phase follows the flags")
        void phase_followsFlags() {
            ShutdownState<String> state = newState();
            assertEquals(ShutdownPhase.RUNNING, state.phase());

            state.acquireDelay();
            state.trigger("stop");
            assertEquals(ShutdownPhase.TRIGGERED, state.phase());

            state.releaseDelay();
            assertEquals(ShutdownPhase.COMPLETED, state.phase());
        }
    }

    @Nested
    @DisplayName("Waiter registry")
    class WaiterRegistryTests {

        @Test
        @DisplayName("Pending waiters are counted")
        void pendingWaiters_areCounted() {
            ShutdownState<String> state = newState();
            state.newTriggerWaiter();
            state.newTriggerWaiter();
            state.newCompleteWaiter();

            assertEquals(2, state.triggerWaiterCount());
            assertEquals(1, state.completeWaiterCount());
        }

        @Test
        @DisplayName("Trigger drains trigger waiters and keeps completion waiters while delayed")
        void trigger_drainsTriggerWaitersOnly() {
            ShutdownState<String> state = newState();
            state.acquireDelay();
            state.newTriggerWaiter();
            state.newCompleteWaiter();

            state.trigger("stop");

            assertEquals(0, state.triggerWaiterCount());
            assertEquals(1, state.completeWaiterCount());
        }

        @Test
        @DisplayName("Consumer-completed waiter releases its slot")
        void consumerCompleted_releasesSlot() {
            ShutdownState<String> state = newState();
            CompletableFuture<String> waiter = state.newTriggerWaiter();

            waiter.complete("not from shutdown");

            assertEquals(0, state.triggerWaiterCount());
        }

        @Test
        @DisplayName("Waiters created after the transition are not registered")
        void lateWaiters_notRegistered() {
            ShutdownState<String> state = newState();
            state.trigger("stop");

            assertTrue(state.newTriggerWaiter().isDone());
            assertTrue(state.newCompleteWaiter().isDone());
            assertEquals(0, state.triggerWaiterSlots());
        }
    }

    @Nested
    @DisplayName("Wake-up executor")
    class WakeupExecutorTests {

        @Test
        @DisplayName("Waiters are completed through the configured executor")
        void waiters_completedOnExecutor() {
            AtomicInteger executions = new AtomicInteger();
            ShutdownState<String> state = new ShutdownState<>(ShutdownConfig.builder()
                    .wakeupExecutor(task -> {
                        executions.incrementAndGet();
                        task.run();
                    })
                    .build());
            CompletableFuture<String> first = state.newTriggerWaiter();
            CompletableFuture<String> second = state.newCompleteWaiter();

            state.trigger("stop");

            assertEquals("stop", first.join());
            assertEquals("stop", second.join());
            assertEquals(2, executions.get());
        }

        @Test
        @Timeout(5)
        @DisplayName("Waiter callbacks run on the executor thread")
        void callbacks_runOnExecutorThread() throws Exception {
            ExecutorService executor = Executors.newSingleThreadExecutor(
                    runnable -> new Thread(runnable, "shutdown-wakeup"));
            try {
                ShutdownState<String> state = new ShutdownState<>(
                        ShutdownConfig.builder().wakeupExecutor(executor).build());
                AtomicReference<String> thread = new AtomicReference<>();
                CompletableFuture<Void> observed = state.newTriggerWaiter()
                        .thenAccept(reason -> thread.set(Thread.currentThread().getName()));

                state.trigger("stop");

                observed.get(5, TimeUnit.SECONDS);
                assertEquals("shutdown-wakeup", thread.get());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Rejecting executor falls back to inline completion")
        void rejectingExecutor_completesInline() {
            ShutdownState<String> state = new ShutdownState<>(ShutdownConfig.builder()
                    .wakeupExecutor(task -> {
                        throw new RejectedExecutionException("saturated");
                    })
                    .build());
            CompletableFuture<String> waiter = state.newTriggerWaiter();

            state.trigger("stop");

            assertEquals("stop", waiter.getNow(null));
        }
    }

    @Nested
    @DisplayName("Listener ordering")
    class ListenerOrderingTests {

        @Test
        @DisplayName("Listeners run before waiters are woken")
        void listeners_runBeforeWaiters() {
            ShutdownState<String> state = newState();
            List<String> events = new ArrayList<>();
            state.addListener((previous, current, reason) -> events.add("listener:" + current));
            CompletableFuture<Void> waiter =
                    state.newTriggerWaiter().thenAccept(reason -> events.add("waiter"));

            state.trigger("stop");

            assertEquals(
                    List.of("listener:Triggered", "waiter", "listener:Completed"), events);
            assertTrue(waiter.isDone());
        }

        @Test
        @DisplayName("Trigger waiter releasing the last delay does not complete ahead of later waiters")
        void lastReleaseFromTriggerWaiter_completesAfterAllTriggerWaiters() {
            ShutdownCoordinator<String> coordinator = new ShutdownCoordinator<>();
            ShutdownState<String> state = coordinator.state();
            DelayToken<String> token = coordinator.delayShutdownToken().value();
            CompletableFuture<Void> releasing =
                    state.newTriggerWaiter().thenRun(token::close);
            CompletableFuture<String> observer = state.newTriggerWaiter();
            AtomicReference<Boolean> observerDoneAtCompletion = new AtomicReference<>();
            CompletableFuture<Void> completion = state.newCompleteWaiter()
                    .thenRun(() -> observerDoneAtCompletion.set(observer.isDone()));

            state.trigger("stop");

            assertTrue(releasing.isDone());
            assertTrue(completion.isDone());
            assertEquals(Boolean.TRUE, observerDoneAtCompletion.get());
            assertTrue(state.isCompleted());
        }

        @Test
        @DisplayName("Listener releasing the last delay reports COMPLETED after TRIGGERED waiters")
        void lastReleaseFromListener_completesAfterTriggerWaiters() {
            ShutdownCoordinator<String> coordinator = new ShutdownCoordinator<>();
            ShutdownState<String> state = coordinator.state();
            DelayToken<String> token = coordinator.delayShutdownToken().value();
            List<String> events = new ArrayList<>();
            state.addListener((previous, current, reason) -> {
                events.add("listener:" + current);
                if (current == ShutdownPhase.TRIGGERED) {
                    token.close();
                }
            });
            CompletableFuture<Void> triggerWaiter =
                    state.newTriggerWaiter().thenRun(() -> events.add("trigger waiter"));
            CompletableFuture<Void> completeWaiter =
                    state.newCompleteWaiter().thenRun(() -> events.add("complete waiter"));

            state.trigger("stop");

            assertEquals(
                    List.of(
                            "listener:Triggered",
                            "trigger waiter",
                            "listener:Completed",
                            "complete waiter"),
                    events);
            assertTrue(triggerWaiter.isDone());
            assertTrue(completeWaiter.isDone());
        }

        @Test
        @DisplayName("Completion waiter created while trigger waiters are woken waits for them")
        void completeWaiterDuringTriggerWake_waitsForTriggerWaiters() {
            ShutdownState<String> state = newState();
            AtomicReference<CompletableFuture<String>> lateWaiter = new AtomicReference<>();
            AtomicReference<Boolean> lateDoneInsideWake = new AtomicReference<>();
            CompletableFuture<Void> first = state.newTriggerWaiter().thenRun(() -> {
                CompletableFuture<String> late = state.newCompleteWaiter();
                lateWaiter.set(late);
                lateDoneInsideWake.set(late.isDone());
            });
            CompletableFuture<String> second = state.newTriggerWaiter();

            state.trigger("stop");

            assertTrue(first.isDone());
            assertEquals(Boolean.FALSE, lateDoneInsideWake.get());
            assertEquals("stop", second.getNow(null));
            assertEquals("stop", lateWaiter.get().getNow(null));
        }
    }
}

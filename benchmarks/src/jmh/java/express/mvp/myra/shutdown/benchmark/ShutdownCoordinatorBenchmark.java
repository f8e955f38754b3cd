package express.mvp.myra.shutdown.benchmark;

import express.mvp.myra.shutdown.CancelOnShutdown;
import express.mvp.myra.shutdown.DelayToken;
import express.mvp.myra.shutdown.ShutdownConfig;
import express.mvp.myra.shutdown.ShutdownCoordinator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Micro-benchmarks for the shutdown coordinator hot paths.
 *
 * <p>Covers the operations a server performs per connection or per request while running:
 *
 * <ul>
 *   <li>taking and releasing a delay token
 *   <li>registering and dropping a trigger waiter
 *   <li>wrapping an operation for cancel-on-shutdown
 * </ul>
 *
 * <p>The contended variant runs the delay token path from four threads against one coordinator.
 */
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 5, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 5, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ShutdownCoordinatorBenchmark {

    private ShutdownCoordinator<String> coordinator;

    private CompletableFuture<String> completedOperation;

    @Setup(Level.Trial)
    public void setup() {
        coordinator = new ShutdownCoordinator<>(
                ShutdownConfig.builder().name("benchmark").build());
        completedOperation = CompletableFuture.completedFuture("done");
    }

    // ========== Running-state benchmarks ==========

    @Benchmark
    public void delayToken_acquireRelease() {
        try (DelayToken<String> token = coordinator.delayShutdownToken().value()) {
            // held for the scope of one request
        }
    }

    @Benchmark
    public void triggerWaiter_registerCancel() {
        coordinator.waitShutdownTriggered().cancel(false);
    }

    @Benchmark
    public void wrapCancel_pendingThenClose(Blackhole bh) {
        CancelOnShutdown<String, String> wrapped = coordinator.wrapCancel(new CompletableFuture<>());
        wrapped.close();
        bh.consume(wrapped);
    }

    @Benchmark
    public String wrapCancel_completedOperation() {
        return coordinator.wrapCancel(completedOperation).future().join();
    }

    @Benchmark
    public boolean isTriggered() {
        return coordinator.isTriggered();
    }

    // ========== Trigger benchmarks ==========

    @Benchmark
    public String trigger_withWaiters(Waiters waiters) {
        waiters.coordinator.triggerShutdown("benchmark");
        return waiters.last.join();
    }

    // ========== Contended benchmarks ==========

    @Benchmark
    @Threads(4)
    public void delayToken_contended(Shared shared) {
        try (DelayToken<String> token = shared.coordinator.delayShutdownToken().value()) {
            // held for the scope of one request
        }
    }

    /** A fresh coordinator with pending trigger waiters for every invocation. */
    @State(Scope.Thread)
    public static class Waiters {

        private static final int WAITER_COUNT = 64;

        ShutdownCoordinator<String> coordinator;

        CompletableFuture<String> last;

        @Setup(Level.Invocation)
        public void setup() {
            coordinator = new ShutdownCoordinator<>();
            for (int i = 0; i < WAITER_COUNT; i++) {
                last = coordinator.waitShutdownTriggered();
            }
        }
    }

    /** One coordinator shared by every benchmark thread. */
    @State(Scope.Benchmark)
    public static class Shared {

        ShutdownCoordinator<String> coordinator;

        @Setup(Level.Trial)
        public void setup() {
            coordinator = new ShutdownCoordinator<>();
        }
    }
}

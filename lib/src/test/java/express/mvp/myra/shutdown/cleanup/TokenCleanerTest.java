package express.mvp.myra.shutdown.cleanup;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * Unit tests for {@link TokenCleaner}.
 */
@DisplayName("TokenCleaner")
class TokenCleanerTest {

    @Nested
    @DisplayName("Explicit release")
    class ExplicitReleaseTests {

        @Test
        @DisplayName("release runs the action once")
        void release_runsOnce() {
            AtomicInteger runs = new AtomicInteger();
            Object owner = new Object();
            TokenCleaner.Registration registration =
                    TokenCleaner.register(owner, "test", false, runs::incrementAndGet);

            registration.release();
            registration.release();
            registration.close();

            assertEquals(1, runs.get());
            assertTrue(registration.isReleased());
        }

        @Test
        @DisplayName("Failure of an explicit release propagates")
        void explicitFailure_propagates() {
            TokenCleaner.Registration registration = TokenCleaner.register(
                    new Object(), "test", false, () -> {
                        throw new IllegalStateException("release failed");
                    });

            assertThrows(IllegalStateException.class, registration::release);
            assertTrue(registration.isReleased());
        }

        @Test
        @DisplayName("Null owner or action is rejected")
        void nullArguments_rejected() {
            assertThrows(
                    NullPointerException.class,
                    () -> TokenCleaner.register(null, "test", false, () -> {}));
            assertThrows(
                    NullPointerException.class,
                    () -> TokenCleaner.register(new Object(), "test", false, null));
        }
    }

    @Nested
    @DisplayName("Abandonment")
    class AbandonmentTests {

        @Test
        @Timeout(10)
        @DisplayName("Action runs after the owner is garbage collected")
        void actionRunsAfterGc() throws InterruptedException {
            CountDownLatch latch = new CountDownLatch(1);
            registerAndAbandon(latch);

            // Force GC
            for (int i = 0; i < 50; i++) {
                System.gc();
                if (latch.await(100, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }

            assertEquals(0, latch.getCount(), "Release should run after GC");
        }

        @Test
        @Timeout(10)
        @DisplayName("Failing abandoned release does not break the cleaner")
        void failingAbandonedRelease_isContained() throws InterruptedException {
            CountDownLatch latch = new CountDownLatch(1);
            registerFailingAndAbandon();
            registerAndAbandon(latch);

            for (int i = 0; i < 50; i++) {
                System.gc();
                if (latch.await(100, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }

            assertEquals(0, latch.getCount());
        }

        @Test
        @Timeout(10)
        @DisplayName("Abandoned release runs on the common pool, not the cleaner thread")
        void abandonedRelease_runsOnCommonPool() throws InterruptedException {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<Thread> releaseThread = new AtomicReference<>();
            registerAndAbandon(() -> {
                releaseThread.set(Thread.currentThread());
                latch.countDown();
            });

            // Force GC
            for (int i = 0; i < 50; i++) {
                System.gc();
                if (latch.await(100, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }

            assertEquals(0, latch.getCount(), "Release should run after GC");
            assertInstanceOf(ForkJoinWorkerThread.class, releaseThread.get());
        }

        private void registerAndAbandon(Runnable release) {
            TokenCleaner.register(new Object(), "abandoned", false, release);
            // the owner becomes unreachable after this method returns
        }

        private void registerAndAbandon(CountDownLatch latch) {
            Object owner = new Object();
            TokenCleaner.register(owner, "abandoned", false, latch::countDown);
            // owner becomes unreachable after this method returns
        }

        private void registerFailingAndAbandon() {
            TokenCleaner.register(new Object(), "failing", false, () -> {
                throw new IllegalStateException("release failed");
            });
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatisticsTests {

        @Test
        @DisplayName("Counters follow registrations and explicit releases")
        void counters_follow() {
            long registered = TokenCleaner.getRegistrationCount();
            long explicit = TokenCleaner.getExplicitReleaseCount();
            Object first = new Object();
            Object second = new Object();

            TokenCleaner.Registration a = TokenCleaner.register(first, "a", false, () -> {});
            TokenCleaner.register(second, "b", false, () -> {});
            a.release();

            assertEquals(registered + 2, TokenCleaner.getRegistrationCount());
            assertEquals(explicit + 1, TokenCleaner.getExplicitReleaseCount());
            assertTrue(TokenCleaner.getActiveCount() >= 1);
            assertNotNull(second);
        }
    }
}

package express.mvp.myra.shutdown.error;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ShutdownResult} and the rejection values.
 */
@DisplayName("ShutdownResult")
class ShutdownResultTest {

    @Nested
    @DisplayName("Success")
    class SuccessTests {

        @Test
        @DisplayName("Carries its value")
        void carriesValue() {
            ShutdownResult<String, String> result = ShutdownResult.success("token");

            assertTrue(result.isSuccess());
            assertFalse(result.isRejected());
            assertEquals("token", result.value());
            assertEquals(Optional.empty(), result.rejection());
        }

        @Test
        @DisplayName("Void success has no value")
        void voidSuccess() {
            ShutdownResult<Void, String> result = ShutdownResult.success();

            assertTrue(result.isSuccess());
            assertNull(result.value());
            assertEquals("ShutdownResult[success]", result.toString());
        }

        @Test
        @DisplayName("map transforms the value")
        void map_transformsValue() {
            ShutdownResult<Integer, String> result =
                    ShutdownResult.<String, String>success("abc").map(String::length);

            assertEquals(3, result.value());
        }

        @Test
        @DisplayName("ifSuccess runs, ifRejected does not")
        void callbacks() {
            List<String> seen = new ArrayList<>();

            ShutdownResult.<String, String>success("v")
                    .ifSuccess(seen::add)
                    .ifRejected(rejection -> seen.add("rejected"));

            assertEquals(List.of("v"), seen);
        }
    }

    @Nested
    @DisplayName("Rejection")
    class RejectionTests {

        @Test
        @DisplayName("value throws with the rejection attached")
        void value_throws() {
            AlreadyTriggered<String> rejection = new AlreadyTriggered<>("first");
            ShutdownResult<Void, String> result = ShutdownResult.rejected(rejection);

            ShutdownRejectedException thrown =
                    assertThrows(ShutdownRejectedException.class, result::value);

            assertSame(rejection, thrown.rejection());
            assertEquals(rejection.message(), thrown.getMessage());
        }

        @Test
        @DisplayName("orElse returns the fallback")
        void orElse_returnsFallback() {
            ShutdownResult<String, String> result =
                    ShutdownResult.rejected(new AlreadyCompleted<>("done"));

            assertEquals("fallback", result.orElse("fallback"));
        }

        @Test
        @DisplayName("map keeps the rejection")
        void map_keepsRejection() {
            AlreadyCompleted<String> rejection = new AlreadyCompleted<>("done");
            ShutdownResult<String, String> result = ShutdownResult.rejected(rejection);

            ShutdownResult<Integer, String> mapped = result.map(String::length);

            assertTrue(mapped.isRejected());
            assertSame(rejection, mapped.rejection().orElseThrow());
        }

        @Test
        @DisplayName("Messages name the existing reason")
        void messages_nameReason() {
            assertEquals(
                    "shutdown has already been triggered (reason: SIGTERM)",
                    new AlreadyTriggered<>("SIGTERM").message());
            assertEquals(
                    "shutdown has already completed, can not delay shutdown completion"
                            + " (reason: SIGTERM)",
                    new AlreadyCompleted<>("SIGTERM").message());
        }

        @Test
        @DisplayName("Rejections require a reason")
        void rejections_requireReason() {
            assertThrows(NullPointerException.class, () -> new AlreadyTriggered<String>(null));
            assertThrows(NullPointerException.class, () -> new AlreadyCompleted<String>(null));
        }
    }

    @Nested
    @DisplayName("ShutdownCancellationException")
    class CancellationTests {

        @Test
        @DisplayName("Carries the reason and is a CancellationException")
        void carriesReason() {
            ShutdownCancellationException e = new ShutdownCancellationException(42);

            assertEquals(42, e.reason());
            assertEquals(Integer.valueOf(42), e.reason(Integer.class));
            assertInstanceOf(java.util.concurrent.CancellationException.class, e);
            assertEquals("operation cancelled by shutdown (reason: 42)", e.getMessage());
        }

        @Test
        @DisplayName("reason with the wrong type throws")
        void reason_wrongType_throws() {
            ShutdownCancellationException e = new ShutdownCancellationException("text");

            assertThrows(ClassCastException.class, () -> e.reason(Integer.class));
        }
    }
}

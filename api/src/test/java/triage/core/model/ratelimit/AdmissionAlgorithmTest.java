package triage.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AdmissionAlgorithm")
class AdmissionAlgorithmTest {

    // Start of an hour, so minute and hour windows line up with the test steps
    private static final long T0 = 1_700_002_800_000L;

    private LimiterSlot run(LimiterSlot slot, Limit limit, long now, int times) {
        var current = slot;
        for (int i = 0; i < times; i++) {
            var step = AdmissionAlgorithm.admit(current, limit, now);
            assertTrue(step.result().allowed(), "request " + (i + 1) + " should be allowed");
            current = step.slot();
        }
        return current;
    }

    @Nested
    @DisplayName("Token bucket")
    class TokenBucketTests {

        @Test
        @DisplayName("should start full and debit one token per request")
        void shouldStartFullAndDebit() {
            var limit = Limit.of(60, 3600, 10, "test");

            var step = AdmissionAlgorithm.admit(null, limit, T0);

            assertTrue(step.result().allowed());
            assertEquals(9.0, step.result().tokensRemaining(), 1e-9);
            assertEquals(1, step.result().minuteCount());
            assertEquals(1, step.result().hourCount());
            assertEquals(0, step.result().retryAfterSeconds());
        }

        @Test
        @DisplayName("should reject an empty bucket with a refill-based retry hint")
        void shouldRejectEmptyBucket() {
            var limit = Limit.of(60, 3600, 3, "test");
            var slot = run(null, limit, T0, 3);

            var step = AdmissionAlgorithm.admit(slot, limit, T0);

            assertFalse(step.result().allowed());
            assertEquals(1, step.result().retryAfterSeconds());
            assertSame(slot, step.slot(), "a rejection must not change state");
            assertEquals(3, step.result().minuteCount());
        }

        @Test
        @DisplayName("should round the retry hint up to whole seconds")
        void shouldRoundRetryUp() {
            // 6 per minute refills one token every 10 seconds
            var limit = Limit.of(6, 3600, 1, "test");
            var slot = run(null, limit, T0, 1);

            var step = AdmissionAlgorithm.admit(slot, limit, T0 + 2_500);

            assertFalse(step.result().allowed());
            assertEquals(8, step.result().retryAfterSeconds());
        }

        @Test
        @DisplayName("should refill in proportion to elapsed time, capped at capacity")
        void shouldRefillProportionally() {
            var limit = Limit.of(60, 3600, 10, "test");
            var slot = run(null, limit, T0, 10);

            var afterFive = AdmissionAlgorithm.admit(slot, limit, T0 + 5_000);
            assertTrue(afterFive.result().allowed());
            assertEquals(4.0, afterFive.result().tokensRemaining(), 1e-9);

            var muchLater = AdmissionAlgorithm.admit(afterFive.slot(), limit, T0 + 600_000);
            assertEquals(9.0, muchLater.result().tokensRemaining(), 1e-9);
        }

        @Test
        @DisplayName("should not refill when time goes backwards")
        void shouldNotRefillBackwards() {
            var limit = Limit.of(60, 3600, 2, "test");
            var slot = run(null, limit, T0 + 10_000, 2);

            var step = AdmissionAlgorithm.admit(slot, limit, T0);

            assertFalse(step.result().allowed());
        }
    }

    @Nested
    @DisplayName("Windows")
    class WindowTests {

        @Test
        @DisplayName("should roll back the token when the minute window is full")
        void shouldRollBackOnMinuteCeiling() {
            // Bucket larger than the minute ceiling so the window binds first
            var limit = Limit.of(3, 3600, 10, "test");
            var slot = run(null, limit, T0, 3);

            var step = AdmissionAlgorithm.admit(slot, limit, T0);

            assertFalse(step.result().allowed());
            assertEquals(60, step.result().retryAfterSeconds());
            assertEquals(7.0, step.result().tokensRemaining(), 1e-9);
            assertEquals(3, step.result().minuteCount());
            assertSame(slot, step.slot());
        }

        @Test
        @DisplayName("should roll back the token when the hour window is full")
        void shouldRollBackOnHourCeiling() {
            var limit = Limit.of(60, 2, 10, "test");
            var slot = run(null, limit, T0, 2);

            var step = AdmissionAlgorithm.admit(slot, limit, T0 + 61_000);

            assertFalse(step.result().allowed());
            assertEquals(60, step.result().retryAfterSeconds());
            assertEquals(0, step.result().minuteCount(), "a new minute window starts empty");
            assertEquals(2, step.result().hourCount());
        }

        @Test
        @DisplayName("should start a fresh count in a new minute window")
        void shouldStartFreshMinuteWindow() {
            var limit = Limit.of(2, 3600, 10, "test");
            var slot = run(null, limit, T0, 2);

            var step = AdmissionAlgorithm.admit(slot, limit, T0 + 60_000);

            assertTrue(step.result().allowed());
            assertEquals(1, step.result().minuteCount());
            assertEquals(3, step.result().hourCount());
        }
    }

    @Test
    @DisplayName("LimiterKeys should embed the window indexes")
    void limiterKeysShouldEmbedWindowIndexes() {
        var keys = LimiterKeys.of("triage:ratelimit:", "u-1", "patient_access", 7_200_000L + 61_000L);

        assertEquals("triage:ratelimit:{u-1:patient_access}:tb", keys.bucket());
        assertEquals("triage:ratelimit:{u-1:patient_access}:minute:121", keys.minuteWindow());
        assertEquals("triage:ratelimit:{u-1:patient_access}:hour:2", keys.hourWindow());
    }

    @Test
    @DisplayName("LimiterKeys should share one cluster hash tag")
    void limiterKeysShouldShareHashTag() {
        var keys = LimiterKeys.of("triage:ratelimit:", "odd}subject", "api_general", 0L);

        var tag = hashTag(keys.bucket());
        assertEquals("odd", tag);
        assertEquals(tag, hashTag(keys.minuteWindow()));
        assertEquals(tag, hashTag(keys.hourWindow()));
    }

    private static String hashTag(String key) {
        var open = key.indexOf('{');
        var close = key.indexOf('}', open + 1);
        return key.substring(open + 1, close);
    }
}

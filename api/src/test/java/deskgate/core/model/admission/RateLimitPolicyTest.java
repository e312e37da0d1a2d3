package deskgate.core.model.admission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RateLimitPolicy")
class RateLimitPolicyTest {

    private static final KeyGenerator BY_IP = request -> RateLimitKey.of(request.routeClass(), "ip");

    @Test
    @DisplayName("should round the TTL up to whole seconds")
    void shouldRoundTtlUp() {
        assertEquals(60, RateLimitPolicy.of(RouteClass.SEARCH, Duration.ofMinutes(1), 20, BY_IP).ttlSeconds());
        assertEquals(2, RateLimitPolicy.of(RouteClass.SEARCH, Duration.ofMillis(1500), 20, BY_IP).ttlSeconds());
        assertEquals(1, RateLimitPolicy.of(RouteClass.SEARCH, Duration.ofMillis(10), 20, BY_IP).ttlSeconds());
    }

    @Test
    @DisplayName("should reject non-positive windows")
    void shouldRejectNonPositiveWindows() {
        assertThrows(
                IllegalArgumentException.class,
                () -> RateLimitPolicy.of(RouteClass.SEARCH, Duration.ZERO, 20, BY_IP));
    }

    @Nested
    @DisplayName("Slot release")
    class SlotReleaseTests {

        @Test
        @DisplayName("should release successful requests only when skipping successes")
        void shouldReleaseSuccesses() {
            var policy = RateLimitPolicy.of(RouteClass.AUTHENTICATION, Duration.ofMinutes(15), 5, BY_IP)
                    .skippingSuccessful();

            assertTrue(policy.releasesSlotFor(200));
            assertTrue(policy.releasesSlotFor(302));
            assertFalse(policy.releasesSlotFor(401));
        }

        @Test
        @DisplayName("should release failed requests only when skipping failures")
        void shouldReleaseFailures() {
            var policy = RateLimitPolicy.of(RouteClass.GENERAL, Duration.ofMinutes(15), 100, BY_IP)
                    .skippingFailed();

            assertFalse(policy.releasesSlotFor(200));
            assertTrue(policy.releasesSlotFor(400));
            assertTrue(policy.releasesSlotFor(503));
        }

        @Test
        @DisplayName("should never release by default")
        void shouldNeverReleaseByDefault() {
            var policy = RateLimitPolicy.of(RouteClass.GENERAL, Duration.ofMinutes(15), 100, BY_IP);

            assertFalse(policy.releasesSlotFor(200));
            assertFalse(policy.releasesSlotFor(500));
        }
    }

    @Test
    @DisplayName("should index fixed windows by floor division")
    void shouldIndexWindows() {
        var policy = RateLimitPolicy.of(RouteClass.SEARCH, Duration.ofMinutes(1), 20, BY_IP);

        var counter = WindowCounter.at("rate_limit:search:ip", policy, 125_000);

        assertEquals(2, counter.windowIndex());
        assertEquals("rate_limit:search:ip:2", counter.counterId());
        assertEquals(60, counter.ttlSeconds());
    }

    @Test
    @DisplayName("should put the route class first in every key")
    void shouldPrefixRouteClass() {
        var key = RateLimitKey.of(RouteClass.AUTHENTICATED_API, "user", "42");

        assertEquals("authenticated-api:user:42", key.value());
        assertThrows(IllegalArgumentException.class, () -> RateLimitKey.of(RouteClass.GENERAL));
    }
}

package com.conductor.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ItemExponentialFailureRateLimiterTest {

    private final ItemExponentialFailureRateLimiter<String> limiter =
            new ItemExponentialFailureRateLimiter<>(Duration.ofMillis(5), Duration.ofSeconds(1000));

    @Test
    @DisplayName("Backoff doubles per failure of the same item")
    void when_shouldDoublePerFailure() {
        assertEquals(Duration.ofMillis(5), limiter.when("a"));
        assertEquals(Duration.ofMillis(10), limiter.when("a"));
        assertEquals(Duration.ofMillis(20), limiter.when("a"));
        assertEquals(3, limiter.numRequeues("a"));
    }

    @Test
    @DisplayName("Items back off independently")
    void when_shouldTrackItemsSeparately() {
        limiter.when("a");
        limiter.when("a");

        assertEquals(Duration.ofMillis(5), limiter.when("b"));
    }

    @Test
    @DisplayName("Backoff is capped at the max delay, even after very many failures")
    void when_shouldCapAtMax() {
        Duration last = Duration.ZERO;
        for (int i = 0; i < 200; i++) {
            last = limiter.when("a");
        }
        assertEquals(Duration.ofSeconds(1000), last);
    }

    @Test
    @DisplayName("forget() resets the backoff")
    void forget_shouldReset() {
        limiter.when("a");
        limiter.when("a");
        limiter.forget("a");

        assertEquals(0, limiter.numRequeues("a"));
        assertEquals(Duration.ofMillis(5), limiter.when("a"));
    }

    @Test
    @DisplayName("Max below base is rejected")
    void constructor_shouldRejectInvertedBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new ItemExponentialFailureRateLimiter<String>(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }
}

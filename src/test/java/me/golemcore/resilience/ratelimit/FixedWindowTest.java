package me.golemcore.resilience.ratelimit;

import me.golemcore.resilience.domain.model.RateLimitResult;
import me.golemcore.resilience.domain.model.RateWindowState;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FixedWindowTest {

    private static final long MINUTE_START = 28_000_000L * FixedWindow.WINDOW_MILLIS;

    @Test
    void tryAcquire_admitsUpToLimitWithinOneMinute() {
        FixedWindow window = new FixedWindow(3, MINUTE_START / FixedWindow.WINDOW_MILLIS);

        for (int i = 0; i < 3; i++) {
            RateLimitResult result = window.tryAcquire(MINUTE_START + i * 1000L);
            assertTrue(result.isAllowed(), "Request " + (i + 1) + " should be allowed");
            assertEquals(2 - i, result.getRemaining());
        }

        RateLimitResult fourth = window.tryAcquire(MINUTE_START + 5000);
        assertFalse(fourth.isAllowed());
        assertEquals("Rate limit exceeded", fourth.getReason());
        assertEquals(Duration.ofMillis(55_000), fourth.getWaitTime());
    }

    @Test
    void tryAcquire_rejectionsDoNotConsumeTheWindow() {
        FixedWindow window = new FixedWindow(1, MINUTE_START / FixedWindow.WINDOW_MILLIS);
        window.tryAcquire(MINUTE_START);

        for (int i = 0; i < 5; i++) {
            assertFalse(window.tryAcquire(MINUTE_START + 10).isAllowed());
        }

        RateWindowState state = window.getState("github");
        assertEquals(1, state.getCount());
        assertEquals(1, state.getLimit());
        assertEquals("github", state.getTarget());
    }

    @Test
    void tryAcquire_resetsWhenMinuteRollsOver() {
        FixedWindow window = new FixedWindow(3, MINUTE_START / FixedWindow.WINDOW_MILLIS);
        for (int i = 0; i < 3; i++) {
            window.tryAcquire(MINUTE_START + 59_000);
        }
        assertFalse(window.tryAcquire(MINUTE_START + 59_999).isAllowed());

        RateLimitResult next = window.tryAcquire(MINUTE_START + FixedWindow.WINDOW_MILLIS);

        assertTrue(next.isAllowed());
        assertEquals(2, next.getRemaining());
        RateWindowState state = window.getState("github");
        assertEquals(MINUTE_START / FixedWindow.WINDOW_MILLIS + 1, state.getWindowStartMinute());
        assertEquals(1, state.getCount());
    }

    @Test
    void tryAcquire_lateBurstAfterRolloverIsAdmitted() {
        // fixed windows allow up to 2x limit across a boundary
        FixedWindow window = new FixedWindow(2, MINUTE_START / FixedWindow.WINDOW_MILLIS);
        assertTrue(window.tryAcquire(MINUTE_START + 59_900).isAllowed());
        assertTrue(window.tryAcquire(MINUTE_START + 59_950).isAllowed());
        assertTrue(window.tryAcquire(MINUTE_START + 60_000).isAllowed());
        assertTrue(window.tryAcquire(MINUTE_START + 60_050).isAllowed());
        assertFalse(window.tryAcquire(MINUTE_START + 60_100).isAllowed());
    }

    @Test
    void constructor_rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new FixedWindow(0, 0));
    }
}

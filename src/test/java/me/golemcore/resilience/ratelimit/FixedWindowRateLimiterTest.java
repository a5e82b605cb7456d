package me.golemcore.resilience.ratelimit;

import me.golemcore.resilience.domain.model.RateWindowState;
import me.golemcore.resilience.governance.GovernancePolicyResolver;
import me.golemcore.resilience.infrastructure.config.ResilienceProperties;
import me.golemcore.resilience.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FixedWindowRateLimiterTest {

    private ResilienceProperties properties;
    private MutableClock clock;
    private FixedWindowRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        properties = new ResilienceProperties();
        properties.getMcp().getDefaults().setRateLimitPerMinute(3);
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        rateLimiter = new FixedWindowRateLimiter(new GovernancePolicyResolver(properties), clock);
    }

    @Test
    void allow_admitsThreeThenRejectsFourthInSameMinute() {
        assertTrue(rateLimiter.allow("github").isAllowed());
        assertTrue(rateLimiter.allow("github").isAllowed());
        assertTrue(rateLimiter.allow("github").isAllowed());

        assertFalse(rateLimiter.allow("github").isAllowed());
    }

    @Test
    void allow_admitsAgainAfterMinuteRollsOver() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.allow("github");
        }
        clock.advance(Duration.ofSeconds(59));
        assertFalse(rateLimiter.allow("github").isAllowed());

        clock.advance(Duration.ofSeconds(1));

        assertTrue(rateLimiter.allow("github").isAllowed());
    }

    @Test
    void allow_keepsTargetsIndependent() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.allow("github");
        }

        assertFalse(rateLimiter.allow("github").isAllowed());
        assertTrue(rateLimiter.allow("slack").isAllowed());
    }

    @Test
    void allow_usesPerTargetOverride() {
        ResilienceProperties.GovernanceOverrides overrides = new ResilienceProperties.GovernanceOverrides();
        overrides.setRateLimitPerMinute(1);
        properties.getMcp().getTargets().put("slow", overrides);

        assertTrue(rateLimiter.allow("slow").isAllowed());
        assertFalse(rateLimiter.allow("slow").isAllowed());
    }

    @Test
    void allow_admitsExactlyLimitUnderConcurrency() throws Exception {
        int callers = 32;
        properties.getMcp().getDefaults().setRateLimitPerMinute(callers);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(new GovernancePolicyResolver(properties), clock);

        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CyclicBarrier barrier = new CyclicBarrier(callers);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < callers * 2; i++) {
                boolean synchronizedStart = i < callers;
                futures.add(executor.submit(() -> {
                    if (synchronizedStart) {
                        barrier.await(5, TimeUnit.SECONDS);
                    }
                    return limiter.allow("github").isAllowed();
                }));
            }

            int admitted = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertEquals(callers, admitted);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void getWindowState_reflectsCount() {
        assertTrue(rateLimiter.getWindowState("github").isEmpty());

        rateLimiter.allow("github");
        rateLimiter.allow("github");

        RateWindowState state = rateLimiter.getWindowState("github").orElseThrow();
        assertEquals(2, state.getCount());
        assertEquals(3, state.getLimit());
        assertEquals(1, rateLimiter.getWindowStates().size());
    }
}

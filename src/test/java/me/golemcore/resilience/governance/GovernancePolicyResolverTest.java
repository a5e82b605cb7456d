package me.golemcore.resilience.governance;

import me.golemcore.resilience.domain.model.GovernancePolicy;
import me.golemcore.resilience.infrastructure.config.ResilienceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GovernancePolicyResolverTest {

    private ResilienceProperties properties;
    private GovernancePolicyResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new ResilienceProperties();
        resolver = new GovernancePolicyResolver(properties);
    }

    @Test
    void resolve_usesDefaultsWithoutOverride() {
        GovernancePolicy policy = resolver.resolve("github");

        assertEquals(4, policy.getMaxConcurrentRequests());
        assertEquals(Duration.ofMillis(200), policy.getQueueWait());
        assertEquals(120, policy.getRateLimitPerMinute());
        assertEquals(5, policy.getFailureThreshold());
        assertEquals(Duration.ofSeconds(30), policy.getCooldown());
    }

    @Test
    void resolve_mergesPartialOverride() {
        ResilienceProperties.GovernanceOverrides overrides = new ResilienceProperties.GovernanceOverrides();
        overrides.setMaxConcurrentRequests(1);
        overrides.setCooldownMs(5000L);
        properties.getMcp().getTargets().put("github", overrides);

        GovernancePolicy policy = resolver.resolve("github");

        assertEquals(1, policy.getMaxConcurrentRequests());
        assertEquals(Duration.ofSeconds(5), policy.getCooldown());
        assertEquals(120, policy.getRateLimitPerMinute());
        assertEquals(4, resolver.resolve("slack").getMaxConcurrentRequests());
    }

    @Test
    void resolve_clampsInvalidValues() {
        ResilienceProperties.GovernanceDefaults defaults = properties.getMcp().getDefaults();
        defaults.setMaxConcurrentRequests(0);
        defaults.setQueueWaitMs(-10);
        defaults.setRateLimitPerMinute(-1);
        defaults.setFailureThreshold(0);
        defaults.setCooldownMs(-1);

        GovernancePolicy policy = resolver.resolve("github");

        assertEquals(1, policy.getMaxConcurrentRequests());
        assertEquals(Duration.ZERO, policy.getQueueWait());
        assertEquals(1, policy.getRateLimitPerMinute());
        assertEquals(1, policy.getFailureThreshold());
        assertEquals(Duration.ZERO, policy.getCooldown());
    }

    @Test
    void resolve_isFixedAfterFirstUse() {
        GovernancePolicy first = resolver.resolve("github");
        properties.getMcp().getDefaults().setMaxConcurrentRequests(10);

        assertSame(first, resolver.resolve("github"));
    }
}

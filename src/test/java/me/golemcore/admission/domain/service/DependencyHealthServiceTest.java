package me.golemcore.admission.domain.service;

import me.golemcore.admission.domain.model.HealthReport;
import me.golemcore.admission.domain.model.HealthStatus;
import me.golemcore.admission.infrastructure.config.AdmissionProperties;
import me.golemcore.admission.resilience.CircuitBreaker;
import me.golemcore.admission.resilience.CircuitBreakerRegistry;
import me.golemcore.admission.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DependencyHealthServiceTest {

    private MutableClock clock;
    private CircuitBreakerRegistry registry;
    private DependencyHealthService healthService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T12:00:00Z");
        AdmissionProperties properties = new AdmissionProperties();
        properties.getDefaults().getCircuitBreaker().setFailureThreshold(1);
        properties.getDefaults().getCircuitBreaker().setOpenTimeout(Duration.ofSeconds(30));
        registry = new CircuitBreakerRegistry(properties, clock);
        healthService = new DependencyHealthService(registry, clock);
    }

    private void trip(CircuitBreaker breaker) {
        assertThrows(IOException.class, () -> breaker.call(() -> {
            throw new IOException("down");
        }));
    }

    @Test
    void shouldBeHealthyWithoutBreakers() {
        HealthReport report = healthService.report();

        assertEquals(HealthStatus.HEALTHY, report.getOverallStatus());
        assertTrue(report.getBreakers().isEmpty());
        assertEquals(clock.instant(), report.getTimestamp());
    }

    @Test
    void openBreakerShouldMakeReportUnhealthy() {
        registry.forDependency("s3");
        trip(registry.forDependency("bedrock"));

        HealthReport report = healthService.report();

        assertEquals(HealthStatus.UNHEALTHY, report.getOverallStatus());
        assertEquals(1L, report.getSummary().get(HealthStatus.HEALTHY));
        assertEquals(1L, report.getSummary().get(HealthStatus.UNHEALTHY));
        assertEquals(0L, report.getSummary().get(HealthStatus.DEGRADED));
        assertEquals(HealthStatus.UNHEALTHY, healthService.statusOf("bedrock"));
        assertEquals(HealthStatus.HEALTHY, healthService.statusOf("s3"));
    }

    @Test
    void halfOpenBreakerShouldBeDegraded() throws Exception {
        CircuitBreaker breaker = registry.forDependency("bedrock");
        trip(breaker);
        clock.advance(Duration.ofSeconds(31));
        breaker.call(() -> "probe");

        assertEquals(HealthStatus.DEGRADED, healthService.report().getOverallStatus());
    }

    @Test
    void resetShouldRestoreHealth() {
        trip(registry.forDependency("bedrock"));

        healthService.reset("bedrock");

        assertEquals(HealthStatus.HEALTHY, healthService.report().getOverallStatus());
    }

    @Test
    void resetAllShouldCloseEveryBreaker() {
        trip(registry.forDependency("bedrock"));
        trip(registry.forDependency("s3"));
        assertEquals(2L, healthService.report().getSummary().get(HealthStatus.UNHEALTHY));

        healthService.resetAll();

        HealthReport report = healthService.report();
        assertEquals(HealthStatus.HEALTHY, report.getOverallStatus());
        assertEquals(2L, report.getSummary().get(HealthStatus.HEALTHY));
    }
}

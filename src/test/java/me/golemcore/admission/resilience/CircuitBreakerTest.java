package me.golemcore.admission.resilience;

import me.golemcore.admission.domain.exception.CircuitOpenException;
import me.golemcore.admission.domain.model.CircuitBreakerSnapshot;
import me.golemcore.admission.domain.model.CircuitState;
import me.golemcore.admission.domain.model.ErrorClass;
import me.golemcore.admission.domain.model.ErrorClassification;
import me.golemcore.admission.domain.model.Outcome;
import me.golemcore.admission.infrastructure.config.AdmissionProperties.CircuitBreakerProperties;
import me.golemcore.admission.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private static final String DEPENDENCY = "bedrock";

    private MutableClock clock;
    private CircuitBreakerProperties properties;
    private CircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T12:00:00Z");
        properties = new CircuitBreakerProperties();
        properties.setFailureThreshold(2);
        properties.setSuccessThreshold(2);
        properties.setOpenTimeout(Duration.ofSeconds(10));
        breaker = new CircuitBreaker(DEPENDENCY, properties, clock);
        invocations = new AtomicInteger();
    }

    private Callable<String> failing() {
        return () -> {
            invocations.incrementAndGet();
            throw new IOException("boom");
        };
    }

    private Callable<String> succeeding() {
        return () -> {
            invocations.incrementAndGet();
            return "ok";
        };
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            assertThrows(IOException.class, () -> breaker.call(failing()));
        }
    }

    // ===== Closed =====

    @Test
    void shouldStartClosedAndPassThroughResults() throws Exception {
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals("ok", breaker.call(succeeding()));
        assertEquals(1, invocations.get());
    }

    @Test
    void shouldRethrowOriginalError() {
        IOException error = assertThrows(IOException.class, () -> breaker.call(failing()));
        assertEquals("boom", error.getMessage());
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void successShouldResetFailureCountWhileClosed() throws Exception {
        failTimes(1);
        breaker.call(succeeding());
        failTimes(1);

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(1, breaker.snapshot().getConsecutiveFailureCount());
    }

    // ===== Open =====

    @Test
    void shouldOpenAfterThresholdAndRejectWithoutInvoking() {
        failTimes(2);
        assertEquals(CircuitState.OPEN, breaker.getState());

        clock.advance(Duration.ofSeconds(5));
        CircuitOpenException rejection = assertThrows(CircuitOpenException.class,
                () -> breaker.call(succeeding()));

        assertEquals(2, invocations.get());
        assertEquals(DEPENDENCY, rejection.getDependency());
        assertEquals(Duration.ofSeconds(5), rejection.getRetryAfter());
    }

    @Test
    void shouldProbeAfterOpenTimeout() throws Exception {
        failTimes(2);

        clock.advance(Duration.ofSeconds(11));
        assertEquals("ok", breaker.call(succeeding()));

        assertEquals(3, invocations.get());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
    }

    @Test
    void shouldProbeExactlyAtOpenTimeout() throws Exception {
        failTimes(2);

        clock.advance(Duration.ofSeconds(10));
        breaker.call(succeeding());

        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
    }

    // ===== Half-open =====

    @Test
    void shouldCloseAfterSuccessThresholdInHalfOpen() throws Exception {
        failTimes(2);
        clock.advance(Duration.ofSeconds(11));

        breaker.call(succeeding());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        breaker.call(succeeding());

        assertEquals(CircuitState.CLOSED, breaker.getState());
        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals(0, snapshot.getConsecutiveFailureCount());
        assertTrue(snapshot.isHealthy());
    }

    @Test
    void singleFailureInHalfOpenShouldReopen() {
        failTimes(2);
        clock.advance(Duration.ofSeconds(11));

        assertThrows(IOException.class, () -> breaker.call(failing()));

        assertEquals(CircuitState.OPEN, breaker.getState());
        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals(0, snapshot.getConsecutiveSuccessCount());
        assertEquals(clock.instant(), snapshot.getLastFailureTime());
        assertEquals(Duration.ofSeconds(10), snapshot.getRetryAfter());
        assertThrows(CircuitOpenException.class, () -> breaker.call(succeeding()));
    }

    @Test
    void shouldLimitConcurrentProbes() throws Exception {
        properties.setHalfOpenMaxCalls(1);
        failTimes(2);
        clock.advance(Duration.ofSeconds(11));

        String result = breaker.call(() -> {
            CircuitOpenException nested = assertThrows(CircuitOpenException.class,
                    () -> breaker.call(succeeding()));
            assertEquals(Duration.ZERO, nested.getRetryAfter());
            return "probe";
        });

        assertEquals("probe", result);
        assertEquals(2, invocations.get());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(1, breaker.snapshot().getConsecutiveSuccessCount());
    }

    @Test
    void errorThrownByProbeShouldReopenAndFreeProbeSlot() throws Exception {
        failTimes(2);
        clock.advance(Duration.ofSeconds(11));

        assertThrows(StackOverflowError.class, () -> breaker.call(() -> {
            throw new StackOverflowError();
        }));
        assertEquals(CircuitState.OPEN, breaker.getState());

        clock.advance(Duration.ofSeconds(11));
        assertEquals("ok", breaker.call(succeeding()));
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
    }

    @Test
    void errorThrownByAttemptShouldCountAsFailure() {
        properties.setFailureThreshold(1);

        assertThrows(StackOverflowError.class, () -> breaker.attempt(() -> {
            throw new StackOverflowError();
        }));

        assertEquals(CircuitState.OPEN, breaker.getState());
        clock.advance(Duration.ofSeconds(11));
        assertTrue(breaker.attempt(() -> Outcome.success("ok")).isSuccess());
    }

    @Test
    void successOfCallAdmittedBeforeHalfOpenShouldNotCloseBreaker() throws Exception {
        String result = breaker.call(() -> {
            failTimes(2);
            clock.advance(Duration.ofSeconds(11));
            assertEquals("ok", breaker.call(succeeding()));
            return "late";
        });

        assertEquals("late", result);
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(1, breaker.snapshot().getConsecutiveSuccessCount());
    }

    // ===== Outcome-based attempts =====

    @Test
    void attemptShouldCountRetryableOutcomesAsFailures() {
        ResilientOperation<String> throttled = () -> Outcome.retryable(
                ErrorClassification.of(ErrorClass.THROTTLING), new IOException("slow down"));

        breaker.attempt(throttled);
        breaker.attempt(throttled);

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertThrows(CircuitOpenException.class, () -> breaker.attempt(throttled));
    }

    @Test
    void callerFaultsShouldNotTripBreaker() {
        ResilientOperation<String> invalid = () -> Outcome.terminal(
                ErrorClassification.of(ErrorClass.VALIDATION), new IllegalArgumentException("bad input"));

        for (int i = 0; i < 5; i++) {
            Outcome<String> outcome = breaker.attempt(invalid);
            assertEquals(ErrorClass.VALIDATION, outcome.getErrorClass());
        }

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.snapshot().getConsecutiveFailureCount());
    }

    @Test
    void attemptShouldReturnSuccessfulOutcome() {
        Outcome<String> outcome = breaker.attempt(() -> Outcome.success("value"));

        assertTrue(outcome.isSuccess());
        assertEquals("value", outcome.getValue());
    }

    @Test
    void resetShouldCloseBreaker() {
        failTimes(2);

        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertNull(breaker.snapshot().getLastFailureTime());
    }

    @Test
    void snapshotShouldExposeConfiguration() {
        CircuitBreakerSnapshot snapshot = breaker.snapshot();

        assertEquals(DEPENDENCY, snapshot.getDependency());
        assertEquals(2, snapshot.getFailureThreshold());
        assertEquals(2, snapshot.getSuccessThreshold());
        assertEquals(2, snapshot.getHalfOpenMaxCalls());
        assertEquals(Duration.ofSeconds(10), snapshot.getOpenTimeout());
        assertEquals(Duration.ZERO, snapshot.getRetryAfter());
    }
}

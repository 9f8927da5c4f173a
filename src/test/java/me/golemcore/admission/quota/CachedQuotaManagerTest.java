package me.golemcore.admission.quota;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.admission.adapter.outbound.store.InMemoryCounterStoreAdapter;
import me.golemcore.admission.domain.exception.CounterStoreUnavailableException;
import me.golemcore.admission.domain.exception.QuotaExceededException;
import me.golemcore.admission.domain.exception.TrackingException;
import me.golemcore.admission.domain.model.CounterKey;
import me.golemcore.admission.domain.model.QuotaDecision;
import me.golemcore.admission.domain.model.QuotaInfo;
import me.golemcore.admission.domain.model.QuotaLimit;
import me.golemcore.admission.domain.model.QuotaStatus;
import me.golemcore.admission.domain.model.StoreFailurePolicy;
import me.golemcore.admission.infrastructure.config.AdmissionProperties;
import me.golemcore.admission.infrastructure.config.AutoConfiguration;
import me.golemcore.admission.port.outbound.CounterStorePort;
import me.golemcore.admission.testsupport.InMemorySharedCache;
import me.golemcore.admission.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import static org.junit.jupiter.api.Assertions.*;

class CachedQuotaManagerTest {

    private static final String SUBJECT = "u1";
    private static final String OPERATION = "transcribe";

    private MutableClock clock;
    private AdmissionProperties properties;
    private ObjectMapper objectMapper;
    private InMemoryCounterStoreAdapter store;
    private InMemorySharedCache sharedCache;
    private CachedQuotaManager quotaManager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T12:00:00Z");
        properties = new AdmissionProperties();
        properties.getQuota().setDailyLimit(2);
        properties.getQuota().setMonthlyLimit(1000);
        objectMapper = AutoConfiguration.objectMapper();
        store = spy(new InMemoryCounterStoreAdapter(properties, clock));
        sharedCache = new InMemorySharedCache();
        quotaManager = newManager(store, sharedCache);
    }

    private CachedQuotaManager newManager(CounterStorePort counterStore, InMemorySharedCache cache) {
        return new CachedQuotaManager(counterStore, cache, properties.getQuota(), objectMapper, clock);
    }

    // ===== Admission =====

    @Test
    void shouldAdmitUpToDailyLimitThenRejectWithDaily() {
        QuotaDecision first = quotaManager.checkAndIncrement(SUBJECT, OPERATION);
        QuotaDecision second = quotaManager.checkAndIncrement(SUBJECT, OPERATION);
        QuotaDecision third = quotaManager.checkAndIncrement(SUBJECT, OPERATION);

        assertTrue(first.isAllowed());
        assertEquals(1, first.getInfo().getDailyUsed());
        assertTrue(second.isAllowed());
        assertEquals(2, second.getInfo().getDailyUsed());
        assertNull(second.getExceededLimit());

        assertFalse(third.isAllowed());
        assertEquals(QuotaLimit.DAILY, third.getExceededLimit());
        assertEquals(2, third.getInfo().getDailyUsed());
        assertEquals(0, third.getInfo().getDailyRemaining());
        assertEquals(QuotaStatus.EXCEEDED, third.getInfo().getStatus());
    }

    @Test
    void shouldRecordLastOperation() {
        QuotaDecision decision = quotaManager.checkAndIncrement(SUBJECT, OPERATION);

        assertEquals(OPERATION, decision.getInfo().getLastOperation());
        assertEquals(clock.instant(), decision.getInfo().getLastUpdated());
    }

    @Test
    void shouldRejectWithMonthlyWhenMonthTotalReached() {
        properties.getQuota().setDailyLimit(10);
        properties.getQuota().setMonthlyLimit(3);

        assertTrue(quotaManager.checkAndIncrement(SUBJECT, OPERATION).isAllowed());
        assertTrue(quotaManager.checkAndIncrement(SUBJECT, OPERATION).isAllowed());
        clock.advance(Duration.ofDays(1));
        QuotaDecision third = quotaManager.checkAndIncrement(SUBJECT, OPERATION);
        QuotaDecision fourth = quotaManager.checkAndIncrement(SUBJECT, OPERATION);

        assertTrue(third.isAllowed());
        assertEquals(1, third.getInfo().getDailyUsed());
        assertEquals(3, third.getInfo().getMonthlyUsed());
        assertFalse(fourth.isAllowed());
        assertEquals(QuotaLimit.MONTHLY, fourth.getExceededLimit());
    }

    @Test
    void shouldResetDailyCountOnNewDay() {
        quotaManager.checkAndIncrement(SUBJECT, OPERATION);
        quotaManager.checkAndIncrement(SUBJECT, OPERATION);
        assertFalse(quotaManager.checkAndIncrement(SUBJECT, OPERATION).isAllowed());

        clock.advance(Duration.ofDays(1));
        QuotaDecision nextDay = quotaManager.checkAndIncrement(SUBJECT, OPERATION);

        assertTrue(nextDay.isAllowed());
        assertEquals(1, nextDay.getInfo().getDailyUsed());
        assertEquals(3, nextDay.getInfo().getMonthlyUsed());
    }

    @Test
    void admitShouldThrowWhenLimitReached() {
        quotaManager.admit(SUBJECT, OPERATION);
        quotaManager.admit(SUBJECT, OPERATION);

        QuotaExceededException error = assertThrows(QuotaExceededException.class,
                () -> quotaManager.admit(SUBJECT, OPERATION));
        assertEquals(QuotaLimit.DAILY, error.getLimit());
        assertEquals("Daily quota exceeded", error.getMessage());
    }

    // ===== Concurrency =====

    @Test
    void concurrentAdmissionsShouldStopExactlyAtRemainingQuota() throws Exception {
        properties.getQuota().setDailyLimit(40);
        CachedQuotaManager manager = newManager(new InMemoryCounterStoreAdapter(properties, clock), sharedCache);
        for (int i = 0; i < 15; i++) {
            assertTrue(manager.checkAndIncrement(SUBJECT, OPERATION).isAllowed());
        }

        assertEquals(25, admitConcurrently(manager, 8, 10));
        assertEquals(40, manager.getUsage(SUBJECT).getDailyUsed());
    }

    @Test
    void concurrentAdmissionsBelowRemainingQuotaShouldAllSucceed() throws Exception {
        properties.getQuota().setDailyLimit(40);
        CachedQuotaManager manager = newManager(new InMemoryCounterStoreAdapter(properties, clock), sharedCache);
        for (int i = 0; i < 15; i++) {
            manager.checkAndIncrement(SUBJECT, OPERATION);
        }

        assertEquals(16, admitConcurrently(manager, 8, 2));
        assertEquals(31, manager.getUsage(SUBJECT).getDailyUsed());
    }

    private static int admitConcurrently(CachedQuotaManager manager, int threads, int callsPerThread)
            throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                int admitted = 0;
                for (int j = 0; j < callsPerThread; j++) {
                    if (manager.checkAndIncrement(SUBJECT, OPERATION).isAllowed()) {
                        admitted++;
                    }
                }
                return admitted;
            }));
        }
        start.countDown();

        int total = 0;
        for (Future<Integer> future : futures) {
            total += future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        return total;
    }

    // ===== Cached reads =====

    @Test
    void checkFastShouldNotConsumeQuota() {
        QuotaDecision decision = quotaManager.checkFast(SUBJECT);

        assertTrue(decision.isAllowed());
        assertEquals(0, decision.getInfo().getDailyUsed());
        assertEquals(2, decision.getInfo().getDailyRemaining());
        assertEquals(0, quotaManager.checkFast(SUBJECT).getInfo().getDailyUsed());
    }

    @Test
    void checkFastShouldReturnIdenticalInfoWithoutRereadingStore() {
        quotaManager.checkAndIncrement(SUBJECT, OPERATION);

        QuotaInfo first = quotaManager.checkFast(SUBJECT).getInfo();
        QuotaInfo second = quotaManager.checkFast(SUBJECT).getInfo();
        QuotaInfo third = quotaManager.getUsage(SUBJECT);

        assertEquals(first, second);
        assertEquals(first, third);
        verify(store, times(1)).get(any(CounterKey.class));
    }

    @Test
    void shouldBackFillMemoryFromSharedCache() {
        QuotaInfo fromStore = quotaManager.checkFast(SUBJECT).getInfo();
        String key = CachedQuotaManager.cacheKey(new CounterKey(SUBJECT, "2026-03-10", "2026-03"));
        assertTrue(sharedCache.contains(key));
        assertEquals(Duration.ofSeconds(300), sharedCache.ttlOf(key));

        quotaManager.clearCache();
        QuotaInfo fromShared = quotaManager.checkFast(SUBJECT).getInfo();
        QuotaInfo fromMemory = quotaManager.checkFast(SUBJECT).getInfo();

        assertEquals(fromStore, fromShared);
        assertEquals(fromStore, fromMemory);
        assertEquals(2, sharedCache.reads());
        verify(store, times(1)).get(any(CounterKey.class));
    }

    @Test
    void shouldServeFromStoreAfterMemoryTtlWithoutSharedCache() {
        CachedQuotaManager memoryOnly = new CachedQuotaManager(store, null, properties.getQuota(), objectMapper,
                clock);

        memoryOnly.checkFast(SUBJECT);
        memoryOnly.checkFast(SUBJECT);
        clock.advance(Duration.ofSeconds(301));
        memoryOnly.checkFast(SUBJECT);

        verify(store, times(2)).get(any(CounterKey.class));
    }

    @Test
    void successfulIncrementShouldInvalidateEveryTier() {
        quotaManager.checkFast(SUBJECT);
        String key = CachedQuotaManager.cacheKey(new CounterKey(SUBJECT, "2026-03-10", "2026-03"));
        assertTrue(sharedCache.contains(key));

        quotaManager.checkAndIncrement(SUBJECT, OPERATION);

        assertFalse(sharedCache.contains(key));
        assertEquals(0, quotaManager.getMemoryCache().size());
        assertEquals(1, quotaManager.checkFast(SUBJECT).getInfo().getDailyUsed());
    }

    @Test
    void rejectionShouldRefreshCachesWithAuthoritativeCounts() {
        quotaManager.checkAndIncrement(SUBJECT, OPERATION);
        quotaManager.checkAndIncrement(SUBJECT, OPERATION);
        quotaManager.checkAndIncrement(SUBJECT, OPERATION);

        String key = CachedQuotaManager.cacheKey(new CounterKey(SUBJECT, "2026-03-10", "2026-03"));
        assertTrue(sharedCache.contains(key));

        QuotaDecision cached = quotaManager.checkFast(SUBJECT);
        assertFalse(cached.isAllowed());
        assertEquals(2, cached.getInfo().getDailyUsed());
        verify(store, times(1)).get(any(CounterKey.class));
    }

    @Test
    void sharedCacheFailureShouldBeTreatedAsMiss() {
        sharedCache.setFailing(true);

        quotaManager.checkAndIncrement(SUBJECT, OPERATION);
        QuotaDecision decision = quotaManager.checkFast(SUBJECT);

        assertTrue(decision.isAllowed());
        assertEquals(1, decision.getInfo().getDailyUsed());
        assertFalse(decision.getInfo().isTrackingError());
    }

    @Test
    void cacheKeyShouldNotExposeSubjectId() {
        String key = CachedQuotaManager.cacheKey(new CounterKey("alice@example.com", "2026-03-10", "2026-03"));

        assertTrue(key.startsWith("quota:"));
        assertFalse(key.contains("alice"));
        assertEquals("quota:".length() + 32, key.length());
    }

    // ===== Store outage =====

    @Test
    void failOpenShouldAdmitWithTrackingError() {
        CounterStorePort broken = brokenStore();
        CachedQuotaManager manager = newManager(broken, sharedCache);

        QuotaDecision increment = manager.checkAndIncrement(SUBJECT, OPERATION);
        QuotaDecision fast = manager.checkFast(SUBJECT);

        assertTrue(increment.isAllowed());
        assertTrue(increment.getInfo().isTrackingError());
        assertTrue(fast.isAllowed());
        assertTrue(fast.getInfo().isTrackingError());
    }

    @Test
    void failClosedShouldThrowTrackingException() {
        properties.getQuota().setStoreFailurePolicy(StoreFailurePolicy.FAIL_CLOSED);
        CounterStorePort broken = brokenStore();
        CachedQuotaManager manager = newManager(broken, sharedCache);

        TrackingException error = assertThrows(TrackingException.class,
                () -> manager.checkAndIncrement(SUBJECT, OPERATION));
        assertInstanceOf(CounterStoreUnavailableException.class, error.getCause());
        assertThrows(TrackingException.class, () -> manager.checkFast(SUBJECT));
    }

    @Test
    void rejectionShouldFallBackToObservedRecordWhenRereadFails() {
        properties.getQuota().setDailyLimit(1);
        quotaManager.checkAndIncrement(SUBJECT, OPERATION);
        doThrow(new CounterStoreUnavailableException("timeout")).when(store).get(any(CounterKey.class));

        QuotaDecision decision = quotaManager.checkAndIncrement(SUBJECT, OPERATION);

        assertFalse(decision.isAllowed());
        assertEquals(QuotaLimit.DAILY, decision.getExceededLimit());
        assertEquals(1, decision.getInfo().getDailyUsed());
    }

    private CounterStorePort brokenStore() {
        CounterStorePort broken = mock(CounterStorePort.class);
        when(broken.conditionalIncrement(any(), anyList(), anyString()))
                .thenThrow(new CounterStoreUnavailableException("connection refused"));
        when(broken.get(any())).thenThrow(new CounterStoreUnavailableException("connection refused"));
        return broken;
    }
}

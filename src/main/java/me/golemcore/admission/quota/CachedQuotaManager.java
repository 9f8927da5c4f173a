package me.golemcore.admission.quota;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.admission.domain.exception.CounterStoreUnavailableException;
import me.golemcore.admission.domain.exception.TrackingException;
import me.golemcore.admission.domain.model.ConditionalIncrementResult;
import me.golemcore.admission.domain.model.CounterKey;
import me.golemcore.admission.domain.model.FieldConstraint;
import me.golemcore.admission.domain.model.QuotaDecision;
import me.golemcore.admission.domain.model.QuotaInfo;
import me.golemcore.admission.domain.model.QuotaLimit;
import me.golemcore.admission.domain.model.StoreFailurePolicy;
import me.golemcore.admission.domain.model.UsageRecord;
import me.golemcore.admission.infrastructure.config.AdmissionProperties.QuotaProperties;
import me.golemcore.admission.port.outbound.CounterStorePort;
import me.golemcore.admission.port.outbound.SharedCachePort;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Quota manager backed by the durable counter store with two cache tiers in
 * front of it.
 *
 * <p>
 * Reads go memory, then shared cache, then store, back-filling every tier they
 * passed. Increments always go to the store's conditional write, which is the
 * only arbiter of admission; caches are invalidated after a successful
 * increment and refreshed with authoritative counts after a rejection.
 *
 * <p>
 * Shared cache failures are logged and treated as misses. Counter store
 * failures are handled according to {@link StoreFailurePolicy}.
 *
 * @since 1.0
 */
@Slf4j
public class CachedQuotaManager implements QuotaManager {

    private static final String LOG_PREFIX = "[Quota]";
    private static final String KEY_PREFIX = "quota:";
    private static final String CHECK_FAST_OPERATION = "checkFast";
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final CounterStorePort counterStore;
    private final SharedCachePort sharedCache;
    private final QuotaProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MemoryCache<UsageRecord> memoryCache;

    /**
     * @param sharedCache
     *            shared tier, or {@code null} to run with the memory tier only
     */
    public CachedQuotaManager(CounterStorePort counterStore, SharedCachePort sharedCache,
            QuotaProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.counterStore = counterStore;
        this.sharedCache = sharedCache;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.memoryCache = new MemoryCache<>(properties.getMemoryCacheMaxEntries(), clock);
    }

    @Override
    public QuotaDecision checkFast(String subjectId) {
        CounterKey key = currentKey(subjectId);
        UsageRecord record;
        try {
            record = readThrough(key);
        } catch (CounterStoreUnavailableException e) {
            return onStoreFailure(key, CHECK_FAST_OPERATION, e);
        }
        QuotaInfo info = toInfo(record);
        return info.getExceededLimit() == null ? QuotaDecision.allowed(info) : QuotaDecision.denied(info);
    }

    @Override
    public QuotaDecision checkAndIncrement(String subjectId, String operation) {
        CounterKey key = currentKey(subjectId);
        List<FieldConstraint> constraints = List.of(
                FieldConstraint.lessThan(UsageRecord.DAILY_COUNT, properties.getDailyLimit()),
                FieldConstraint.lessThan(UsageRecord.MONTHLY_COUNT, properties.getMonthlyLimit()));

        ConditionalIncrementResult result;
        try {
            result = counterStore.conditionalIncrement(key, constraints, operation);
        } catch (CounterStoreUnavailableException e) {
            return onStoreFailure(key, operation, e);
        }

        String cacheKey = cacheKey(key);
        if (result.isApplied()) {
            invalidate(cacheKey);
            QuotaInfo info = toInfo(result.getRecord()).toBuilder()
                    .exceededLimit(null)
                    .build();
            log.debug("{} Admitted {} for subject {}: daily {}/{}, monthly {}/{}", LOG_PREFIX, operation,
                    subjectId, info.getDailyUsed(), info.getDailyLimit(), info.getMonthlyUsed(),
                    info.getMonthlyLimit());
            return QuotaDecision.allowed(info);
        }

        QuotaInfo info = rejectedInfo(key, result);
        log.info("{} Rejected {} for subject {}: {} (daily {}/{}, monthly {}/{})", LOG_PREFIX, operation,
                subjectId, info.getExceededLimit(), info.getDailyUsed(), info.getDailyLimit(),
                info.getMonthlyUsed(), info.getMonthlyLimit());
        return QuotaDecision.denied(info);
    }

    @Override
    public QuotaInfo getUsage(String subjectId) {
        return checkFast(subjectId).getInfo();
    }

    @Override
    public void clearCache(String subjectId) {
        invalidate(cacheKey(currentKey(subjectId)));
    }

    /**
     * Clears the memory tier. Shared cache entries expire on their own TTL.
     */
    @Override
    public void clearCache() {
        memoryCache.clear();
        log.debug("{} Memory cache cleared", LOG_PREFIX);
    }

    MemoryCache<UsageRecord> getMemoryCache() {
        return memoryCache;
    }

    private UsageRecord readThrough(CounterKey key) {
        String cacheKey = cacheKey(key);

        Optional<UsageRecord> cached = memoryCache.get(cacheKey);
        if (cached.isPresent()) {
            return cached.get().copy();
        }

        Optional<UsageRecord> shared = readShared(cacheKey);
        if (shared.isPresent()) {
            memoryCache.put(cacheKey, shared.get().copy(), properties.getCacheTtl());
            return shared.get();
        }

        UsageRecord stored = counterStore.get(key).orElseGet(() -> UsageRecord.empty(key));
        refresh(cacheKey, stored);
        return stored;
    }

    private QuotaInfo rejectedInfo(CounterKey key, ConditionalIncrementResult result) {
        UsageRecord observed = result.getRecord();
        try {
            Optional<UsageRecord> authoritative = counterStore.get(key);
            if (authoritative.isPresent()) {
                observed = authoritative.get();
            }
        } catch (CounterStoreUnavailableException e) {
            log.warn("{} Re-read after rejection failed for {}, using observed counts: {}", LOG_PREFIX,
                    key.asString(), e.getMessage());
        }

        if (observed == null) {
            return QuotaInfo.trackingUnavailable(key, properties.getDailyLimit(), properties.getMonthlyLimit())
                    .toBuilder()
                    .exceededLimit(QuotaLimit.DAILY)
                    .build();
        }

        refresh(cacheKey(key), observed);
        QuotaInfo info = toInfo(observed);
        if (info.getExceededLimit() == null) {
            // counts read back under both limits; the month aggregate is the only other constraint
            info = info.toBuilder().exceededLimit(QuotaLimit.MONTHLY).build();
        }
        return info;
    }

    private QuotaDecision onStoreFailure(CounterKey key, String operation, CounterStoreUnavailableException e) {
        if (properties.getStoreFailurePolicy() == StoreFailurePolicy.FAIL_CLOSED) {
            log.error("{} Counter store unavailable, rejecting {} for subject {}: {}", LOG_PREFIX, operation,
                    key.subjectId(), e.getMessage());
            throw new TrackingException("Quota tracking unavailable for subject " + key.subjectId(), e);
        }
        log.error("{} Tracking error: counter store unavailable, admitting {} for subject {} untracked: {}",
                LOG_PREFIX, operation, key.subjectId(), e.getMessage());
        return QuotaDecision.allowed(
                QuotaInfo.trackingUnavailable(key, properties.getDailyLimit(), properties.getMonthlyLimit()));
    }

    private void refresh(String cacheKey, UsageRecord record) {
        memoryCache.put(cacheKey, record.copy(), properties.getCacheTtl());
        writeShared(cacheKey, record);
    }

    private void invalidate(String cacheKey) {
        memoryCache.invalidate(cacheKey);
        if (sharedCache == null) {
            return;
        }
        try {
            sharedCache.delete(cacheKey);
        } catch (RuntimeException e) {
            log.warn("{} Shared cache delete failed for {}: {}", LOG_PREFIX, cacheKey, e.getMessage());
        }
    }

    private Optional<UsageRecord> readShared(String cacheKey) {
        if (sharedCache == null) {
            return Optional.empty();
        }
        try {
            Optional<byte[]> bytes = sharedCache.get(cacheKey);
            if (bytes.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(bytes.get(), UsageRecord.class));
        } catch (IOException | RuntimeException e) {
            log.warn("{} Shared cache read failed for {}: {}", LOG_PREFIX, cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeShared(String cacheKey, UsageRecord record) {
        if (sharedCache == null) {
            return;
        }
        try {
            sharedCache.set(cacheKey, objectMapper.writeValueAsBytes(record), properties.getCacheTtl());
        } catch (IOException | RuntimeException e) {
            log.warn("{} Shared cache write failed for {}: {}", LOG_PREFIX, cacheKey, e.getMessage());
        }
    }

    private QuotaInfo toInfo(UsageRecord record) {
        return QuotaInfo.of(record, properties.getDailyLimit(), properties.getMonthlyLimit());
    }

    private CounterKey currentKey(String subjectId) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        return new CounterKey(subjectId, today.format(DAY_FORMAT), today.format(MONTH_FORMAT));
    }

    static String cacheKey(CounterKey key) {
        String raw = key.subjectId() + ":" + key.bucketDate();
        return KEY_PREFIX + DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }
}

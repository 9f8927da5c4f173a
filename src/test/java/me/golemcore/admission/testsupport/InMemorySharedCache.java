package me.golemcore.admission.testsupport;

import me.golemcore.admission.port.outbound.SharedCachePort;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed shared cache that can be switched into a failing mode. TTLs are
 * recorded but not enforced.
 */
public class InMemorySharedCache implements SharedCachePort {

    private final Map<String, byte[]> values = new ConcurrentHashMap<>();
    private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
    private final AtomicInteger reads = new AtomicInteger();
    private volatile boolean failing;

    @Override
    public Optional<byte[]> get(String key) {
        reads.incrementAndGet();
        failIfRequested();
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        failIfRequested();
        values.put(key, value);
        ttls.put(key, ttl);
    }

    @Override
    public void delete(String key) {
        failIfRequested();
        values.remove(key);
        ttls.remove(key);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Duration ttlOf(String key) {
        return ttls.get(key);
    }

    public int size() {
        return values.size();
    }

    public int reads() {
        return reads.get();
    }

    private void failIfRequested() {
        if (failing) {
            throw new IllegalStateException("shared cache down");
        }
    }
}

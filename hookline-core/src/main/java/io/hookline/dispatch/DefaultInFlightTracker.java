package io.hookline.dispatch;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>When {@code ttlMs} is zero (the default), a key remains tracked until released. When
 * positive, stale entries can be re-acquired after the TTL elapses, so a task lost by a
 * crashed worker does not block its (event, subscription) pair forever.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Map<String, Long> inflight = new ConcurrentHashMap<>();
    private final long ttlMs;
    private final AtomicInteger evictCounter = new AtomicInteger();

    public DefaultInFlightTracker() {
        this(0L);
    }

    /**
     * @param ttlMs time-to-live in milliseconds; 0 disables expiry
     */
    public DefaultInFlightTracker(long ttlMs) {
        if (ttlMs < 0) {
            throw new IllegalArgumentException("ttlMs must be >= 0");
        }
        this.ttlMs = ttlMs;
    }

    @Override
    public boolean tryAcquire(String key) {
        long now = System.currentTimeMillis();
        maybeEvictExpired(now);
        for (int attempt = 0; attempt < 10; attempt++) {
            Long existing = inflight.putIfAbsent(key, now);
            if (existing == null) {
                return true;
            }
            if (ttlMs > 0 && now - existing > ttlMs) {
                if (inflight.replace(key, existing, now)) {
                    return true;
                }
                continue;
            }
            return false;
        }
        return false;
    }

    private void maybeEvictExpired(long now) {
        if (ttlMs <= 0) return;
        // sample roughly every 1024 acquires
        if ((evictCounter.incrementAndGet() & 0x3FF) != 0) return;
        inflight.entrySet().removeIf(e -> now - e.getValue() > ttlMs * 2);
    }

    @Override
    public void release(String key) {
        inflight.remove(key);
    }

    @Override
    public int size() {
        return inflight.size();
    }
}

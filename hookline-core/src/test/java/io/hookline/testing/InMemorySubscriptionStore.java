package io.hookline.testing;

import io.hookline.model.Subscription;
import io.hookline.model.SubscriptionStatus;
import io.hookline.spi.SubscriptionStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public final class InMemorySubscriptionStore implements SubscriptionStore {
    private final Map<String, Subscription> rows = new ConcurrentHashMap<>();
    private final AtomicInteger forcedConflicts = new AtomicInteger();
    private final AtomicInteger updateCalls = new AtomicInteger();

    /** The next {@code count} updates fail as if another writer bumped the version. */
    public void forceConflicts(int count) {
        forcedConflicts.set(count);
    }

    public int updateCalls() {
        return updateCalls.get();
    }

    public void put(Subscription subscription) {
        rows.put(subscription.id(), subscription);
    }

    @Override
    public void insert(Connection conn, Subscription subscription) {
        if (rows.putIfAbsent(subscription.id(), subscription) != null) {
            throw new IllegalStateException("Duplicate id " + subscription.id());
        }
    }

    @Override
    public Optional<Subscription> find(Connection conn, String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public List<Subscription> findAll(Connection conn, SubscriptionStatus status) {
        List<Subscription> result = new ArrayList<>();
        for (Subscription s : rows.values()) {
            if (status == null || s.status() == status) {
                result.add(s);
            }
        }
        return result;
    }

    @Override
    public int update(Connection conn, Subscription subscription, long expectedVersion) {
        updateCalls.incrementAndGet();
        if (forcedConflicts.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            return 0;
        }
        Subscription[] written = new Subscription[1];
        rows.computeIfPresent(subscription.id(), (id, current) -> {
            if (current.version() != expectedVersion) {
                return current;
            }
            written[0] = subscription;
            return subscription;
        });
        return written[0] != null ? 1 : 0;
    }

    @Override
    public int delete(Connection conn, String id) {
        return rows.remove(id) != null ? 1 : 0;
    }
}

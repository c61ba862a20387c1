package io.hookline.spi;

import io.hookline.model.Subscription;
import io.hookline.model.SubscriptionStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for webhook subscriptions.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code hookline-jdbc} module.
 * Failures surface as {@link io.hookline.StoreException}.
 *
 * @see io.hookline.jdbc.store.AbstractJdbcSubscriptionStore
 */
public interface SubscriptionStore {

    /**
     * Inserts a new subscription row.
     *
     * @param conn         the JDBC connection
     * @param subscription the subscription to persist
     */
    void insert(Connection conn, Subscription subscription);

    /**
     * Loads a subscription by id.
     *
     * @param conn the JDBC connection
     * @param id   the subscription id
     * @return the subscription, or empty if absent
     */
    Optional<Subscription> find(Connection conn, String id);

    /**
     * Lists subscriptions ordered by creation time, then id.
     *
     * @param conn   the JDBC connection
     * @param status optional status filter ({@code null} for all)
     * @return matching subscriptions
     */
    List<Subscription> findAll(Connection conn, SubscriptionStatus status);

    /**
     * Lists subscriptions in {@code status} that were created before {@code before}.
     *
     * @param conn   the JDBC connection
     * @param status the status to match
     * @param before exclusive upper bound on {@code createdAt}
     * @return matching subscriptions
     */
    default List<Subscription> findCreatedBefore(Connection conn, SubscriptionStatus status, Instant before) {
        return findAll(conn, status).stream()
            .filter(s -> s.createdAt().isBefore(before))
            .toList();
    }

    /**
     * Writes {@code subscription} only if the stored row still carries
     * {@code expectedVersion}. The stored version becomes {@code subscription.version()}.
     *
     * @param conn            the JDBC connection
     * @param subscription    the new state
     * @param expectedVersion version the caller read
     * @return the number of rows updated (0 on a version conflict or missing row)
     */
    int update(Connection conn, Subscription subscription, long expectedVersion);

    /**
     * Deletes a subscription.
     *
     * @param conn the JDBC connection
     * @param id   the subscription id
     * @return the number of rows deleted (0 or 1)
     */
    int delete(Connection conn, String id);
}

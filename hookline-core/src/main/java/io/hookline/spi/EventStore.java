package io.hookline.spi;

import io.hookline.model.EventEnvelope;

import java.sql.Connection;
import java.util.Optional;

/**
 * Append-only persistence for accepted events.
 *
 * @see io.hookline.jdbc.store.AbstractJdbcEventStore
 */
public interface EventStore {

    /**
     * Inserts a new event.
     *
     * @param conn  the JDBC connection
     * @param event the event to persist
     */
    void insert(Connection conn, EventEnvelope event);

    /**
     * Loads an event by id.
     *
     * @param conn    the JDBC connection
     * @param eventId the event id
     * @return the event, or empty if absent (never stored, or purged)
     */
    Optional<EventEnvelope> find(Connection conn, String eventId);
}

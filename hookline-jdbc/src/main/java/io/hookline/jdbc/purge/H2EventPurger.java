package io.hookline.jdbc.purge;

import io.hookline.jdbc.TableNames;

/**
 * Retention purger for H2, the database of the embedded server profile. H2 accepts
 * {@code LIMIT} inside the {@code id IN (...)} subselect, so the shared batch statement
 * is used unchanged.
 */
public final class H2EventPurger extends AbstractJdbcEventPurger {

    /** Purges {@value TableNames#DEFAULT_EVENT_TABLE}. */
    public H2EventPurger() {
    }

    public H2EventPurger(String eventTable) {
        super(eventTable);
    }
}

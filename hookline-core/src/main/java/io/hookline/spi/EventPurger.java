package io.hookline.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes persisted events older than a cutoff, in bounded batches.
 *
 * @see io.hookline.retention.RetentionScheduler
 */
public interface EventPurger {

    /**
     * Deletes up to {@code limit} events created before {@code before}.
     *
     * @param conn   the JDBC connection (auto-commit)
     * @param before exclusive cutoff
     * @param limit  maximum rows to delete
     * @return the number of rows deleted
     */
    int purge(Connection conn, Instant before, int limit);
}

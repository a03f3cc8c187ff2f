package mediaflow.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes records that reached a terminal state before a cutoff.
 *
 * @see mediaflow.purge.RetentionSweeper
 */
public interface RecordPurger {

    /**
     * Deletes up to {@code limit} terminal records last updated before {@code before}.
     *
     * @param conn   the connection
     * @param before the retention cutoff
     * @param limit  maximum rows to delete in this batch
     * @return the number of rows deleted
     */
    int purge(Connection conn, Instant before, int limit);
}

package io.github.yok.credload.core;

import io.github.yok.credload.config.ImportConfig;
import java.time.LocalDate;
import javax.sql.DataSource;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * State of a single import run.
 *
 * <p>
 * Holds the store handle, the run's configuration, and its counters. One instance is created per
 * input file and handed to every stage of the run. Counters are owned by the run's thread and are
 * not synchronized.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public class ImportContext {

    // Process-wide connection pool
    @NonNull
    private final DataSource dataSource;

    @NonNull
    private final ImportMode mode;

    // Effective profile of the mode (table, batch size, source name)
    @NonNull
    private final ImportConfig.Profile profile;

    // Append-only ledger table
    @NonNull
    private final String ledgerTable;

    // Data vintage written to the ledger
    @NonNull
    private final LocalDate logicalDate;

    private long linesRead;
    private long accepted;
    private long errors;
    private long batches;

    /** Counts one line taken from the input. */
    public void lineRead() {
        linesRead++;
    }

    /** Counts one row handed to the accumulator. */
    public void rowAccepted() {
        accepted++;
    }

    /** Counts one row-level or batch-level error. */
    public void recordError() {
        errors++;
    }

    /** Counts one upsert writer invocation, including the final possibly empty one. */
    public void batchAttempted() {
        batches++;
    }

    /**
     * Returns the ledger state the run would get now.
     *
     * @return {@link ImportState#ERROR} once any error was counted
     */
    public ImportState currentState() {
        return ImportState.fromErrorCount(errors);
    }
}

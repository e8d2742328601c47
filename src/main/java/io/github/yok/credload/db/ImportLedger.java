package io.github.yok.credload.db;

import io.github.yok.credload.core.ImportContext;
import io.github.yok.credload.core.ImportState;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDate;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends one audit row per completed run.
 *
 * <p>
 * Writing the entry is best effort: a failure is logged and does not change the run's outcome.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ImportLedger {

    /**
     * Records the run held by the context with its current state.
     *
     * @param context run context
     * @return {@code true} if the entry was written
     */
    public boolean record(ImportContext context) {
        return record(context.getDataSource(), context.getLedgerTable(),
                context.getProfile().getSourceName(), context.currentState(),
                context.getLogicalDate());
    }

    /**
     * Inserts a ledger entry.
     *
     * @param dataSource store handle
     * @param ledgerTable ledger table
     * @param sourceName name of the imported corpus
     * @param state terminal state of the run
     * @param logicalDate data vintage of the corpus
     * @return {@code true} if the entry was written
     */
    public boolean record(DataSource dataSource, String ledgerTable, String sourceName,
            ImportState state, LocalDate logicalDate) {
        String sql = "INSERT INTO " + SqlIdentifiers.require(ledgerTable)
                + " (name, state, import_date) VALUES (?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sourceName);
            ps.setString(2, state.getDbValue());
            ps.setDate(3, Date.valueOf(logicalDate));
            ps.executeUpdate();
            log.info("Import of {} recorded as '{}' for {}", sourceName, state.getDbValue(),
                    logicalDate);
            return true;
        } catch (SQLException e) {
            log.error("Error writing to {}: {}", ledgerTable, e.getMessage(), e);
            return false;
        }
    }
}

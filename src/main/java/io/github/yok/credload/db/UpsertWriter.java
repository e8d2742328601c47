package io.github.yok.credload.db;

import io.github.yok.credload.core.ImportContext;
import io.github.yok.credload.model.CredentialRow;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Writes one batch as a single multi-row upsert.
 *
 * <p>
 * A failed statement counts as one error of the run, whatever the batch size; its rows are not
 * retried. Because every statement is an upsert, replaying a batch yields the same content.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class UpsertWriter {

    // Length of the SQL prefix included in failure logs
    private static final int SQL_LOG_WIDTH = 160;

    /**
     * Upserts the rows into the context's destination table.
     *
     * <p>
     * Every call counts as a batch attempt. An empty list does not touch the store.
     * </p>
     *
     * @param context run context
     * @param rows rows of the context mode's variant, in input order
     * @return {@code true} if the statement succeeded or there was nothing to write
     * @throws IllegalArgumentException if a row's variant differs from the mode's variant
     */
    public boolean write(ImportContext context, List<CredentialRow> rows) {
        context.batchAttempted();
        if (rows.isEmpty()) {
            log.debug("[{}] Empty batch → nothing to write", context.getMode());
            return true;
        }

        UpsertStatement statement = UpsertStatement.forBatch(context.getProfile().getTable(),
                context.getMode().getVariant(), rows.size());

        try (Connection conn = context.getDataSource().getConnection();
                PreparedStatement ps = conn.prepareStatement(statement.getSql())) {
            statement.bind(ps, rows);
            ps.executeUpdate();
            log.debug("[{}] Upserted batch of {} rows into {}", context.getMode(), rows.size(),
                    statement.getTable());
            return true;
        } catch (SQLException e) {
            context.recordError();
            log.error("Err: {} on {} ({} rows)", e.getMessage(),
                    StringUtils.abbreviate(statement.getSql(), SQL_LOG_WIDTH), rows.size());
            return false;
        }
    }
}

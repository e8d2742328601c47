package io.github.yok.credload.db;

import com.google.common.base.Preconditions;
import io.github.yok.credload.model.CredentialRow;
import io.github.yok.credload.model.RowVariant;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Multi-row {@code INSERT ... ON CONFLICT} statement for one batch of same-variant rows.
 *
 * <p>
 * The SQL text is generated from the variant's column lists: one placeholder group per row, JDBC
 * {@code ?} markers only, and a conflict clause on the identifier column:
 * </p>
 *
 * <pre>
 * INSERT INTO hibp (hibp_id, count) VALUES (?, ?),(?, ?)
 *     ON CONFLICT (hibp_id) DO UPDATE SET count = EXCLUDED.count
 * INSERT INTO hibp_compact (hibp_id) VALUES (?),(?) ON CONFLICT (hibp_id) DO NOTHING
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class UpsertStatement {

    private final String table;
    private final RowVariant variant;
    private final int rowCount;
    private final ConflictAction conflictAction;
    private final String sql;

    private UpsertStatement(String table, RowVariant variant, int rowCount) {
        this.table = SqlIdentifiers.require(table);
        this.variant = variant;
        this.rowCount = rowCount;
        this.conflictAction = variant.updateColumns().isEmpty() ? ConflictAction.DO_NOTHING
                : ConflictAction.UPDATE;
        this.sql = buildSql();
    }

    /**
     * Creates the statement for a batch.
     *
     * @param table destination table
     * @param variant variant of every row in the batch
     * @param rowCount number of rows; must be positive
     * @return statement
     * @throws IllegalArgumentException if {@code rowCount} is not positive or the table name is
     *         not a plain identifier
     */
    public static UpsertStatement forBatch(String table, RowVariant variant, int rowCount) {
        Preconditions.checkNotNull(variant, "variant must not be null");
        Preconditions.checkArgument(rowCount > 0, "rowCount must be positive: %s", rowCount);
        return new UpsertStatement(table, variant, rowCount);
    }

    /**
     * Returns the total number of bind parameters.
     *
     * @return parameter count
     */
    public int parameterCount() {
        return rowCount * variant.parametersPerRow();
    }

    /**
     * Binds the rows' values in order.
     *
     * @param ps statement prepared from {@link #getSql()}
     * @param rows rows of this statement's variant; exactly {@link #getRowCount()} of them
     * @throws SQLException if binding fails
     * @throws IllegalArgumentException if the row count or a row's variant does not match
     */
    public void bind(PreparedStatement ps, List<CredentialRow> rows) throws SQLException {
        Preconditions.checkArgument(rows.size() == rowCount, "Expected %s rows but got %s",
                rowCount, rows.size());
        int index = 1;
        for (CredentialRow row : rows) {
            Preconditions.checkArgument(row.getVariant() == variant,
                    "Row variant %s does not match batch variant %s", row.getVariant(), variant);
            for (Object value : row.bindValues()) {
                ps.setObject(index++, value);
            }
        }
    }

    private String buildSql() {
        List<String> columns = variant.insertColumns();
        String group = columns.stream().map(c -> "?")
                .collect(Collectors.joining(", ", "(", ")"));

        StringBuilder sb = new StringBuilder(64 + rowCount * (group.length() + 1));
        sb.append("INSERT INTO ").append(table).append(" (").append(String.join(", ", columns))
                .append(") VALUES ");
        sb.append(String.join(",", Collections.nCopies(rowCount, group)));
        sb.append(" ON CONFLICT (").append(CredentialRow.COLUMN_IDENTIFIER).append(") ");
        if (conflictAction == ConflictAction.DO_NOTHING) {
            sb.append("DO NOTHING");
        } else {
            sb.append("DO UPDATE SET ").append(variant.updateColumns().stream()
                    .map(c -> c + " = EXCLUDED." + c).collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }
}

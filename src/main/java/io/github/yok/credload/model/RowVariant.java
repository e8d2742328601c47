package io.github.yok.credload.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Shape of a destination row and the column policy applied when its identifier already exists.
 *
 * <p>
 * Every variant writes the identifier key column. {@link #COUNT} and {@link #PASSWORD} overwrite
 * only their own value column on conflict; other columns of the existing record stay untouched.
 * {@link #IDENTIFIER} keeps the first stored record and ignores later duplicates.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum RowVariant {

    /** {@code identifier, count}; updates {@code count} on conflict. */
    COUNT(ImmutableList.of(CredentialRow.COLUMN_COUNT),
            ImmutableList.of(CredentialRow.COLUMN_COUNT)),

    /** {@code identifier, password}; updates {@code password} on conflict. */
    PASSWORD(ImmutableList.of(CredentialRow.COLUMN_PASSWORD),
            ImmutableList.of(CredentialRow.COLUMN_PASSWORD)),

    /** {@code identifier} only; conflicts are ignored. */
    IDENTIFIER(ImmutableList.of(), ImmutableList.of());

    private final List<String> valueColumns;
    private final List<String> updateColumns;

    RowVariant(List<String> valueColumns, List<String> updateColumns) {
        this.valueColumns = valueColumns;
        this.updateColumns = updateColumns;
    }

    /**
     * Returns the inserted columns in bind order, key column first.
     *
     * @return column names
     */
    public List<String> insertColumns() {
        return ImmutableList.<String>builder().add(CredentialRow.COLUMN_IDENTIFIER)
                .addAll(valueColumns).build();
    }

    /**
     * Returns the columns overwritten on key conflict; empty means "do nothing".
     *
     * @return column names
     */
    public List<String> updateColumns() {
        return updateColumns;
    }

    /**
     * Returns the number of bind parameters one row of this variant contributes.
     *
     * @return parameters per row
     */
    public int parametersPerRow() {
        return 1 + valueColumns.size();
    }
}

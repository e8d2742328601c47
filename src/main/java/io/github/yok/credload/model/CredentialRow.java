package io.github.yok.credload.model;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * One destination row, tagged with its {@link RowVariant}.
 *
 * <p>
 * Instances are created per input line through the {@code of*} factories and live only inside a
 * single batch buffer. The identifier is already encoded for storage; the value fields that do not
 * belong to the variant are {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class CredentialRow {

    /** Primary-key column. */
    public static final String COLUMN_IDENTIFIER = "hibp_id";
    /** Occurrence count column. */
    public static final String COLUMN_COUNT = "count";
    /** Plaintext password column. */
    public static final String COLUMN_PASSWORD = "password";

    private final RowVariant variant;
    private final String identifier;
    private final Integer count;
    private final String password;

    /**
     * Creates a count row.
     *
     * @param identifier encoded identifier
     * @param count occurrence count
     * @return row of variant {@link RowVariant#COUNT}
     */
    public static CredentialRow ofCount(String identifier, int count) {
        return new CredentialRow(RowVariant.COUNT, requireIdentifier(identifier), count, null);
    }

    /**
     * Creates a password row.
     *
     * @param identifier encoded identifier
     * @param password plaintext password
     * @return row of variant {@link RowVariant#PASSWORD}
     */
    public static CredentialRow ofPassword(String identifier, String password) {
        Preconditions.checkNotNull(password, "password must not be null");
        return new CredentialRow(RowVariant.PASSWORD, requireIdentifier(identifier), null,
                password);
    }

    /**
     * Creates an identifier-only row.
     *
     * @param identifier encoded identifier
     * @return row of variant {@link RowVariant#IDENTIFIER}
     */
    public static CredentialRow ofIdentifier(String identifier) {
        return new CredentialRow(RowVariant.IDENTIFIER, requireIdentifier(identifier), null, null);
    }

    /**
     * Returns the values to bind, in the order of {@link RowVariant#insertColumns()}.
     *
     * @return bind values
     */
    public List<Object> bindValues() {
        switch (variant) {
            case COUNT:
                return Arrays.asList(identifier, count);
            case PASSWORD:
                return Arrays.asList(identifier, password);
            default:
                return Collections.singletonList(identifier);
        }
    }

    private static String requireIdentifier(String identifier) {
        Preconditions.checkArgument(StringUtils.isNotEmpty(identifier),
                "identifier must not be empty");
        return identifier;
    }
}

package io.github.yok.credload.config;

import com.google.common.base.Preconditions;
import io.github.yok.credload.core.ImportMode;
import io.github.yok.credload.util.LogicalDateParser;
import java.util.EnumMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Import policy: per-mode destination table, batch size, ledger source name, and identifier width.
 *
 * <pre>
 * import:
 *   date-format: MMMM d uuuu
 *   ledger-table: imports
 *   profiles:
 *     count:
 *       table: hibp
 *       batch-size: 10000
 *       source-name: pwned-passwords-sha1
 *       identifier-length: 40
 * </pre>
 *
 * <p>
 * Anything not configured falls back to {@link ImportMode#defaultProfile()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "import")
@Data
public class ImportConfig {

    /** PostgreSQL limit of bind parameters in one statement. */
    public static final int MAX_BIND_PARAMETERS = 65_535;

    // Pattern of the logical date argument
    private String dateFormat = LogicalDateParser.DEFAULT_PATTERN;

    // Append-only ledger table
    private String ledgerTable = "imports";

    // Per-mode overrides keyed by mode
    private Map<ImportMode, Profile> profiles = new EnumMap<>(ImportMode.class);

    /**
     * Settings of one import mode.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Profile {
        // Destination table
        private String table;
        // Rows per upsert statement
        private int batchSize;
        // Source name written to the ledger
        private String sourceName;
        // Width of the identifier column
        private int identifierLength;
    }

    /**
     * Returns the effective profile for the mode, validating it against the statement limits.
     *
     * <p>
     * Configured values override the mode's default one by one; an unset table or source name and
     * a zero batch size or identifier length keep the default.
     * </p>
     *
     * @param mode import mode
     * @return effective profile
     * @throws IllegalStateException if a value is negative or the batch exceeds
     *         {@link #MAX_BIND_PARAMETERS}
     */
    public Profile profileFor(ImportMode mode) {
        Profile effective = mode.defaultProfile();
        Profile configured = profiles.get(mode);
        if (configured != null) {
            if (StringUtils.isNotBlank(configured.getTable())) {
                effective.setTable(configured.getTable());
            }
            if (StringUtils.isNotBlank(configured.getSourceName())) {
                effective.setSourceName(configured.getSourceName());
            }
            if (configured.getBatchSize() != 0) {
                effective.setBatchSize(configured.getBatchSize());
            }
            if (configured.getIdentifierLength() != 0) {
                effective.setIdentifierLength(configured.getIdentifierLength());
            }
        }

        Preconditions.checkState(effective.getBatchSize() > 0,
                "import.profiles.%s.batch-size must be positive: %s", mode.key(),
                effective.getBatchSize());
        Preconditions.checkState(effective.getIdentifierLength() > 0,
                "import.profiles.%s.identifier-length must be positive: %s", mode.key(),
                effective.getIdentifierLength());
        long parameters = (long) effective.getBatchSize() * mode.getVariant().parametersPerRow();
        Preconditions.checkState(parameters <= MAX_BIND_PARAMETERS,
                "import.profiles.%s.batch-size %s needs %s bind parameters (max %s)", mode.key(),
                effective.getBatchSize(), parameters, MAX_BIND_PARAMETERS);
        return effective;
    }
}

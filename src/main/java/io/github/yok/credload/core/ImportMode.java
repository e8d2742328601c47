package io.github.yok.credload.core;

import com.google.common.base.CharMatcher;
import io.github.yok.credload.codec.Ascii85IdentifierEncoder;
import io.github.yok.credload.codec.IdentifierEncoder;
import io.github.yok.credload.codec.LowercaseHexIdentifierEncoder;
import io.github.yok.credload.config.ImportConfig;
import io.github.yok.credload.model.CredentialRow;
import io.github.yok.credload.model.RowVariant;
import java.util.Locale;
import lombok.Getter;

/**
 * Kind of corpus being imported.
 *
 * <p>
 * A mode fixes the row variant, the identifier encoding, how the value field is interpreted, and
 * the default {@link ImportConfig.Profile}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ImportMode {

    /** {@code hexdigest:count} stored as lowercase hex with its count. */
    COUNT(RowVariant.COUNT) {
        @Override
        public IdentifierEncoder newEncoder() {
            return new LowercaseHexIdentifierEncoder();
        }

        @Override
        public CredentialRow toRow(String identifier, String value)
                throws MalformedLineException {
            String digits = value.startsWith("-") ? value.substring(1) : value;
            if (digits.isEmpty() || !ASCII_DIGITS.matchesAllOf(digits)) {
                throw new MalformedLineException("Count is not an integer: " + value);
            }
            try {
                return CredentialRow.ofCount(identifier, Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new MalformedLineException("Count is not an integer: " + value, e);
            }
        }

        @Override
        public ImportConfig.Profile defaultProfile() {
            return new ImportConfig.Profile("hibp", 10_000, "pwned-passwords-sha1", 40);
        }
    },

    /** {@code hexdigest:plaintext} stored as lowercase hex with its password. */
    PASSWORD(RowVariant.PASSWORD) {
        @Override
        public IdentifierEncoder newEncoder() {
            return new LowercaseHexIdentifierEncoder();
        }

        @Override
        public CredentialRow toRow(String identifier, String value) {
            return CredentialRow.ofPassword(identifier, value);
        }

        @Override
        public ImportConfig.Profile defaultProfile() {
            return new ImportConfig.Profile("hibp", 10_000, "pwned-passwords-plain", 40);
        }
    },

    /** {@code hexdigest:count} stored as an ASCII85 identifier only; the count is ignored. */
    COMPACT(RowVariant.IDENTIFIER) {
        @Override
        public IdentifierEncoder newEncoder() {
            return new Ascii85IdentifierEncoder();
        }

        @Override
        public CredentialRow toRow(String identifier, String value) {
            return CredentialRow.ofIdentifier(identifier);
        }

        @Override
        public ImportConfig.Profile defaultProfile() {
            return new ImportConfig.Profile("hibp_compact", 60_000,
                    "pwned-passwords-sha1-ascii85", 25);
        }
    };

    // Integer.parseInt also accepts '+' and non-ASCII decimal digits
    private static final CharMatcher ASCII_DIGITS = CharMatcher.inRange('0', '9');

    private final RowVariant variant;

    ImportMode(RowVariant variant) {
        this.variant = variant;
    }

    /**
     * Returns the configuration key of this mode ({@code count}, {@code password},
     * {@code compact}).
     *
     * @return lowercase key
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Creates the identifier encoder used by this mode.
     *
     * @return new encoder
     */
    public abstract IdentifierEncoder newEncoder();

    /**
     * Builds a row from an encoded identifier and the raw value field.
     *
     * @param identifier encoded identifier
     * @param value value field of the line
     * @return row of this mode's variant
     * @throws MalformedLineException if the value field cannot be interpreted
     */
    public abstract CredentialRow toRow(String identifier, String value)
            throws MalformedLineException;

    /**
     * Returns a fresh copy of this mode's default profile.
     *
     * @return default profile
     */
    public abstract ImportConfig.Profile defaultProfile();
}

package io.github.yok.credload.db;

import com.google.common.base.Preconditions;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Guards configured table names before they are spliced into SQL text.
 */
final class SqlIdentifiers {

    // Unquoted identifier, optionally schema-qualified
    private static final Pattern IDENTIFIER =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    @Generated
    private SqlIdentifiers() {
        throw new AssertionError("No io.github.yok.credload.db.SqlIdentifiers instances for you!");
    }

    static String require(String name) {
        Preconditions.checkArgument(name != null && IDENTIFIER.matcher(name).matches(),
                "Not a plain SQL identifier: %s", name);
        return name;
    }
}

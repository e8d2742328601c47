package io.github.yok.credload.core;

import org.apache.commons.lang3.StringUtils;

/**
 * Splits an input line into key and value on the first separator.
 *
 * <p>
 * Only the first separator splits; the value may contain further separators. Both fields must be
 * non-empty. Field contents are not validated here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class LineParser {

    /** Separator of {@code key:value} lines. */
    public static final char SEPARATOR = ':';

    /**
     * Parses one line.
     *
     * @param line input line without its terminator
     * @return key and value
     * @throws MalformedLineException if the separator is missing or a field is empty
     */
    public ParsedLine parse(String line) throws MalformedLineException {
        int at = line.indexOf(SEPARATOR);
        if (at < 0) {
            throw new MalformedLineException(
                    "Missing separator: " + StringUtils.abbreviate(line, 80));
        }
        String key = line.substring(0, at);
        String value = line.substring(at + 1);
        if (key.isEmpty() || value.isEmpty()) {
            throw new MalformedLineException(
                    "Empty field: " + StringUtils.abbreviate(line, 80));
        }
        return new ParsedLine(key, value);
    }
}

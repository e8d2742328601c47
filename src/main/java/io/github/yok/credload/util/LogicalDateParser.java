package io.github.yok.credload.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses the logical (data vintage) date supplied on the command line.
 *
 * <p>
 * The default pattern is {@code MMMM d uuuu} with English month names, e.g.
 * {@code November 19 2020}. The pattern is resolved strictly, so {@code February 30 2020} is
 * rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LogicalDateParser {

    /** Pattern used when none is configured. */
    public static final String DEFAULT_PATTERN = "MMMM d uuuu";

    private final String pattern;
    private final DateTimeFormatter formatter;

    /**
     * Creates a parser with {@link #DEFAULT_PATTERN}.
     */
    public LogicalDateParser() {
        this(DEFAULT_PATTERN);
    }

    /**
     * Creates a parser for the given pattern.
     *
     * @param pattern {@link DateTimeFormatter} pattern; English month names are assumed
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public LogicalDateParser(String pattern) {
        this.pattern = pattern;
        this.formatter = DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Parses the given text.
     *
     * @param text date text, e.g. {@code November 19 2020}
     * @return parsed date
     * @throws IllegalArgumentException if the text is blank or does not match the pattern
     */
    public LocalDate parse(String text) {
        if (StringUtils.isBlank(text)) {
            throw new IllegalArgumentException(
                    "Missing required date field e.g. November 19 2020");
        }
        try {
            LocalDate date = LocalDate.parse(text.trim(), formatter);
            log.info("File import date {}", date);
            return date;
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Invalid date '" + text + "' (expected pattern '" + pattern + "')", e);
        }
    }
}

package io.github.yok.credload.core;

/**
 * Signals an input line that does not form a row (missing separator, empty field, bad count).
 *
 * @author Yasuharu.Okawauchi
 */
public class MalformedLineException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public MalformedLineException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause underlying parse failure
     */
    public MalformedLineException(String message, Throwable cause) {
        super(message, cause);
    }
}

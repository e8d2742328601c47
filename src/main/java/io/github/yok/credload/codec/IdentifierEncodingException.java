package io.github.yok.credload.codec;

/**
 * Signals that one input key could not be turned into an identifier.
 *
 * <p>
 * Recoverable at row level: the pipeline counts the error and continues with the next line.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class IdentifierEncodingException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public IdentifierEncodingException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause underlying decode failure
     */
    public IdentifierEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}

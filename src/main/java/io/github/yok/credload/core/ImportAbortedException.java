package io.github.yok.credload.core;

/**
 * Infrastructure failure that stops a run before its ledger entry is written.
 *
 * <p>
 * Raised for unreadable input, schema creation failure, and similar conditions. Data-quality
 * problems never raise it; they are counted instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ImportAbortedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause underlying failure
     */
    public ImportAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}

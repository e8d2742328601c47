package io.github.yok.credload.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Terminal state recorded in the ledger.
 */
@Getter
@RequiredArgsConstructor
public enum ImportState {

    DONE("done"),

    ERROR("error");

    // Value stored in the ledger's state column
    private final String dbValue;

    /**
     * Derives the state from a run's error count.
     *
     * @param errors row- and batch-level errors of the run
     * @return {@link #ERROR} if any error occurred, else {@link #DONE}
     */
    public static ImportState fromErrorCount(long errors) {
        return errors > 0 ? ERROR : DONE;
    }
}

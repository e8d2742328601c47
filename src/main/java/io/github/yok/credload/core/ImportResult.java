package io.github.yok.credload.core;

import lombok.Value;

/**
 * Outcome of one completed run.
 */
@Value
public class ImportResult {
    // Ledger source name of the run
    String sourceName;
    // Rows handed to the writer
    long accepted;
    // Row-level plus batch-level errors
    long errors;
    // Writer invocations, including the final flush
    long batches;
    ImportState state;

    static ImportResult of(ImportContext context) {
        return new ImportResult(context.getProfile().getSourceName(), context.getAccepted(),
                context.getErrors(), context.getBatches(), context.currentState());
    }
}

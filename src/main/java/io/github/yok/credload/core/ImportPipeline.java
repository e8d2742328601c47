package io.github.yok.credload.core;

import io.github.yok.credload.codec.IdentifierEncoder;
import io.github.yok.credload.codec.IdentifierEncodingException;
import io.github.yok.credload.db.ImportLedger;
import io.github.yok.credload.db.SchemaInitializer;
import io.github.yok.credload.db.UpsertWriter;
import io.github.yok.credload.model.CredentialRow;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;

/**
 * Streams one input file into the destination table and records the run in the ledger.
 *
 * <p>
 * <strong>Phases:</strong>
 * </p>
 * <ul>
 * <li>{@link PipelineState#INIT}: ensure the schema exists and open the file.</li>
 * <li>{@link PipelineState#STREAMING}: parse, encode and buffer each line; write the buffer
 * whenever it reaches the batch size.</li>
 * <li>{@link PipelineState#FLUSHING}: write whatever is left once the input ends (possibly
 * nothing).</li>
 * <li>{@link PipelineState#LOGGING}: append the ledger entry, {@code error} if any row or batch
 * failed, else {@code done}.</li>
 * </ul>
 *
 * <p>
 * Malformed lines, undecodable identifiers, and failed batches are counted and skipped. Failing to
 * create the schema or to read the file aborts the run with {@link ImportAbortedException} and no
 * ledger entry is written.
 * </p>
 *
 * <p>
 * The run is strictly sequential: each batch is written before the next one is accumulated.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ImportPipeline {

    private final ImportContext context;
    private final LineParser parser;
    private final IdentifierEncoder encoder;
    private final UpsertWriter writer;
    private final ImportLedger ledger;
    private final SchemaInitializer schemaInitializer;

    private PipelineState state = PipelineState.INIT;

    /**
     * Creates a pipeline with the mode's encoder and the default store collaborators.
     *
     * @param context run context
     */
    public ImportPipeline(ImportContext context) {
        this(context, new LineParser(), context.getMode().newEncoder(), new UpsertWriter(),
                new ImportLedger(), new SchemaInitializer());
    }

    /**
     * Creates a pipeline with explicit collaborators.
     *
     * @param context run context
     * @param parser line parser
     * @param encoder identifier encoder
     * @param writer batch writer
     * @param ledger ledger writer
     * @param schemaInitializer schema bootstrap
     */
    ImportPipeline(ImportContext context, LineParser parser, IdentifierEncoder encoder,
            UpsertWriter writer, ImportLedger ledger, SchemaInitializer schemaInitializer) {
        this.context = context;
        this.parser = parser;
        this.encoder = encoder;
        this.writer = writer;
        this.ledger = ledger;
        this.schemaInitializer = schemaInitializer;
    }

    /**
     * Imports the file.
     *
     * @param file input file, UTF-8, one {@code key:value} record per line
     * @return counts and terminal state of the run
     * @throws ImportAbortedException if the schema cannot be created or the file cannot be read
     */
    public ImportResult run(Path file) {
        String sourceName = context.getProfile().getSourceName();
        log.info("=== {} import started (file={}, date={}, batchSize={}) ===", sourceName, file,
                context.getLogicalDate(), context.getProfile().getBatchSize());

        transition(PipelineState.INIT);
        try {
            schemaInitializer.ensure(context.getDataSource(), context.getProfile(),
                    context.getLedgerTable());
        } catch (SQLException e) {
            throw new ImportAbortedException("Schema creation failed: " + e.getMessage(), e);
        }

        BatchAccumulator<CredentialRow> accumulator =
                new BatchAccumulator<>(context.getProfile().getBatchSize());

        // Undecodable bytes become U+FFFD instead of failing the whole read
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            transition(PipelineState.STREAMING);
            String line;
            while ((line = reader.readLine()) != null) {
                context.lineRead();
                CredentialRow row = toRow(line);
                if (row == null) {
                    continue;
                }
                accumulator.append(row);
                context.rowAccepted();

                if (accumulator.shouldFlush()) {
                    log.info("processing {}...", context.getAccepted());
                    writer.write(context, accumulator.drain());
                }
            }
        } catch (IOException e) {
            throw new ImportAbortedException("Cannot read " + file + ": " + e.getMessage(), e);
        }

        transition(PipelineState.FLUSHING);
        writer.write(context, accumulator.drain());

        transition(PipelineState.LOGGING);
        if (context.getErrors() > 0) {
            log.warn("{} Error(s) found", context.getErrors());
        }
        ledger.record(context);

        transition(PipelineState.DONE);
        ImportResult result = ImportResult.of(context);
        log.info("=== {} import finished (lines={}, accepted={}, errors={}, batches={}, "
                + "state={}) ===", sourceName, context.getLinesRead(), result.getAccepted(),
                result.getErrors(), result.getBatches(), result.getState().getDbValue());
        return result;
    }

    /**
     * Returns the phase reached by the last {@link #run(Path)}.
     *
     * @return current phase
     */
    public PipelineState getState() {
        return state;
    }

    private CredentialRow toRow(String line) {
        try {
            ParsedLine parsed = parser.parse(line);
            String identifier = encoder.encode(parsed.getKey());
            return context.getMode().toRow(identifier, parsed.getValue());
        } catch (MalformedLineException | IdentifierEncodingException e) {
            context.recordError();
            log.debug("Line {} skipped: {}", context.getLinesRead(), e.getMessage());
            return null;
        }
    }

    private void transition(PipelineState next) {
        log.debug("[{}] {} → {}", context.getMode(), state, next);
        state = next;
    }
}

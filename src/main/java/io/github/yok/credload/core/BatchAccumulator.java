package io.github.yok.credload.core;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size row buffer between the parser and the upsert writer.
 *
 * @param <T> row type
 * @author Yasuharu.Okawauchi
 */
public class BatchAccumulator<T> {

    private final int batchSize;
    private List<T> buffer;

    /**
     * Creates an accumulator.
     *
     * @param batchSize number of rows after which {@link #shouldFlush()} becomes {@code true}
     * @throws IllegalArgumentException if {@code batchSize} is not positive
     */
    public BatchAccumulator(int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive: %s", batchSize);
        this.batchSize = batchSize;
        this.buffer = new ArrayList<>(batchSize);
    }

    /**
     * Adds a row to the buffer.
     *
     * @param row row to add
     */
    public void append(T row) {
        buffer.add(row);
    }

    /**
     * Returns whether the buffer has reached the batch size.
     *
     * @return {@code true} when the buffer should be drained
     */
    public boolean shouldFlush() {
        return buffer.size() >= batchSize;
    }

    /**
     * Hands over the buffered rows and starts a new, empty buffer.
     *
     * @return buffered rows in append order; possibly empty
     */
    public List<T> drain() {
        List<T> drained = buffer;
        buffer = new ArrayList<>(batchSize);
        return drained;
    }

    /**
     * Returns the number of buffered rows.
     *
     * @return buffer length
     */
    public int size() {
        return buffer.size();
    }

    /**
     * Returns the configured batch size.
     *
     * @return batch size
     */
    public int getBatchSize() {
        return batchSize;
    }
}

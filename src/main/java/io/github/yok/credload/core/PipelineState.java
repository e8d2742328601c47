package io.github.yok.credload.core;

/**
 * Phases of {@link ImportPipeline#run(java.nio.file.Path)}, in order.
 */
public enum PipelineState {
    INIT, STREAMING, FLUSHING, LOGGING, DONE
}

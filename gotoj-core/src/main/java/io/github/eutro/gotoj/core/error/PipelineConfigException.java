package io.github.eutro.gotoj.core.error;

/**
 * Thrown when a pipeline names a pass that does not exist, or puts passes in an order they forbid.
 */
public class PipelineConfigException extends GotoException {
    public PipelineConfigException(String message) {
        super(message);
    }
}

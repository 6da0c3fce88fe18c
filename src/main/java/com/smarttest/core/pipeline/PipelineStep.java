package com.smarttest.core.pipeline;

/**
 * One unit of pipeline work, e.g. invoking an agent or the browser runner.
 */
@FunctionalInterface
public interface PipelineStep<T> {

    T execute() throws Exception;
}

package com.smarttest.core.recovery;

import com.smarttest.core.model.RunState;

import java.time.Instant;

/**
 * One observed step failure.
 *
 * @param runId        run the step belongs to
 * @param step         pipeline step name
 * @param state        run state while the step was executing
 * @param error        the failure
 * @param attemptCount 1-based number of the attempt that failed
 * @param timestamp    when the failure was observed
 */
public record ErrorContext(
    String runId,
    String step,
    RunState state,
    Throwable error,
    int attemptCount,
    Instant timestamp
) {}

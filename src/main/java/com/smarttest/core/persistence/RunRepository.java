package com.smarttest.core.persistence;

import com.smarttest.core.model.RunState;
import com.smarttest.core.model.RunUpdate;
import com.smarttest.core.model.TestRun;

import java.util.List;
import java.util.Optional;

/**
 * Storage for test runs.
 * <p>
 * {@link #update} is atomic per run: a reader never observes a state change without the
 * decision-log entry that explains it.
 */
public interface RunRepository {

    Optional<TestRun> findById(String runId);

    TestRun create(TestRun run);

    /**
     * Applies {@code update} to the stored run and returns the result.
     *
     * @throws com.smarttest.core.engine.NotFoundException if no run has this id
     */
    TestRun update(String runId, RunUpdate update);

    /** Runs of a project, newest first. */
    List<TestRun> findByProjectId(String projectId);

    /** Runs currently in {@code state}, oldest first. */
    List<TestRun> findByState(RunState state);

    /** Most recently created runs, newest first. */
    List<TestRun> findRecent(int limit);
}

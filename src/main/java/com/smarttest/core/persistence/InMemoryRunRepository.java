package com.smarttest.core.persistence;

import com.smarttest.core.engine.NotFoundException;
import com.smarttest.core.model.RunState;
import com.smarttest.core.model.RunUpdate;
import com.smarttest.core.model.TestRun;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link RunRepository}. Updates are atomic through {@link ConcurrentHashMap#compute}.
 */
public class InMemoryRunRepository implements RunRepository {

    private final ConcurrentHashMap<String, TestRun> runs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRunRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<TestRun> findById(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public TestRun create(TestRun run) {
        TestRun existing = runs.putIfAbsent(run.id(), run);
        if (existing != null) {
            throw new IllegalStateException("Test run already exists: " + run.id());
        }
        return run;
    }

    @Override
    public TestRun update(String runId, RunUpdate update) {
        TestRun updated = runs.computeIfPresent(runId, (id, current) -> update.applyTo(current, clock.instant()));
        if (updated == null) {
            throw NotFoundException.run(runId);
        }
        return updated;
    }

    @Override
    public List<TestRun> findByProjectId(String projectId) {
        return runs.values().stream()
                .filter(r -> r.projectId().equals(projectId))
                .sorted(Comparator.comparing(TestRun::createdAt).reversed())
                .toList();
    }

    @Override
    public List<TestRun> findByState(RunState state) {
        return runs.values().stream()
                .filter(r -> r.state() == state)
                .sorted(Comparator.comparing(TestRun::createdAt))
                .toList();
    }

    @Override
    public List<TestRun> findRecent(int limit) {
        return runs.values().stream()
                .sorted(Comparator.comparing(TestRun::createdAt).reversed())
                .limit(limit)
                .toList();
    }
}

package com.smarttest.core.persistence;

import com.smarttest.core.model.DecisionLogEntry;
import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.RunState;
import com.smarttest.core.model.TestRun;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class RunFixtures {

    private RunFixtures() {}

    static TestRun run(String id, String projectId, Instant createdAt) {
        var seed = new DecisionLogEntry(createdAt, RunState.CREATED, RunState.CREATED, RunEvent.RUN_CREATED,
                "Test run created", Map.of());
        return new TestRun(id, projectId, RunState.CREATED, null, "docs/prd.md", List.of("/login"),
                "ws/" + id, Map.of("browser", "chromium"), Map.of("codex", "1.2"), Map.of("prdParse", "v1"),
                List.of(seed), null, null, createdAt, createdAt, null);
    }

    static DecisionLogEntry entry(Instant at, RunState from, RunState to, RunEvent event) {
        return new DecisionLogEntry(at, from, to, event, null, Map.of("attempt", 1));
    }
}

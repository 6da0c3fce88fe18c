package com.smarttest.core.pipeline;

import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.engine.OrchestratorProperties;
import com.smarttest.core.engine.RunContext;
import com.smarttest.core.events.EventBus;
import com.smarttest.core.metrics.SmartTestMetrics;
import com.smarttest.core.model.CreateRunInput;
import com.smarttest.core.model.Project;
import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.TestRun;
import com.smarttest.core.persistence.InMemoryProjectRepository;
import com.smarttest.core.persistence.InMemoryRunRepository;
import com.smarttest.core.statemachine.StateMachine;
import com.smarttest.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.util.List;

/**
 * A real orchestrator over in-memory storage, for tests of the pipeline services.
 */
class PipelineTestSupport {

    static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    final MutableClock clock = new MutableClock(T0);
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final SmartTestMetrics metrics = new SmartTestMetrics(registry);
    final EventBus eventBus = new EventBus();
    final Orchestrator orchestrator;

    PipelineTestSupport() {
        var projects = new InMemoryProjectRepository();
        projects.save(new Project("shop", "Shop"));
        orchestrator = new Orchestrator(new InMemoryRunRepository(clock), projects, new StateMachine(clock),
                eventBus, metrics, new OrchestratorProperties(), clock);
    }

    /**
     * Creates a run and applies {@code events} to it.
     */
    RunContext start(RunEvent... events) {
        TestRun run = orchestrator.createRun(CreateRunInput.of("shop", "prd.md", List.of("/login")));
        var context = new RunContext(run.id());
        for (RunEvent event : events) {
            orchestrator.transition(context, event);
        }
        return context;
    }
}

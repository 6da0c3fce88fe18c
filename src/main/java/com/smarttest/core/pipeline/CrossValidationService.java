package com.smarttest.core.pipeline;

import com.smarttest.core.crossvalidation.Arbitrator;
import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.engine.RunContext;
import com.smarttest.core.engine.TransitionException;
import com.smarttest.core.metrics.SmartTestMetrics;
import com.smarttest.core.model.ArbitrationResult;
import com.smarttest.core.model.ArbitrationSummary;
import com.smarttest.core.model.Assertion;
import com.smarttest.core.model.Defect;
import com.smarttest.core.model.GateResult;
import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.RunState;
import com.smarttest.core.model.TestRun;
import com.smarttest.core.model.TransitionOptions;
import com.smarttest.core.qualitygate.QualityGateEvaluationService;
import com.smarttest.core.report.DefectAggregator;
import com.smarttest.core.statemachine.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * The cross-validation step: arbitrates verdicts, evaluates the quality gate, aggregates defects
 * and moves the run to {@code report_ready}, or to {@code failed} when the gate blocks it.
 */
@Service
public class CrossValidationService {

    private static final Logger log = LoggerFactory.getLogger(CrossValidationService.class);

    private final Orchestrator orchestrator;
    private final Arbitrator arbitrator;
    private final QualityGateEvaluationService gateService;
    private final DefectAggregator defectAggregator;
    private final SmartTestMetrics metrics;

    public CrossValidationService(Orchestrator orchestrator,
                                  Arbitrator arbitrator,
                                  QualityGateEvaluationService gateService,
                                  DefectAggregator defectAggregator,
                                  SmartTestMetrics metrics) {
        this.orchestrator = orchestrator;
        this.arbitrator = arbitrator;
        this.gateService = gateService;
        this.defectAggregator = defectAggregator;
        this.metrics = metrics;
    }

    /**
     * @throws TransitionException if the run is not in {@code cross_validating}
     */
    public CrossValidationOutcome crossValidate(RunContext context, CrossValidationInput input) {
        TestRun run = orchestrator.getRun(context.runId());
        if (run.state() != RunState.CROSS_VALIDATING) {
            throw new TransitionException(run.id(), run.state(), RunEvent.VALIDATION_COMPLETE,
                    "Run is not cross-validating (state: " + run.state().wireName() + ")");
        }

        List<ArbitrationResult> results = arbitrator.arbitrateAssertions(input.assertions(), input.reviews());
        List<Assertion> arbitrated = arbitrator.applyArbitrationResults(input.assertions(), results);
        ArbitrationSummary summary = arbitrator.generateArbitrationSummary(results);
        metrics.recordArbitrationConflicts(summary.conflicts());
        log.info("Arbitrated {} assertions for run {}: {} passed, {} failed, {} conflicts",
                summary.total(), run.id(), summary.passed(), summary.failed(), summary.conflicts());

        GateResult gate = gateService.evaluate(input.requirements(), input.testCases(), arbitrated, input.history());
        List<Defect> defects = defectAggregator.sortDefectsBySeverity(
                defectAggregator.aggregateDefects(arbitrated, input.testCases(), input.requirements()));
        metrics.recordDefects(defects.size());

        orchestrator.updateQualityMetrics(run.id(), QualityGateEvaluationService.toQualityMetrics(gate));

        TestRun after;
        if (gate.passed()) {
            after = orchestrator.transition(context, RunEvent.VALIDATION_COMPLETE,
                    new TransitionOptions("Quality gate passed", Map.of("defects", defects.size()), null, null));
        } else {
            after = orchestrator.transition(context, RunEvent.ERROR,
                    TransitionOptions.error(ReasonCodes.QUALITY_GATE_BLOCKED, String.join("; ", gate.warnings())));
        }

        return new CrossValidationOutcome(after, results, summary, arbitrated, gate, defects,
                defectAggregator.summarize(defects, gate));
    }
}

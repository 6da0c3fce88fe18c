package com.smarttest.core.qualitygate;

import com.smarttest.core.crossvalidation.P0CoverageChecker;
import com.smarttest.core.metrics.SmartTestMetrics;
import com.smarttest.core.model.Assertion;
import com.smarttest.core.model.GateResult;
import com.smarttest.core.model.GateStatus;
import com.smarttest.core.model.P0CoverageCheck;
import com.smarttest.core.model.QualityMetric;
import com.smarttest.core.model.QualityMetrics;
import com.smarttest.core.model.Requirement;
import com.smarttest.core.model.RunHistoryEntry;
import com.smarttest.core.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Evaluates the quality gate for a cross-validated run.
 * <p>
 * The gate passes only if RC, APR and (when there is enough history) FR meet their thresholds
 * and every testable P0 requirement is covered. Metrics can never override a P0 coverage failure.
 */
@Service
public class QualityGateEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(QualityGateEvaluationService.class);

    private final MetricsCalculator calculator;
    private final P0CoverageChecker p0Checker;
    private final SmartTestMetrics metrics;

    public QualityGateEvaluationService(MetricsCalculator calculator,
                                        P0CoverageChecker p0Checker,
                                        @Autowired(required = false) SmartTestMetrics metrics) {
        this.calculator = calculator;
        this.p0Checker = p0Checker;
        this.metrics = metrics;
    }

    /**
     * @param requirements testable and non-testable requirements of the run
     * @param testCases    generated test cases
     * @param assertions   assertions carrying their final verdicts
     * @param history      case outcomes of earlier runs of the same project; may be empty
     * @return the gate result, listing a warning for each failing element
     */
    public GateResult evaluate(List<Requirement> requirements, List<TestCase> testCases,
                               List<Assertion> assertions, List<RunHistoryEntry> history) {
        QualityMetric rc = calculator.calculateRC(requirements, testCases);
        QualityMetric apr = calculator.calculateAPR(assertions);
        Optional<QualityMetric> fr = calculator.calculateFR(history);
        P0CoverageCheck p0 = p0Checker.checkP0Coverage(requirements, testCases);

        var all = new ArrayList<QualityMetric>(List.of(rc, apr));
        fr.ifPresent(all::add);

        var warnings = new ArrayList<String>();
        if (!p0.passed()) {
            warnings.add("P0 requirements not covered: " + String.join(", ", p0.missingP0Ids()));
        }
        if (!rc.passed()) {
            RcBreakdown breakdown = calculator.getRCBreakdown(requirements, testCases);
            warnings.add(String.format(Locale.ROOT, "RC (%.1f%%) below threshold (%.0f%%). Uncovered: %s",
                    rc.value() * 100, rc.threshold() * 100, String.join(", ", breakdown.uncovered())));
        }
        if (!apr.passed()) {
            warnings.add(String.format(Locale.ROOT, "APR (%.1f%%) below threshold (%.0f%%)",
                    apr.value() * 100, apr.threshold() * 100));
        }
        fr.filter(m -> !m.passed()).ifPresent(m -> warnings.add(String.format(Locale.ROOT,
                "FR (%.1f%%) above threshold (%.0f%%). Flaky: %s", m.value() * 100, m.threshold() * 100,
                String.join(", ", calculator.getFlakyTestCases(history)))));

        boolean passed = warnings.isEmpty();
        if (passed) {
            log.info("Quality gate PASSED: RC={} APR={} FR={}", rc.value(), apr.value(),
                    fr.map(QualityMetric::value).map(String::valueOf).orElse("n/a"));
        } else {
            log.info("Quality gate FAILED: {}", warnings);
        }
        if (metrics != null) {
            metrics.recordGateEvaluation(passed);
        }
        return new GateResult(passed ? GateStatus.PASSED : GateStatus.FAILED, all, p0, warnings);
    }

    /**
     * The metrics of {@code result} in the shape stored on a run.
     */
    public static QualityMetrics toQualityMetrics(GateResult result) {
        QualityMetric rc = null;
        QualityMetric apr = null;
        QualityMetric fr = null;
        for (QualityMetric metric : result.metrics()) {
            switch (metric.name()) {
                case RC -> rc = metric;
                case APR -> apr = metric;
                case FR -> fr = metric;
            }
        }
        return new QualityMetrics(rc, apr, fr);
    }
}

package com.smarttest.core.qualitygate;

import com.smarttest.core.model.Assertion;
import com.smarttest.core.model.CaseResult;
import com.smarttest.core.model.MetricName;
import com.smarttest.core.model.QualityMetric;
import com.smarttest.core.model.Requirement;
import com.smarttest.core.model.RunHistoryEntry;
import com.smarttest.core.model.TestCase;
import com.smarttest.core.model.Verdict;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the run quality metrics.
 * <p>
 * Thresholds are fixed: requirements coverage at least 85%, assertion pass rate at least 95%,
 * flaky rate at most 5%.
 */
@Component
public class MetricsCalculator {

    public static final double RC_THRESHOLD = 0.85;
    public static final double APR_THRESHOLD = 0.95;
    public static final double FR_THRESHOLD = 0.05;

    /** Runs, and outcomes per case, needed before a flaky rate is meaningful. */
    public static final int MIN_HISTORY = 3;

    public QualityMetric calculateRC(List<Requirement> requirements, List<TestCase> testCases) {
        return QualityMetric.of(MetricName.RC, getRCBreakdown(requirements, testCases).rate(), RC_THRESHOLD);
    }

    /**
     * Pass rate over deterministic assertions; soft assertions are excluded.
     */
    public QualityMetric calculateAPR(List<Assertion> assertions) {
        return QualityMetric.of(MetricName.APR, getAPRBreakdown(assertions).rate(), APR_THRESHOLD);
    }

    /**
     * Share of automated cases whose outcomes mix pass and fail across history.
     * Empty when fewer than {@link #MIN_HISTORY} runs, or no case with enough outcomes, exist.
     */
    public Optional<QualityMetric> calculateFR(List<RunHistoryEntry> history) {
        if (history.size() < MIN_HISTORY) {
            return Optional.empty();
        }
        Map<String, List<Boolean>> outcomes = outcomesByCase(history);
        int automated = 0;
        int flaky = 0;
        for (List<Boolean> results : outcomes.values()) {
            if (results.size() < MIN_HISTORY) {
                continue;
            }
            automated++;
            if (isFlaky(results)) {
                flaky++;
            }
        }
        if (automated == 0) {
            return Optional.empty();
        }
        return Optional.of(QualityMetric.of(MetricName.FR, (double) flaky / automated, FR_THRESHOLD));
    }

    public RcBreakdown getRCBreakdown(List<Requirement> requirements, List<TestCase> testCases) {
        var uncovered = new ArrayList<String>();
        int testable = 0;
        int covered = 0;
        for (Requirement requirement : requirements) {
            if (!requirement.testable()) {
                continue;
            }
            testable++;
            boolean hasCase = testCases.stream().anyMatch(tc -> requirement.isReferencedBy(tc.requirementId()));
            if (hasCase) {
                covered++;
            } else {
                uncovered.add(requirement.requirementId());
            }
        }
        double rate = testable > 0 ? (double) covered / testable : 1.0;
        return new RcBreakdown(testable, covered, uncovered, rate);
    }

    public AprBreakdown getAPRBreakdown(List<Assertion> assertions) {
        int total = 0;
        int passed = 0;
        int failed = 0;
        int errors = 0;
        for (Assertion assertion : assertions) {
            if (!assertion.type().isDeterministic()) {
                continue;
            }
            total++;
            if (assertion.finalVerdict() == Verdict.PASS) {
                passed++;
            } else if (assertion.finalVerdict() == Verdict.FAIL) {
                failed++;
            } else if (assertion.finalVerdict() == Verdict.ERROR) {
                errors++;
            }
        }
        double rate = total > 0 ? (double) passed / total : 1.0;
        return new AprBreakdown(total, passed, failed, errors, rate);
    }

    public List<String> getFlakyTestCases(List<RunHistoryEntry> history) {
        if (history.size() < MIN_HISTORY) {
            return List.of();
        }
        return outcomesByCase(history).entrySet().stream()
                .filter(e -> e.getValue().size() >= MIN_HISTORY && isFlaky(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static Map<String, List<Boolean>> outcomesByCase(List<RunHistoryEntry> history) {
        Map<String, List<Boolean>> outcomes = new LinkedHashMap<>();
        for (RunHistoryEntry run : history) {
            for (CaseResult result : run.caseResults()) {
                outcomes.computeIfAbsent(result.caseId(), k -> new ArrayList<>()).add(result.passed());
            }
        }
        return outcomes;
    }

    private static boolean isFlaky(List<Boolean> results) {
        return results.contains(Boolean.TRUE) && results.contains(Boolean.FALSE);
    }
}

package com.smarttest.core.report;

import com.smarttest.core.model.Assertion;
import com.smarttest.core.model.Defect;
import com.smarttest.core.model.DefectSeverity;
import com.smarttest.core.model.GateResult;
import com.smarttest.core.model.ReportSummary;
import com.smarttest.core.model.Requirement;
import com.smarttest.core.model.TestCase;
import com.smarttest.core.model.TestStep;
import com.smarttest.core.model.Verdict;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns failed assertions into defects for the report.
 */
@Component
public class DefectAggregator {

    static final String UNKNOWN_ROUTE = "unknown";

    /**
     * One defect per assertion whose final verdict is {@link Verdict#FAIL}, in assertion order.
     * Severity follows the priority of the requirement reached through the assertion's test case;
     * defects without a resolvable requirement are suggestions.
     */
    public List<Defect> aggregateDefects(List<Assertion> assertions, List<TestCase> testCases,
                                         List<Requirement> requirements) {
        Map<String, TestCase> casesById = testCases.stream()
                .collect(Collectors.toMap(TestCase::caseId, Function.identity(), (a, b) -> a));

        var defects = new ArrayList<Defect>();
        for (Assertion assertion : assertions) {
            if (assertion.finalVerdict() != Verdict.FAIL) {
                continue;
            }
            TestCase testCase = casesById.get(assertion.caseId());
            Optional<Requirement> requirement = Optional.ofNullable(testCase)
                    .flatMap(tc -> findRequirement(tc.requirementId(), requirements));
            defects.add(toDefect(assertion, testCase, requirement.orElse(null)));
        }
        return defects;
    }

    private static Optional<Requirement> findRequirement(String reference, List<Requirement> requirements) {
        return requirements.stream().filter(r -> r.isReferencedBy(reference)).findFirst();
    }

    private static Defect toDefect(Assertion assertion, TestCase testCase, Requirement requirement) {
        DefectSeverity severity = DefectSeverity.forPriority(requirement != null ? requirement.priority() : null);
        String label = testCase != null ? testCase.caseId() : assertion.assertionId();
        List<String> screenshots = assertion.evidencePath() != null ? List.of(assertion.evidencePath()) : List.of();
        List<String> steps = testCase != null
                ? testCase.steps().stream().map(DefectAggregator::describeStep).toList()
                : List.of();
        return new Defect(
                "DEF-" + assertion.assertionId(),
                severity,
                "[" + label + "] " + assertion.description(),
                assertion.assertionId(),
                assertion.caseId(),
                testCase != null ? testCase.requirementId() : "",
                testCase != null ? testCase.route() : "",
                screenshots,
                steps);
    }

    private static String describeStep(TestStep step) {
        String text = step.stepNumber() + ". " + step.action();
        return step.inputValue() != null ? text + " (input: " + step.inputValue() + ")" : text;
    }

    /**
     * Stable sort, most severe first.
     */
    public List<Defect> sortDefectsBySeverity(List<Defect> defects) {
        return defects.stream().sorted(Comparator.comparing(Defect::severity)).toList();
    }

    /**
     * Count per severity; every severity is present and the counts sum to {@code defects.size()}.
     */
    public Map<DefectSeverity, Integer> countDefectsBySeverity(List<Defect> defects) {
        Map<DefectSeverity, Integer> counts = new EnumMap<>(DefectSeverity.class);
        for (DefectSeverity severity : DefectSeverity.values()) {
            counts.put(severity, 0);
        }
        defects.forEach(d -> counts.merge(d.severity(), 1, Integer::sum));
        return counts;
    }

    /**
     * Defects grouped by route in first-seen order. Defects without a route go under "unknown".
     */
    public Map<String, List<Defect>> groupDefectsByRoute(List<Defect> defects) {
        Map<String, List<Defect>> groups = new LinkedHashMap<>();
        for (Defect defect : defects) {
            String route = defect.route() == null || defect.route().isEmpty() ? UNKNOWN_ROUTE : defect.route();
            groups.computeIfAbsent(route, k -> new ArrayList<>()).add(defect);
        }
        return groups;
    }

    public List<String> getAffectedRoutes(List<Defect> defects) {
        var routes = new TreeSet<String>();
        for (Defect defect : defects) {
            if (defect.route() != null && !defect.route().isEmpty()) {
                routes.add(defect.route());
            }
        }
        return List.copyOf(routes);
    }

    public ReportSummary summarize(List<Defect> defects, GateResult gate) {
        return new ReportSummary(
                defects.size(),
                countDefectsBySeverity(defects),
                getAffectedRoutes(defects),
                gate != null ? gate.metrics() : List.of());
    }
}

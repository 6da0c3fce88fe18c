package com.smarttest.core.crossvalidation;

import com.smarttest.core.model.ArbitrationResult;
import com.smarttest.core.model.ArbitrationSummary;
import com.smarttest.core.model.Assertion;
import com.smarttest.core.model.AssertionReview;
import com.smarttest.core.model.AssertionType;
import com.smarttest.core.model.ReviewVerdict;
import com.smarttest.core.model.Verdict;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges an assertion's own verdict with a second-opinion review.
 * <p>
 * Rules are biased towards failure: a disagreeing review always fails the assertion, and
 * an uncertain review fails soft assertions, whose verdicts come from an AI judge in the
 * first place. Deterministic verdicts survive uncertainty.
 */
@Component
public class Arbitrator {

    /**
     * Outcome of applying the arbitration rules to one verdict pair.
     */
    public record Ruling(Verdict finalVerdict, String reason, boolean conflictDetected) {}

    public boolean isDeterministicAssertion(AssertionType type) {
        return type.isDeterministic();
    }

    public Ruling arbitrateDeterministicAssertion(Verdict machineVerdict, ReviewVerdict reviewVerdict) {
        if (reviewVerdict == null) {
            return new Ruling(machineVerdict, "Unknown review verdict, keeping machine verdict", false);
        }
        return switch (reviewVerdict) {
            case AGREE -> new Ruling(machineVerdict, "Reviewer agrees with machine verdict", false);
            case DISAGREE -> new Ruling(Verdict.FAIL, "Reviewer disagrees with machine verdict, marking as failed", true);
            case UNCERTAIN -> new Ruling(machineVerdict, "Reviewer uncertain, keeping machine verdict", false);
        };
    }

    public Ruling arbitrateSoftAssertion(Verdict agentVerdict, ReviewVerdict reviewVerdict) {
        if (reviewVerdict == null) {
            return new Ruling(Verdict.FAIL, "Unknown review verdict on soft assertion, marking as failed", true);
        }
        return switch (reviewVerdict) {
            case AGREE -> new Ruling(agentVerdict, "Reviewer agrees with agent verdict", false);
            case DISAGREE -> new Ruling(Verdict.FAIL, "Reviewer disagrees with agent verdict, marking as failed", true);
            case UNCERTAIN -> new Ruling(Verdict.FAIL, "Reviewer uncertain on soft assertion, marking as failed", true);
        };
    }

    public ArbitrationResult arbitrateAssertion(Assertion assertion, AssertionReview review) {
        Verdict original = assertion.originalVerdict();
        ReviewVerdict reviewVerdict = review.reviewVerdict();
        Ruling ruling = isDeterministicAssertion(assertion.type())
                ? arbitrateDeterministicAssertion(original, reviewVerdict)
                : arbitrateSoftAssertion(original, reviewVerdict);
        return new ArbitrationResult(assertion.assertionId(), original, reviewVerdict,
                ruling.finalVerdict(), ruling.reason(), ruling.conflictDetected());
    }

    /**
     * Arbitrates every assertion against the review with the same assertion id. Assertions without
     * a review keep their original verdict and are recorded as {@link ReviewVerdict#UNCERTAIN}.
     */
    public List<ArbitrationResult> arbitrateAssertions(List<Assertion> assertions, List<AssertionReview> reviews) {
        Map<String, AssertionReview> byId = new HashMap<>();
        for (AssertionReview review : reviews) {
            byId.put(review.assertionId(), review);
        }

        var results = new ArrayList<ArbitrationResult>(assertions.size());
        for (Assertion assertion : assertions) {
            AssertionReview review = byId.get(assertion.assertionId());
            if (review != null) {
                results.add(arbitrateAssertion(assertion, review));
            } else {
                Verdict original = assertion.originalVerdict();
                results.add(new ArbitrationResult(assertion.assertionId(), original, ReviewVerdict.UNCERTAIN,
                        original, "No review found, keeping original verdict", false));
            }
        }
        return results;
    }

    /**
     * Copies each result's final verdict onto the assertion with the same id.
     */
    public List<Assertion> applyArbitrationResults(List<Assertion> assertions, List<ArbitrationResult> results) {
        Map<String, ArbitrationResult> byId = new HashMap<>();
        for (ArbitrationResult result : results) {
            byId.put(result.assertionId(), result);
        }
        return assertions.stream()
                .map(a -> {
                    ArbitrationResult result = byId.get(a.assertionId());
                    return result != null ? a.withFinalVerdict(result.finalVerdict()) : a;
                })
                .toList();
    }

    public int countConflicts(List<ArbitrationResult> results) {
        return (int) results.stream().filter(ArbitrationResult::conflictDetected).count();
    }

    public ArbitrationSummary generateArbitrationSummary(List<ArbitrationResult> results) {
        int total = results.size();
        int passed = 0;
        int failed = 0;
        int errors = 0;
        for (ArbitrationResult result : results) {
            switch (result.finalVerdict()) {
                case PASS -> passed++;
                case FAIL -> failed++;
                case ERROR -> errors++;
            }
        }
        int conflicts = countConflicts(results);
        double agreementRate = total > 0 ? (double) (total - conflicts) / total : 1.0;
        return new ArbitrationSummary(total, passed, failed, errors, conflicts, agreementRate);
    }
}

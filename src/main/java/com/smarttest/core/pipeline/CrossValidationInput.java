package com.smarttest.core.pipeline;

import com.smarttest.core.model.Assertion;
import com.smarttest.core.model.AssertionReview;
import com.smarttest.core.model.Requirement;
import com.smarttest.core.model.RunHistoryEntry;
import com.smarttest.core.model.TestCase;

import java.util.List;

/**
 * Everything cross-validation needs from the earlier pipeline steps.
 *
 * @param requirements parsed requirements
 * @param testCases    generated and executed test cases
 * @param assertions   executed assertions carrying machine or agent verdicts
 * @param reviews      second-opinion reviews, keyed by assertion id
 * @param history      case outcomes of earlier runs of the project
 */
public record CrossValidationInput(
    List<Requirement> requirements,
    List<TestCase> testCases,
    List<Assertion> assertions,
    List<AssertionReview> reviews,
    List<RunHistoryEntry> history
) {

    public CrossValidationInput {
        requirements = List.copyOf(requirements);
        testCases = List.copyOf(testCases);
        assertions = List.copyOf(assertions);
        reviews = List.copyOf(reviews);
        history = history == null ? List.of() : List.copyOf(history);
    }
}

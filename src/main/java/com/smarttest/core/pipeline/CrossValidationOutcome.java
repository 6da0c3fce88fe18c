package com.smarttest.core.pipeline;

import com.smarttest.core.model.ArbitrationResult;
import com.smarttest.core.model.ArbitrationSummary;
import com.smarttest.core.model.Assertion;
import com.smarttest.core.model.Defect;
import com.smarttest.core.model.GateResult;
import com.smarttest.core.model.ReportSummary;
import com.smarttest.core.model.TestRun;

import java.util.List;

/**
 * @param run          the run after cross-validation, in {@code report_ready} or {@code failed}
 * @param arbitration  one result per assertion
 * @param summary      arbitration totals
 * @param assertions   the assertions with final verdicts applied
 * @param gate         quality gate result
 * @param defects      defects sorted most severe first
 * @param report       data for the report renderer
 */
public record CrossValidationOutcome(
    TestRun run,
    List<ArbitrationResult> arbitration,
    ArbitrationSummary summary,
    List<Assertion> assertions,
    GateResult gate,
    List<Defect> defects,
    ReportSummary report
) {}

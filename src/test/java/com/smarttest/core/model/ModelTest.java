package com.smarttest.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("Assertion")
    class AssertionTests {

        @Test
        @DisplayName("deterministic assertions cannot carry an agent verdict")
        void deterministicRejectsAgentVerdict() {
            assertThrows(IllegalArgumentException.class, () -> new Assertion("A1", "TC-1",
                    AssertionType.NAVIGATION, "d", null, null, Verdict.PASS, Verdict.PASS, null, null, null));
        }

        @Test
        @DisplayName("soft assertions cannot carry a machine verdict")
        void softRejectsMachineVerdict() {
            assertThrows(IllegalArgumentException.class, () -> new Assertion("A1", "TC-1",
                    AssertionType.SOFT, "d", null, null, Verdict.PASS, Verdict.PASS, null, null, null));
        }

        @Test
        @DisplayName("original verdict falls back to error when missing")
        void originalVerdict() {
            var soft = Assertion.soft("A1", "TC-1", "layout looks right", null, null);
            assertEquals(Verdict.ERROR, soft.originalVerdict());
            var det = Assertion.deterministic("A2", "TC-1", AssertionType.ELEMENT_COUNT, "3 rows", Verdict.FAIL);
            assertEquals(Verdict.FAIL, det.originalVerdict());
        }
    }

    @Test
    @DisplayName("quality metric direction depends on the metric")
    void qualityMetricPassed() {
        assertTrue(QualityMetric.of(MetricName.RC, 0.85, 0.85).passed());
        assertFalse(QualityMetric.of(MetricName.APR, 0.94, 0.95).passed());
        assertTrue(QualityMetric.of(MetricName.FR, 0.05, 0.05).passed());
        assertFalse(QualityMetric.of(MetricName.FR, 0.06, 0.05).passed());
    }

    @Test
    @DisplayName("run update appends the entry and keeps unspecified fields")
    void runUpdate() {
        Instant t0 = Instant.parse("2026-03-01T09:00:00Z");
        var seed = new DecisionLogEntry(t0, RunState.CREATED, RunState.CREATED, RunEvent.RUN_CREATED, null, null);
        var run = new TestRun("r1", "p1", RunState.CREATED, null, "prd.md", List.of("/a"), "ws/r1",
                null, null, null, List.of(seed), null, "old.html", t0, t0, null);
        var entry = new DecisionLogEntry(t0.plusSeconds(5), RunState.CREATED, RunState.PARSING,
                RunEvent.START_PARSING, null, null);

        TestRun updated = RunUpdate.transition(RunState.PARSING, null, null, entry).applyTo(run, t0.plusSeconds(6));

        assertEquals(RunState.PARSING, updated.state());
        assertEquals(List.of(seed, entry), updated.decisionLog());
        assertEquals("old.html", updated.reportPath());
        assertEquals(t0.plusSeconds(6), updated.updatedAt());
        assertEquals(t0, updated.createdAt());
    }

    @Test
    @DisplayName("enums serialize with wire names")
    void wireNames() throws Exception {
        var mapper = new ObjectMapper();
        assertEquals("\"awaiting_approval\"", mapper.writeValueAsString(RunState.AWAITING_APPROVAL));
        assertEquals("\"quality_gate_blocked\"", mapper.writeValueAsString(ReasonCode.QUALITY_GATE_BLOCKED));
        assertEquals(RunState.REPORT_READY, mapper.readValue("\"report_ready\"", RunState.class));
        assertEquals(Verdict.FAIL, Verdict.fromWireName("fail"));
        assertThrows(IllegalArgumentException.class, () -> RunState.fromWireName("paused"));
    }

    @Test
    @DisplayName("severity follows requirement priority")
    void severity() {
        assertEquals(DefectSeverity.CRITICAL, DefectSeverity.forPriority(RequirementPriority.P0));
        assertEquals(DefectSeverity.MAJOR, DefectSeverity.forPriority(RequirementPriority.P1));
        assertEquals(DefectSeverity.MINOR, DefectSeverity.forPriority(RequirementPriority.P2));
        assertEquals(DefectSeverity.SUGGESTION, DefectSeverity.forPriority(null));
    }

    @Test
    @DisplayName("requirements are referenced by database or external id")
    void requirementReference() {
        var req = Fixtures.requirement("REQ-1", RequirementPriority.P0);
        assertTrue(req.isReferencedBy("REQ-1"));
        assertTrue(req.isReferencedBy("db-REQ-1"));
        assertFalse(req.isReferencedBy(null));
        assertEquals(Map.of(), new DecisionLogEntry(null, null, null, null, null, null).metadata());
    }
}

package com.smarttest.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId and projectId in MDC")
    void setRun() {
        MdcContext.setRun("run-1", "shop");
        assertEquals("run-1", MDC.get("runId"));
        assertEquals("shop", MDC.get("projectId"));
        assertTrue(MdcContext.hasRun());
    }

    @Test
    @DisplayName("setRun without a project leaves projectId unset")
    void setRunWithoutProject() {
        MdcContext.setRun("run-1", null);
        assertNull(MDC.get("projectId"));
    }

    @Test
    @DisplayName("clearStep keeps the run")
    void clearStep() {
        MdcContext.setStep("run-1", "execute");
        assertEquals("execute", MDC.get("step"));

        MdcContext.clearStep();
        assertNull(MDC.get("step"));
        assertEquals("run-1", MDC.get("runId"));
    }

    @Test
    @DisplayName("clear removes all run MDC keys")
    void clear() {
        MdcContext.setRun("run-1", "shop");
        MdcContext.setStep("run-1", "parse");
        MdcContext.clear();
        assertFalse(MdcContext.hasRun());
        assertNull(MDC.get("projectId"));
        assertNull(MDC.get("step"));
    }
}

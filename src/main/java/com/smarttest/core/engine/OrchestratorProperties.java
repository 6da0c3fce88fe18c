package com.smarttest.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Run orchestration settings, bound from {@code smarttest.orchestrator.*}.
 */
@Component
@ConfigurationProperties(prefix = "smarttest.orchestrator")
public class OrchestratorProperties {

    /** Directory under which each run gets its own workspace. */
    private String workspaceRoot = ".ai-test-workspace";

    public String getWorkspaceRoot() { return workspaceRoot; }
    public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
}

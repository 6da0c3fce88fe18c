package com.smarttest.core.model;

import java.util.List;
import java.util.Map;

/**
 * Request to start a new test run. Version and fingerprint maps are optional.
 */
public record CreateRunInput(
    String projectId,
    String prdPath,
    List<String> routes,
    Map<String, String> envFingerprint,
    Map<String, String> agentVersions,
    Map<String, String> promptVersions
) {

    public static CreateRunInput of(String projectId, String prdPath, List<String> routes) {
        return new CreateRunInput(projectId, prdPath, routes, null, null, null);
    }
}

package com.smarttest.core.engine;

/**
 * Thrown when a run or project id does not resolve. {@link #getResource()} tells which.
 */
public class NotFoundException extends RuntimeException {

    public enum Resource { RUN, PROJECT }

    private final Resource resource;
    private final String id;

    public NotFoundException(Resource resource, String id) {
        super((resource == Resource.RUN ? "Test run" : "Project") + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public static NotFoundException run(String runId) {
        return new NotFoundException(Resource.RUN, runId);
    }

    public static NotFoundException project(String projectId) {
        return new NotFoundException(Resource.PROJECT, projectId);
    }

    public Resource getResource() { return resource; }
    public String getId() { return id; }
}

package com.smarttest.core.persistence;

import com.smarttest.core.model.Project;

import java.util.List;
import java.util.Optional;

public interface ProjectRepository {

    Optional<Project> findById(String projectId);

    Project save(Project project);

    List<Project> findAll();
}

package com.ryuqq.testops.testkit.store;

import com.ryuqq.testops.core.model.Project;
import com.ryuqq.testops.core.spi.ProjectRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of ProjectRegistry for testing purposes.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class InMemoryProjectRegistry implements ProjectRegistry {

    private final Map<String, Project> projects = new LinkedHashMap<>();

    @Override
    public synchronized void save(Project project) {
        if (project == null) {
            throw new IllegalArgumentException("project cannot be null");
        }
        projects.put(project.id(), project);
    }

    @Override
    public synchronized Optional<Project> findById(String projectId) {
        return Optional.ofNullable(projectId == null ? null : projects.get(projectId));
    }

    @Override
    public synchronized List<Project> findAll() {
        return new ArrayList<>(projects.values());
    }

    @Override
    public synchronized boolean deleteById(String projectId) {
        return projectId != null && projects.remove(projectId) != null;
    }

    public synchronized void clear() {
        projects.clear();
    }
}

package com.ryuqq.testops.core.spi;

import com.ryuqq.testops.core.model.Project;

import java.util.List;
import java.util.Optional;

/**
 * Project metadata index SPI.
 *
 * <p>Keeps the list of known projects. The per-project document itself lives in
 * {@link DocumentStore}; this index only answers "which projects exist and who owns them".</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>{@link #save} is an upsert keyed by project id</li>
 *   <li>Storage failures are raised as {@link StorageException}</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public interface ProjectRegistry {

    /**
     * Inserts or replaces a project.
     *
     * @param project project to save
     * @throws IllegalArgumentException if project is null
     */
    void save(Project project);

    Optional<Project> findById(String projectId);

    /**
     * All projects, in insertion order.
     */
    List<Project> findAll();

    /**
     * Removes a project from the index.
     *
     * @param projectId project id
     * @return true if a project was removed
     */
    boolean deleteById(String projectId);
}

package com.ryuqq.testops.adapter.filesystem;

import com.ryuqq.testops.core.codec.DocumentCodec;
import com.ryuqq.testops.core.model.Project;
import com.ryuqq.testops.core.spi.ProjectRegistry;
import com.ryuqq.testops.core.spi.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code projects.json} 파일 기반 프로젝트 인덱스.
 *
 * <p>생성 시 파일을 한 번 읽어 메모리에 두고, 변경마다 전체 인덱스를 원자적으로 다시 씁니다.
 * 쓰기가 실패하면 메모리 상태도 변경 전으로 되돌립니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class FileProjectRegistry implements ProjectRegistry {

    private static final Logger log = LoggerFactory.getLogger(FileProjectRegistry.class);

    private final Path indexPath;
    private final DocumentCodec codec;
    private final AtomicFileWriter writer;
    private final Map<String, Project> projects = new LinkedHashMap<>();

    public FileProjectRegistry(FileStoreConfig config) {
        this(config, new AtomicFileWriter());
    }

    FileProjectRegistry(FileStoreConfig config, AtomicFileWriter writer) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.indexPath = config.projectsIndex();
        this.codec = new DocumentCodec(config.prettyPrint());
        this.writer = writer;
        loadIndex();
    }

    @Override
    public synchronized void save(Project project) {
        if (project == null) {
            throw new IllegalArgumentException("project cannot be null");
        }
        Project previous = projects.put(project.id(), project);
        try {
            flush();
        } catch (StorageException e) {
            if (previous != null) {
                projects.put(project.id(), previous);
            } else {
                projects.remove(project.id());
            }
            throw e;
        }
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
        if (projectId == null || !projects.containsKey(projectId)) {
            return false;
        }
        Map<String, Project> snapshot = new LinkedHashMap<>(projects);
        projects.remove(projectId);
        try {
            flush();
        } catch (StorageException e) {
            projects.clear();
            projects.putAll(snapshot);
            throw e;
        }
        return true;
    }

    private void loadIndex() {
        if (!Files.exists(indexPath)) {
            return;
        }
        try {
            for (Project project : codec.decodeProjects(Files.readAllBytes(indexPath))) {
                projects.put(project.id(), project);
            }
            log.info("Project index loaded: path={}, projects={}", indexPath, projects.size());
        } catch (IOException e) {
            log.error("Corrupt project index, starting empty: path={}", indexPath, e);
        }
    }

    private void flush() {
        try {
            writer.write(indexPath, codec.encodeProjects(new ArrayList<>(projects.values())));
        } catch (IOException e) {
            throw new StorageException(FileStoreConfig.PROJECTS_INDEX, "Failed to write project index", e);
        }
    }
}

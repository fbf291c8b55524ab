package com.ryuqq.testops.application.project;

import com.ryuqq.testops.core.concurrent.Futures;
import com.ryuqq.testops.core.model.Ids;
import com.ryuqq.testops.core.model.Project;
import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.spi.DocumentStore;
import com.ryuqq.testops.core.spi.ProjectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 프로젝트 메타데이터 관리.
 *
 * <p>프로젝트 인덱스({@link ProjectRegistry})와 프로젝트 문서({@link DocumentStore})의 생성/삭제를 함께 처리합니다.</p>
 *
 * <p><strong>소유자 범위:</strong></p>
 * <ul>
 *   <li>get: 소유자가 아니면 "없음"과 동일하게 empty 반환</li>
 *   <li>update / delete: 소유자가 아니면 {@link IllegalStateException}</li>
 * </ul>
 *
 * <p><strong>create 멱등성:</strong> 명시적 ID로 생성할 때 같은 소유자의 프로젝트가 이미 있으면
 * 기존 프로젝트를 반환합니다. 다른 소유자의 프로젝트와 ID가 충돌하면 {@link IllegalStateException}.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRegistry registry;
    private final DocumentStore store;
    private final Object indexLock = new Object();

    public ProjectService(ProjectRegistry registry, DocumentStore store) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.registry = registry;
        this.store = store;
    }

    public Project create(String name, String description, String ownerId) {
        return create(name, description, ownerId, null);
    }

    /**
     * 프로젝트 생성.
     *
     * @param name 이름
     * @param description 설명
     * @param ownerId 소유자 ID
     * @param explicitId 명시적 ID (null이면 생성)
     * @return 생성되었거나 이미 존재하던 프로젝트
     * @throws IllegalArgumentException ownerId가 null/blank이거나 저장소가 ID를 거부하는 경우
     * @throws IllegalStateException 다른 소유자의 프로젝트와 ID가 충돌하는 경우
     */
    public Project create(String name, String description, String ownerId, String explicitId) {
        requireText(ownerId, "ownerId");
        String id = explicitId == null || explicitId.isBlank() ? Ids.shortId() : explicitId;

        synchronized (indexLock) {
            Optional<Project> existing = registry.findById(id);
            if (existing.isPresent()) {
                if (!existing.get().isOwnedBy(ownerId)) {
                    throw new IllegalStateException("ID collision with another user's project: " + id);
                }
                return existing.get();
            }

            Instant now = Instant.now();
            Project project = new Project(id, name, description, ownerId, now, now);
            // 인덱스의 모든 프로젝트는 문서를 가짐
            Futures.await(store.write(id, ProjectDocument.empty()));
            try {
                registry.save(project);
            } catch (RuntimeException e) {
                log.error("Project index update failed, removing document: id={}", id, e);
                try {
                    Futures.await(store.delete(id));
                } catch (RuntimeException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
            log.info("Project created: id={}, owner={}", id, ownerId);
            return project;
        }
    }

    public Optional<Project> get(String projectId, String userId) {
        Optional<Project> project = registry.findById(projectId);
        if (project.isPresent() && !project.get().isOwnedBy(userId)) {
            log.warn("Unauthorized project access: user={} project={} owner={}",
                userId, projectId, project.get().ownerId());
            return Optional.empty();
        }
        return project;
    }

    /**
     * 소유자의 프로젝트 목록 (최근 수정순).
     */
    public List<Project> listByOwner(String userId) {
        return registry.findAll().stream()
            .filter(project -> project.isOwnedBy(userId))
            .sorted(Comparator.comparing(Project::updatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .toList();
    }

    /**
     * 전체 프로젝트 목록 (시스템 작업용, 소유자 무관).
     */
    public List<Project> listAll() {
        return registry.findAll();
    }

    /**
     * 이름/설명 변경. null 인자는 기존 값 유지.
     *
     * @throws IllegalStateException 프로젝트가 없거나 소유자가 아닌 경우
     */
    public Project update(String projectId, String userId, String name, String description) {
        synchronized (indexLock) {
            Project project = registry.findById(projectId)
                .orElseThrow(() -> new IllegalStateException("Project not found: " + projectId));
            if (!project.isOwnedBy(userId)) {
                throw new IllegalStateException("Unauthorized: user " + userId + " does not own project " + projectId);
            }
            Project updated = project.withDetails(name, description, Instant.now());
            registry.save(updated);
            return updated;
        }
    }

    /**
     * 프로젝트와 그 문서를 삭제. 없는 프로젝트는 무시합니다.
     *
     * @throws IllegalStateException 소유자가 아닌 경우
     */
    public void delete(String projectId, String userId) {
        synchronized (indexLock) {
            Optional<Project> project = registry.findById(projectId);
            if (project.isEmpty()) {
                return;
            }
            if (!project.get().isOwnedBy(userId)) {
                throw new IllegalStateException("Unauthorized: user " + userId + " does not own project " + projectId);
            }
            registry.deleteById(projectId);
            Futures.await(store.delete(projectId));
            log.info("Project deleted: id={}", projectId);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}

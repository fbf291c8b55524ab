package com.ryuqq.testops.application.schedule;

import com.ryuqq.testops.application.batch.BatchConfig;
import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.spi.DocumentStore;

import java.util.concurrent.CompletableFuture;

/**
 * 스케줄 대상 ID를 실행 가능한 대상으로 해석합니다.
 *
 * <p><strong>해석 순서 (같은 프로젝트 문서 안에서):</strong></p>
 * <ol>
 *   <li>Suite ID → {@link TargetResolution.SuiteTarget}</li>
 *   <li>파일 노드 ID (폴더 제외) → {@link TargetResolution.SingleFileTarget}</li>
 *   <li>레거시 스크립트 ID → {@link TargetResolution.SingleFileTarget}</li>
 *   <li>그 외 → {@link TargetResolution.NotFound}</li>
 * </ol>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class TargetResolver {

    private final DocumentStore store;

    public TargetResolver(DocumentStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * 대상 해석.
     *
     * @param projectId 프로젝트 ID
     * @param targetId 대상 ID
     * @return 해석 결과
     */
    public CompletableFuture<TargetResolution> resolve(String projectId, String targetId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId cannot be null or blank");
        }
        if (targetId == null || targetId.isBlank()) {
            return CompletableFuture.completedFuture(
                new TargetResolution.NotFound(targetId, "Schedule has no target"));
        }
        return store.read(projectId).thenApply(document -> resolveIn(document, targetId));
    }

    private TargetResolution resolveIn(ProjectDocument document, String targetId) {
        var suite = document.findSuite(targetId);
        if (suite.isPresent()) {
            return new TargetResolution.SuiteTarget(
                targetId, suite.get().getFileIds(), BatchConfig.fromJson(suite.get().getConfig()));
        }
        boolean isFile = document.findFile(targetId).filter(node -> !node.isFolder()).isPresent();
        if (isFile || document.findScript(targetId).isPresent()) {
            return new TargetResolution.SingleFileTarget(targetId);
        }
        return new TargetResolution.NotFound(targetId, "Target not found in project");
    }
}

package com.ryuqq.testops.adapter.runner;

import java.nio.file.Path;

/**
 * BatchRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scratchRoot: Run별 물질화 디렉터리의 상위 경로 (기본: ./temp_batch_runs)</li>
 *   <li>concurrency: 파일 실행 워커 수 (기본: 8)</li>
 *   <li>cleanupScratch: Run 종료 후 물질화 디렉터리 삭제 여부 (기본: true)</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 * @param scratchRoot 물질화 루트
 * @param concurrency 워커 수
 * @param cleanupScratch 종료 후 삭제 여부
 */
public record BatchRunnerConfig(
    Path scratchRoot,
    int concurrency,
    boolean cleanupScratch
) {

    /**
     * 기본 설정 생성자.
     */
    public BatchRunnerConfig() {
        this(Path.of("temp_batch_runs"), 8, true);
    }

    /**
     * Compact constructor (검증 로직).
     *
     * @throws IllegalArgumentException scratchRoot가 null이거나 concurrency가 양수가 아닌 경우
     */
    public BatchRunnerConfig {
        if (scratchRoot == null) {
            throw new IllegalArgumentException("scratchRoot cannot be null");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
    }

    public BatchRunnerConfig withScratchRoot(Path scratchRoot) {
        return new BatchRunnerConfig(scratchRoot, concurrency, cleanupScratch);
    }

    public BatchRunnerConfig withConcurrency(int concurrency) {
        return new BatchRunnerConfig(scratchRoot, concurrency, cleanupScratch);
    }

    public BatchRunnerConfig withCleanupScratch(boolean cleanupScratch) {
        return new BatchRunnerConfig(scratchRoot, concurrency, cleanupScratch);
    }
}

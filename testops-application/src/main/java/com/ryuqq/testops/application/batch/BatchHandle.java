package com.ryuqq.testops.application.batch;

import com.ryuqq.testops.core.statemachine.RunStatus;

import java.util.concurrent.CompletableFuture;

/**
 * 배치 실행 핸들.
 *
 * <p>executeBatch는 실행이 끝나기 전에 반환됩니다. 호출자는 {@link #getRunId()}로 Run을 조회하거나
 * {@link #getCompletion()}으로 종료 상태를 기다릴 수 있습니다. 진실의 원천은 영속화된 Run입니다.</p>
 *
 * <p><strong>두 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li><strong>STARTED:</strong> 백그라운드 실행 중. completion은 Run이 종료 상태로 기록된 뒤 완료</li>
 *   <li><strong>FAILED:</strong> 동기 실패. Run은 이미 FAILED로 기록됨, message에 사유</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public final class BatchHandle {

    private final String runId;
    private final BatchStatus status;
    private final String message;
    private final CompletableFuture<RunStatus> completion;

    private BatchHandle(String runId, BatchStatus status, String message, CompletableFuture<RunStatus> completion) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be null or blank");
        }
        this.runId = runId;
        this.status = status;
        this.message = message;
        this.completion = completion;
    }

    /**
     * 실행 시작 핸들 생성.
     *
     * @param runId Run ID
     * @param completion Run 종료 상태 future
     * @return STARTED 핸들
     * @throws IllegalArgumentException completion이 null인 경우
     */
    public static BatchHandle started(String runId, CompletableFuture<RunStatus> completion) {
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null for started handle");
        }
        return new BatchHandle(runId, BatchStatus.STARTED, "Batch execution started.", completion);
    }

    /**
     * 동기 실패 핸들 생성.
     *
     * @param runId Run ID (FAILED로 기록된 Run)
     * @param message 실패 사유
     * @return FAILED 핸들
     */
    public static BatchHandle failed(String runId, String message) {
        return new BatchHandle(runId, BatchStatus.FAILED, message, CompletableFuture.completedFuture(RunStatus.FAILED));
    }

    public String getRunId() {
        return runId;
    }

    public BatchStatus getStatus() {
        return status;
    }

    public boolean isStarted() {
        return status == BatchStatus.STARTED;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Run이 종료 상태로 기록되면 완료되는 future.
     *
     * <p>반환되는 future는 복사본이므로 호출자가 완료시켜도 핸들에 영향이 없습니다.</p>
     */
    public CompletableFuture<RunStatus> getCompletion() {
        return completion.copy();
    }

    @Override
    public String toString() {
        return "BatchHandle{runId=" + runId + ", status=" + status + ", message=" + message + "}";
    }
}

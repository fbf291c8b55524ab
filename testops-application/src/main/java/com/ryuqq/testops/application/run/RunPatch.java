package com.ryuqq.testops.application.run;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.testops.core.model.Run;
import com.ryuqq.testops.core.model.TestResult;
import com.ryuqq.testops.core.statemachine.RunStatus;

import java.time.Instant;
import java.util.List;

/**
 * Run 부분 업데이트.
 *
 * <p>null이 아닌 필드만 저장된 Run에 병합됩니다. {@code meta}는 키 단위로 병합되므로
 * 서로 다른 키를 갱신하는 두 업데이트는 모두 보존됩니다.</p>
 *
 * <pre>
 * RunPatch.status(RunStatus.COMPLETED).withResults(results);
 * RunPatch.empty().withMeta(meta);
 * </pre>
 *
 * @param status 새 상태
 * @param endTime 종료 시각 (종료 상태인데 null이면 RunTracker가 현재 시각으로 채움)
 * @param results 결과 목록 (전체 교체)
 * @param meta 병합할 메타데이터
 * @param triggeredBy 실행 요청자
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public record RunPatch(
    RunStatus status,
    Instant endTime,
    List<TestResult> results,
    ObjectNode meta,
    String triggeredBy
) {

    public RunPatch {
        results = results == null ? null : List.copyOf(results);
        meta = meta == null ? null : meta.deepCopy();
    }

    public static RunPatch empty() {
        return new RunPatch(null, null, null, null, null);
    }

    public static RunPatch status(RunStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return new RunPatch(status, null, null, null, null);
    }

    public RunPatch withEndTime(Instant endTime) {
        return new RunPatch(status, endTime, results, meta, triggeredBy);
    }

    public RunPatch withResults(List<TestResult> results) {
        return new RunPatch(status, endTime, results, meta, triggeredBy);
    }

    public RunPatch withMeta(ObjectNode meta) {
        return new RunPatch(status, endTime, results, meta, triggeredBy);
    }

    public RunPatch withTriggeredBy(String triggeredBy) {
        return new RunPatch(status, endTime, results, meta, triggeredBy);
    }

    /**
     * 저장된 Run에 null이 아닌 필드를 병합.
     *
     * @param run 대상 Run (프로젝트 문서 안의 인스턴스)
     */
    void applyTo(Run run) {
        if (status != null) {
            run.setStatus(status);
        }
        if (endTime != null) {
            run.setEndTime(endTime);
        }
        if (results != null) {
            run.setResults(results);
        }
        if (meta != null) {
            if (run.getMeta() == null) {
                run.setMeta(meta.deepCopy());
            } else {
                run.getMeta().setAll(meta.deepCopy());
            }
        }
        if (triggeredBy != null) {
            run.setTriggeredBy(triggeredBy);
        }
    }
}

package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 파일 하나의 실행 결과.
 *
 * @param file 파일 식별자 (파일명)
 * @param status 결과 상태
 * @param durationMs 소요 시간 (밀리초, null 허용)
 * @param error 오류 메시지 (null 허용)
 * @param logs 캡처된 출력 라인 (null 허용)
 *
 * @author TestOps Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestResult(
    String file,
    ResultStatus status,
    Long durationMs,
    String error,
    List<String> logs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException file 또는 status가 null인 경우
     */
    public TestResult {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        logs = logs == null ? null : List.copyOf(logs);
    }

    /**
     * 종료 코드 기반 결과 생성. 종료 코드가 0일 때만 PASSED.
     */
    public static TestResult fromExitCode(String file, int exitCode, long durationMs, List<String> logs) {
        ResultStatus status = exitCode == 0 ? ResultStatus.PASSED : ResultStatus.FAILED;
        return new TestResult(file, status, durationMs, null, logs);
    }

    /**
     * 예외로 인한 실패 결과 생성.
     */
    public static TestResult failure(String file, long durationMs, String error) {
        return new TestResult(file, ResultStatus.FAILED, durationMs, error, null);
    }

    @JsonIgnore
    public boolean isPassed() {
        return status == ResultStatus.PASSED;
    }
}

package com.ryuqq.testops.core.executor;

import java.util.List;

/**
 * 실행 결과.
 *
 * @param exitCode 프로세스 종료 코드 (기한 초과 시 -1)
 * @param output 캡처된 출력 라인
 * @param timedOut 기한 초과 여부
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public record ExecutionResult(
    int exitCode,
    List<String> output,
    boolean timedOut
) {

    public static final int TIMEOUT_EXIT_CODE = -1;

    public ExecutionResult {
        output = output == null ? List.of() : List.copyOf(output);
    }

    public static ExecutionResult of(int exitCode, List<String> output) {
        return new ExecutionResult(exitCode, output, false);
    }

    public static ExecutionResult timeout(List<String> output) {
        return new ExecutionResult(TIMEOUT_EXIT_CODE, output, true);
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }
}

package com.ryuqq.testops.core.statemachine;

/**
 * Run 상태 전이 검증기.
 *
 * <p>허용된 전이는 RUNNING → RUNNING(필드 갱신), RUNNING → COMPLETED,
 * RUNNING → FAILED 뿐입니다. 종료 상태에서 출발하는 전이는 모두 거부됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
    }

    /**
     * 전이 가능 여부 확인.
     *
     * @param from 현재 상태
     * @param to 목표 상태
     * @return 허용되는 전이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(RunStatus from, RunStatus to) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        return !from.isTerminal();
    }

    /**
     * 전이를 검증하고, 허용되지 않으면 예외를 던집니다.
     *
     * @param runId 대상 Run ID (오류 메시지용)
     * @param from 현재 상태
     * @param to 목표 상태
     * @throws IllegalStateException 종료 상태에서 출발하는 전이인 경우
     */
    public static void validate(String runId, RunStatus from, RunStatus to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Cannot transition run %s from terminal state %s to %s", runId, from, to));
        }
    }
}

package com.ryuqq.testops.core.statemachine;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Test Run의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>RUNNING → COMPLETED (모든 버킷 실행 종료)</li>
 *   <li>RUNNING → FAILED (동기 검증 실패 또는 오케스트레이션 예외)</li>
 *   <li><strong>종료 상태에서는 어떤 전이도 불가 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * RUNNING
 *    │
 *    ├─► COMPLETED
 *    │
 *    └─► FAILED
 * </pre>
 *
 * <p>JSON에는 소문자 값(running, completed, failed)으로 저장됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public enum RunStatus {

    /**
     * 실행 중. Run 생성 시점의 상태.
     */
    @JsonProperty("running")
    RUNNING,

    /**
     * 실행 완료. 개별 파일 결과의 성공 여부와 무관하게 배치가 끝까지 수행됨.
     */
    @JsonProperty("completed")
    COMPLETED,

    /**
     * 실패. 실행 전 검증 실패 또는 오케스트레이션 수준 예외.
     */
    @JsonProperty("failed")
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태의 Run은 더 이상 변경되지 않습니다.</p>
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

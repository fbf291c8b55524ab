package com.ryuqq.testops.application.batch;

/**
 * executeBatch 호출 직후의 상태.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public enum BatchStatus {

    /**
     * 검증을 통과하고 백그라운드 실행이 시작됨.
     */
    STARTED,

    /**
     * 실행기 호출 전에 실패함 (파일 없음, 유효한 파일 없음, 물질화 실패).
     */
    FAILED
}

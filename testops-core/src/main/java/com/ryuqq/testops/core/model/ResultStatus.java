package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 파일 단위 실행 결과 상태.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public enum ResultStatus {

    @JsonProperty("passed")
    PASSED,

    @JsonProperty("failed")
    FAILED,

    @JsonProperty("skipped")
    SKIPPED
}

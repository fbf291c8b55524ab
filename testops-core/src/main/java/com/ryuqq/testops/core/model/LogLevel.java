package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run 로그 심각도.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public enum LogLevel {

    @JsonProperty("debug")
    DEBUG,

    @JsonProperty("info")
    @JsonEnumDefaultValue
    INFO,

    @JsonProperty("warn")
    WARN,

    @JsonProperty("error")
    ERROR
}

package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Run을 발생시킨 주체.
 *
 * <p>알 수 없는 값(구버전 문서의 "orchestrator" 등)은 {@link #MANUAL}로 해석됩니다.
 * {@link Run}은 원래 문자열을 그대로 보존하므로 다시 저장해도 값이 바뀌지 않습니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public enum RunSource {

    @JsonProperty("manual")
    @JsonEnumDefaultValue
    MANUAL("manual"),

    @JsonProperty("scheduler")
    SCHEDULER("scheduler"),

    @JsonProperty("batch")
    BATCH("batch"),

    @JsonProperty("recorder")
    RECORDER("recorder");

    private final String value;

    RunSource(String value) {
        this.value = value;
    }

    /**
     * 저장 형식의 문자열 값.
     */
    public String value() {
        return value;
    }

    /**
     * 저장된 문자열 해석. null은 null, 알 수 없는 값은 {@link #MANUAL}.
     */
    public static RunSource fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        for (RunSource source : values()) {
            if (source.value.equals(normalized)) {
                return source;
            }
        }
        return MANUAL;
    }
}

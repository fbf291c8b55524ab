package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 가상 파일 트리 노드 종류.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public enum FileNodeType {

    @JsonProperty("file")
    @JsonEnumDefaultValue
    FILE,

    @JsonProperty("folder")
    FOLDER
}

package com.ryuqq.testops.application.suite;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Suite 부분 업데이트. null 필드는 기존 값을 유지합니다.
 *
 * @param name 새 이름 (blank 불가)
 * @param description 새 설명
 * @param fileIds 새 파일 ID 목록 (전체 교체)
 * @param config 새 기본 실행 설정 (전체 교체)
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public record SuiteUpdate(
    String name,
    String description,
    List<String> fileIds,
    ObjectNode config
) {

    public SuiteUpdate {
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        fileIds = fileIds == null ? null : List.copyOf(fileIds);
        config = config == null ? null : config.deepCopy();
    }
}

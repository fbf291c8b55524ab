package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 프로젝트 메타데이터.
 *
 * <p>프로젝트 인덱스(projects.json)에 저장되며, 프로젝트 문서와 1:1로 대응합니다.</p>
 *
 * @param id 프로젝트 ID
 * @param name 이름
 * @param description 설명
 * @param ownerId 소유자 ID
 * @param createdAt 생성 시각
 * @param updatedAt 수정 시각
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public record Project(
    String id,
    String name,
    String description,
    @JsonProperty("user_id") String ownerId,
    Instant createdAt,
    Instant updatedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public Project {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        description = description == null ? "" : description;
    }

    /**
     * 이름과 설명을 변경한 새 인스턴스 생성. null 인자는 기존 값 유지.
     */
    public Project withDetails(String newName, String newDescription, Instant now) {
        return new Project(
            id,
            newName != null ? newName : name,
            newDescription != null ? newDescription : description,
            ownerId,
            createdAt,
            now
        );
    }

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }
}

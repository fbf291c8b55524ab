package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Cron 스케줄 정의.
 *
 * <p>{@code targetId}는 Suite ID 또는 단일 파일 ID입니다. 어느 쪽인지는 tick 시점에
 * 해석됩니다. 구버전 문서의 {@code script_id} 필드도 targetId로 읽힙니다.</p>
 *
 * <p>active 상태인 동안 JobScheduler 레지스트리에 정확히 하나의 핸들을 가집니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Schedule {

    private String id;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("user_id")
    private String userId;

    private String name;

    @JsonProperty("cron_expression")
    private String cronExpression;

    @JsonProperty("suite_id")
    @JsonAlias("script_id")
    private String targetId;

    @JsonProperty("is_active")
    private boolean active;

    @JsonProperty("created_at")
    private Instant createdAt;

    public Schedule() {
    }

    public Schedule(String id, String projectId, String userId, String name,
                    String cronExpression, String targetId, boolean active, Instant createdAt) {
        this.id = id;
        this.projectId = projectId;
        this.userId = userId;
        this.name = name;
        this.cronExpression = cronExpression;
        this.targetId = targetId;
        this.active = active;
        this.createdAt = createdAt;
    }

    /**
     * 표시용 이름. 이름이 없으면 "Untitled Schedule".
     */
    public String displayName() {
        return name == null || name.isBlank() ? "Untitled Schedule" : name;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTargetId() {
        return targetId;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "Schedule{id=" + id + ", name=" + name + ", cron=" + cronExpression + ", target=" + targetId
            + ", active=" + active + "}";
    }
}

package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.testops.core.statemachine.RunStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 한 번의 테스트 실행 기록.
 *
 * <p>프로젝트 문서의 {@code testRuns} 배열에 최신순으로 저장됩니다.
 * RunTracker만 이 객체를 변경하며, 종료 상태가 된 이후에는 변경되지 않습니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Run {

    private String id;
    private String projectId;
    private RunStatus status;
    // 알 수 없는 값도 원문 그대로 보관
    @JsonProperty("source")
    private String source;
    private Instant startTime;
    private Instant endTime;
    private String triggeredBy;
    private List<String> files = new ArrayList<>();
    private List<TestResult> results = new ArrayList<>();
    private List<LogEntry> logs = new ArrayList<>();
    private ObjectNode meta;

    public Run() {
    }

    /**
     * 새 RUNNING 상태 Run 생성.
     *
     * @param id Run ID
     * @param projectId 프로젝트 ID
     * @param fileIds 참조 파일 ID 목록
     * @param source 발생 주체
     * @param triggeredBy 실행 요청자
     * @return RUNNING 상태의 Run
     * @throws IllegalArgumentException id 또는 projectId가 null/blank인 경우
     */
    public static Run started(String id, String projectId, List<String> fileIds, RunSource source, String triggeredBy) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId cannot be null or blank");
        }
        Run run = new Run();
        run.id = id;
        run.projectId = projectId;
        run.status = RunStatus.RUNNING;
        run.source = (source == null ? RunSource.MANUAL : source).value();
        run.startTime = Instant.now();
        run.triggeredBy = triggeredBy;
        run.setFiles(fileIds);
        return run;
    }

    /**
     * 로그 목록만 교체한 사본 생성 (나머지 리스트는 얕은 복사).
     */
    public Run withLogs(List<LogEntry> mergedLogs) {
        Run copy = new Run();
        copy.id = id;
        copy.projectId = projectId;
        copy.status = status;
        copy.source = source;
        copy.startTime = startTime;
        copy.endTime = endTime;
        copy.triggeredBy = triggeredBy;
        copy.files = new ArrayList<>(files);
        copy.results = new ArrayList<>(results);
        copy.logs = new ArrayList<>(mergedLogs);
        copy.meta = meta == null ? null : meta.deepCopy();
        return copy;
    }

    /**
     * 영속화된 로그 중 가장 큰 sequence.
     */
    public long lastLogSequence() {
        long max = 0;
        for (LogEntry entry : logs) {
            max = Math.max(max, entry.sequence());
        }
        return max;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
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

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    @JsonIgnore
    public RunSource getSource() {
        return RunSource.fromValue(source);
    }

    @JsonIgnore
    public void setSource(RunSource source) {
        this.source = source == null ? null : source.value();
    }

    /**
     * 저장된 원래 문자열 (알 수 없는 값 포함).
     */
    @JsonIgnore
    public String getRawSource() {
        return source;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    public void setTriggeredBy(String triggeredBy) {
        this.triggeredBy = triggeredBy;
    }

    public List<String> getFiles() {
        return files;
    }

    public void setFiles(List<String> files) {
        this.files = files == null ? new ArrayList<>() : new ArrayList<>(files);
    }

    public List<TestResult> getResults() {
        return results;
    }

    public void setResults(List<TestResult> results) {
        this.results = results == null ? new ArrayList<>() : new ArrayList<>(results);
    }

    public List<LogEntry> getLogs() {
        return logs;
    }

    public void setLogs(List<LogEntry> logs) {
        this.logs = logs == null ? new ArrayList<>() : new ArrayList<>(logs);
    }

    public ObjectNode getMeta() {
        return meta;
    }

    public void setMeta(ObjectNode meta) {
        this.meta = meta;
    }

    @Override
    public String toString() {
        return "Run{id=" + id + ", projectId=" + projectId + ", status=" + status + ", source=" + source + "}";
    }
}

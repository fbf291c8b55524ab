package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 프로젝트 하나의 가변 집합체(aggregate).
 *
 * <p>프로젝트당 정확히 하나의 물리 파일로 저장되며, 모든 읽기/쓰기는
 * {@link com.ryuqq.testops.core.spi.DocumentStore}를 통해서만 이루어집니다.</p>
 *
 * <p><strong>컬렉션:</strong></p>
 * <ul>
 *   <li>이 코어가 해석하는 컬렉션: testRuns, schedules, files, suites</li>
 *   <li>해석하지 않고 그대로 보존하는 컬렉션: scripts, reports, datasets,
 *       apiCollections, visualTests, customPages, dailyData</li>
 *   <li>알 수 없는 최상위 필드도 그대로 보존됩니다.</li>
 * </ul>
 *
 * <p><strong>주의:</strong> thread-safe 하지 않습니다. DocumentStore의 키 단위 배타 구간 안에서만
 * 변경해야 합니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class ProjectDocument {

    private List<ObjectNode> customPages = new ArrayList<>();
    private List<ObjectNode> dailyData = new ArrayList<>();
    private List<ObjectNode> scripts = new ArrayList<>();
    private List<ObjectNode> reports = new ArrayList<>();
    private List<Run> testRuns = new ArrayList<>();
    private List<Schedule> schedules = new ArrayList<>();
    private List<ObjectNode> datasets = new ArrayList<>();
    private List<FileNode> files = new ArrayList<>();
    private List<ObjectNode> apiCollections = new ArrayList<>();
    private List<ObjectNode> visualTests = new ArrayList<>();
    private List<Suite> suites = new ArrayList<>();

    private final Map<String, JsonNode> unknownFields = new LinkedHashMap<>();

    public ProjectDocument() {
    }

    /**
     * 모든 컬렉션이 비어 있는 문서 생성.
     *
     * @return 빈 문서
     */
    public static ProjectDocument empty() {
        return new ProjectDocument();
    }

    public Optional<Run> findRun(String runId) {
        return testRuns.stream().filter(r -> runId.equals(r.getId())).findFirst();
    }

    public Optional<Schedule> findSchedule(String scheduleId) {
        return schedules.stream().filter(s -> scheduleId.equals(s.getId())).findFirst();
    }

    public Optional<Suite> findSuite(String suiteId) {
        return suites.stream().filter(s -> suiteId.equals(s.getId())).findFirst();
    }

    public Optional<FileNode> findFile(String fileId) {
        return files.stream().filter(f -> fileId.equals(f.getId())).findFirst();
    }

    /**
     * 스크립트 컬렉션에서 ID로 검색.
     */
    public Optional<ObjectNode> findScript(String scriptId) {
        return scripts.stream()
            .filter(s -> s.hasNonNull("id") && scriptId.equals(s.get("id").asText()))
            .findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return customPages.isEmpty() && dailyData.isEmpty() && scripts.isEmpty() && reports.isEmpty()
            && testRuns.isEmpty() && schedules.isEmpty() && datasets.isEmpty() && files.isEmpty()
            && apiCollections.isEmpty() && visualTests.isEmpty() && suites.isEmpty() && unknownFields.isEmpty();
    }

    @JsonAnySetter
    public void putUnknownField(String name, JsonNode value) {
        unknownFields.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getUnknownFields() {
        return unknownFields;
    }

    public List<ObjectNode> getCustomPages() {
        return customPages;
    }

    public void setCustomPages(List<ObjectNode> customPages) {
        this.customPages = orEmpty(customPages);
    }

    public List<ObjectNode> getDailyData() {
        return dailyData;
    }

    public void setDailyData(List<ObjectNode> dailyData) {
        this.dailyData = orEmpty(dailyData);
    }

    public List<ObjectNode> getScripts() {
        return scripts;
    }

    public void setScripts(List<ObjectNode> scripts) {
        this.scripts = orEmpty(scripts);
    }

    public List<ObjectNode> getReports() {
        return reports;
    }

    public void setReports(List<ObjectNode> reports) {
        this.reports = orEmpty(reports);
    }

    public List<Run> getTestRuns() {
        return testRuns;
    }

    public void setTestRuns(List<Run> testRuns) {
        this.testRuns = orEmpty(testRuns);
    }

    public List<Schedule> getSchedules() {
        return schedules;
    }

    public void setSchedules(List<Schedule> schedules) {
        this.schedules = orEmpty(schedules);
    }

    public List<ObjectNode> getDatasets() {
        return datasets;
    }

    public void setDatasets(List<ObjectNode> datasets) {
        this.datasets = orEmpty(datasets);
    }

    public List<FileNode> getFiles() {
        return files;
    }

    public void setFiles(List<FileNode> files) {
        this.files = orEmpty(files);
    }

    public List<ObjectNode> getApiCollections() {
        return apiCollections;
    }

    public void setApiCollections(List<ObjectNode> apiCollections) {
        this.apiCollections = orEmpty(apiCollections);
    }

    public List<ObjectNode> getVisualTests() {
        return visualTests;
    }

    public void setVisualTests(List<ObjectNode> visualTests) {
        this.visualTests = orEmpty(visualTests);
    }

    public List<Suite> getSuites() {
        return suites;
    }

    public void setSuites(List<Suite> suites) {
        this.suites = orEmpty(suites);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? new ArrayList<>() : new ArrayList<>(list);
    }
}

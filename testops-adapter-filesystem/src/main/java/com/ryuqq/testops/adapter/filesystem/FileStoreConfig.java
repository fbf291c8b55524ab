package com.ryuqq.testops.adapter.filesystem;

import java.nio.file.Path;

/**
 * 파일 저장소 설정 (불변 record).
 *
 * <p><strong>디렉터리 구조:</strong></p>
 * <pre>
 * &lt;dataDir&gt;/projects.json                       프로젝트 인덱스
 * &lt;dataDir&gt;/projects/&lt;projectId&gt;/data.json   프로젝트 문서
 * </pre>
 *
 * @author TestOps Team
 * @since 1.0.0
 * @param dataDir 데이터 루트 디렉터리
 * @param prettyPrint JSON 들여쓰기 여부
 */
public record FileStoreConfig(
    Path dataDir,
    boolean prettyPrint
) {

    public static final String PROJECTS_INDEX = "projects.json";
    public static final String PROJECTS_DIR = "projects";
    public static final String DOCUMENT_FILE = "data.json";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: ./data, pretty print</p>
     */
    public FileStoreConfig() {
        this(Path.of("data"), true);
    }

    /**
     * Compact constructor (검증 로직).
     *
     * @throws IllegalArgumentException dataDir이 null인 경우
     */
    public FileStoreConfig {
        if (dataDir == null) {
            throw new IllegalArgumentException("dataDir cannot be null");
        }
    }

    public FileStoreConfig withDataDir(Path dataDir) {
        return new FileStoreConfig(dataDir, prettyPrint);
    }

    public FileStoreConfig withPrettyPrint(boolean prettyPrint) {
        return new FileStoreConfig(dataDir, prettyPrint);
    }

    public Path projectsIndex() {
        return dataDir.resolve(PROJECTS_INDEX);
    }

    public Path documentPath(String projectId) {
        return dataDir.resolve(PROJECTS_DIR).resolve(projectId).resolve(DOCUMENT_FILE);
    }
}

package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 가상 파일 시스템 노드.
 *
 * <p>파일 내용은 프로젝트 문서 안에 문자열로 저장되며, 디렉터리 구조는
 * {@code parent_id} 역참조로만 표현됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FileNode {

    private String id;
    private String name;
    private FileNodeType type = FileNodeType.FILE;

    @JsonProperty("parent_id")
    private String parentId;

    private String content;

    @JsonProperty("created_at")
    private Instant createdAt;

    public FileNode() {
    }

    public FileNode(String id, String name, FileNodeType type, String parentId, String content) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.parentId = parentId;
        this.content = content;
    }

    public static FileNode file(String id, String name, String parentId, String content) {
        return new FileNode(id, name, FileNodeType.FILE, parentId, content);
    }

    public static FileNode folder(String id, String name, String parentId) {
        return new FileNode(id, name, FileNodeType.FOLDER, parentId, null);
    }

    @JsonIgnore
    public boolean isFolder() {
        return type == FileNodeType.FOLDER;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public FileNodeType getType() {
        return type;
    }

    public void setType(FileNodeType type) {
        this.type = type == null ? FileNodeType.FILE : type;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}

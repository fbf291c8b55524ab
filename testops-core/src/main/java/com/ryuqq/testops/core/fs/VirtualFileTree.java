package com.ryuqq.testops.core.fs;

import com.ryuqq.testops.core.model.FileNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 프로젝트 문서의 가상 파일 트리 뷰.
 *
 * <p>{@link FileNode}는 {@code parentId} 역참조로만 계층을 표현합니다. 이 클래스는 ID로 노드를 찾고,
 * 부모 체인을 따라 상대 경로를 계산하며, 트리 전체를 실제 디렉터리로 물질화(materialize)합니다.</p>
 *
 * <p><strong>경로 규칙:</strong></p>
 * <ul>
 *   <li>존재하지 않는 부모를 가리키는 노드는 루트 바로 아래에 놓입니다.</li>
 *   <li>부모 체인에 순환이 있으면 순환이 감지된 지점에서 끊습니다.</li>
 *   <li>루트 밖으로 나가는 경로(예: {@code ..})는 {@link IllegalStateException}으로 거부합니다.</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public final class VirtualFileTree {

    private final Map<String, FileNode> nodes;

    /**
     * @param files 프로젝트 문서의 파일 노드 목록
     * @throws IllegalArgumentException files가 null인 경우
     */
    public VirtualFileTree(List<FileNode> files) {
        if (files == null) {
            throw new IllegalArgumentException("files cannot be null");
        }
        Map<String, FileNode> byId = new LinkedHashMap<>();
        for (FileNode node : files) {
            if (node != null && node.getId() != null) {
                byId.put(node.getId(), node);
            }
        }
        this.nodes = Collections.unmodifiableMap(byId);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    public Optional<FileNode> find(String id) {
        return Optional.ofNullable(id == null ? null : nodes.get(id));
    }

    /**
     * 루트부터 노드까지의 이름 목록.
     *
     * @param node 대상 노드
     * @return 경로 세그먼트 (루트 쪽이 앞)
     */
    public List<String> pathSegments(FileNode node) {
        List<String> segments = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        FileNode current = node;
        while (current != null && visited.add(current.getId())) {
            segments.add(current.getName());
            String parentId = current.getParentId();
            current = parentId == null ? null : nodes.get(parentId);
        }
        Collections.reverse(segments);
        return segments;
    }

    public String relativePath(FileNode node) {
        return String.join("/", pathSegments(node));
    }

    /**
     * 루트 디렉터리 기준 노드의 실제 경로.
     *
     * @param root 물질화 루트
     * @param node 대상 노드
     * @return 정규화된 경로
     * @throws IllegalStateException 경로가 루트 밖을 가리키는 경우
     */
    public Path resolve(Path root, FileNode node) {
        if (node.getName() == null || node.getName().isBlank()) {
            throw new IllegalStateException("File node has no name: " + node.getId());
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path path = normalizedRoot;
        for (String segment : pathSegments(node)) {
            path = path.resolve(segment);
        }
        path = path.normalize();
        if (!path.startsWith(normalizedRoot) || path.equals(normalizedRoot)) {
            throw new IllegalStateException("File node escapes materialization root: " + node.getId());
        }
        return path;
    }

    /**
     * 트리 전체를 디렉터리 구조로 기록.
     *
     * <p>선택된 파일만이 아니라 모든 노드를 기록합니다. 실행 대상이 형제 파일을 import할 수 있기 때문입니다.</p>
     *
     * @param root 물질화 루트 (없으면 생성)
     * @return 파일 ID → 기록된 경로 (폴더 제외)
     * @throws IOException 디렉터리 생성 또는 파일 쓰기 실패
     */
    public Map<String, Path> materialize(Path root) throws IOException {
        Files.createDirectories(root);
        Map<String, Path> written = new LinkedHashMap<>();
        for (FileNode node : nodes.values()) {
            Path target = resolve(root, node);
            if (node.isFolder()) {
                Files.createDirectories(target);
                continue;
            }
            Files.createDirectories(target.getParent());
            String content = node.getContent() == null ? "" : node.getContent();
            Files.writeString(target, content, StandardCharsets.UTF_8);
            written.put(node.getId(), target);
        }
        return written;
    }
}

package com.ryuqq.testops.application.suite;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.testops.core.model.Ids;
import com.ryuqq.testops.core.model.Suite;
import com.ryuqq.testops.core.spi.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Suite (이름 붙은 파일 묶음) 관리.
 *
 * <p>Suite는 프로젝트 문서의 {@code suites} 컬렉션에 저장되며 모든 변경은
 * {@link DocumentStore#transact}를 통해 수행됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class SuiteService {

    private static final Logger log = LoggerFactory.getLogger(SuiteService.class);

    private final DocumentStore store;

    public SuiteService(DocumentStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * Suite 생성.
     *
     * @param projectId 프로젝트 ID
     * @param name 이름 (필수)
     * @param fileIds 파일 ID 목록
     * @param description 설명 (null이면 빈 문자열)
     * @param config 기본 실행 설정 (null 허용)
     * @return 생성된 Suite
     * @throws IllegalArgumentException projectId 또는 name이 null/blank인 경우
     */
    public CompletableFuture<Suite> create(String projectId, String name, List<String> fileIds,
                                           String description, ObjectNode config) {
        requireText(projectId, "projectId");
        requireText(name, "name");

        Instant now = Instant.now();
        Suite suite = new Suite();
        suite.setId(Ids.shortId());
        suite.setProjectId(projectId);
        suite.setName(name);
        suite.setDescription(description == null ? "" : description);
        suite.setFileIds(fileIds);
        suite.setConfig(config == null ? null : config.deepCopy());
        suite.setCreatedAt(now);
        suite.setUpdatedAt(now);

        return store.transactAndGet(projectId, document -> {
            document.getSuites().add(suite);
            log.debug("Suite created: projectId={}, suiteId={}, files={}", projectId, suite.getId(),
                suite.getFileIds().size());
            return suite;
        });
    }

    /**
     * 프로젝트의 Suite 목록 (최신 생성순).
     */
    public CompletableFuture<List<Suite>> list(String projectId) {
        requireText(projectId, "projectId");
        return store.read(projectId).thenApply(document -> {
            List<Suite> suites = new ArrayList<>(document.getSuites());
            suites.sort(Comparator.comparing(Suite::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
            return suites;
        });
    }

    public CompletableFuture<Optional<Suite>> get(String projectId, String suiteId) {
        requireText(projectId, "projectId");
        requireText(suiteId, "suiteId");
        return store.read(projectId).thenApply(document -> document.findSuite(suiteId));
    }

    /**
     * Suite 수정. id, projectId, createdAt은 변경되지 않습니다.
     *
     * @return 수정된 Suite (실패: 없으면 {@link IllegalStateException})
     */
    public CompletableFuture<Suite> update(String projectId, String suiteId, SuiteUpdate update) {
        requireText(projectId, "projectId");
        requireText(suiteId, "suiteId");
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        return store.transactAndGet(projectId, document -> {
            Suite suite = document.findSuite(suiteId)
                .orElseThrow(() -> new IllegalStateException("Suite not found: " + suiteId));
            if (update.name() != null) {
                suite.setName(update.name());
            }
            if (update.description() != null) {
                suite.setDescription(update.description());
            }
            if (update.fileIds() != null) {
                suite.setFileIds(update.fileIds());
            }
            if (update.config() != null) {
                suite.setConfig(update.config().deepCopy());
            }
            suite.setUpdatedAt(Instant.now());
            return suite;
        });
    }

    /**
     * Suite 삭제. 없는 Suite는 무시합니다.
     *
     * @return 삭제되었으면 true
     */
    public CompletableFuture<Boolean> delete(String projectId, String suiteId) {
        requireText(projectId, "projectId");
        requireText(suiteId, "suiteId");
        return store.transactAndGet(projectId, document ->
            document.getSuites().removeIf(suite -> suiteId.equals(suite.getId())));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}

package com.ryuqq.testops.application.suite;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.testops.core.model.Suite;
import com.ryuqq.testops.testkit.store.InMemoryDocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SuiteService 테스트.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
class SuiteServiceTest {

    private static final String PROJECT = "p1";

    private InMemoryDocumentStore store;
    private SuiteService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        service = new SuiteService(store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void create는_프로젝트_문서에_Suite를_추가() throws Exception {
        // given
        ObjectNode config = JsonNodeFactory.instance.objectNode().put("browser", "firefox");

        // when
        Suite suite = await(service.create(PROJECT, "Smoke", List.of("f1", "f2"), null, config));

        // then
        Suite stored = await(service.get(PROJECT, suite.getId())).orElseThrow();
        assertThat(stored.getName()).isEqualTo("Smoke");
        assertThat(stored.getDescription()).isEmpty();
        assertThat(stored.getFileIds()).containsExactly("f1", "f2");
        assertThat(stored.getConfig().get("browser").asText()).isEqualTo("firefox");
        assertThat(stored.getProjectId()).isEqualTo(PROJECT);
    }

    @Test
    void 이름이_비어있으면_생성_불가() {
        assertThatThrownBy(() -> service.create(PROJECT, " ", List.of(), null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.contains(PROJECT)).isFalse();
    }

    @Test
    void update는_id와_createdAt을_유지() throws Exception {
        // given
        Suite suite = await(service.create(PROJECT, "Smoke", List.of("f1"), "d", null));

        // when
        Suite updated = await(service.update(PROJECT, suite.getId(),
            new SuiteUpdate("Regression", null, List.of("f2"), null)));

        // then
        assertThat(updated.getId()).isEqualTo(suite.getId());
        assertThat(updated.getCreatedAt()).isEqualTo(suite.getCreatedAt());
        assertThat(updated.getName()).isEqualTo("Regression");
        assertThat(updated.getDescription()).isEqualTo("d");
        assertThat(updated.getFileIds()).containsExactly("f2");
    }

    @Test
    void update_빈_이름은_거부() {
        assertThatThrownBy(() -> new SuiteUpdate("", null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 없는_Suite_update는_실패() {
        assertThatThrownBy(() -> service.update(PROJECT, "missing", new SuiteUpdate("x", null, null, null))
            .get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void list와_delete() throws Exception {
        Suite first = await(service.create(PROJECT, "A", List.of(), null, null));
        Suite second = await(service.create(PROJECT, "B", List.of(), null, null));

        assertThat(await(service.list(PROJECT))).extracting(Suite::getId)
            .containsExactlyInAnyOrder(first.getId(), second.getId());

        assertThat(await(service.delete(PROJECT, first.getId()))).isTrue();
        assertThat(await(service.delete(PROJECT, first.getId()))).isFalse();
        assertThat(await(service.list(PROJECT))).extracting(Suite::getId).containsExactly(second.getId());
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }
}

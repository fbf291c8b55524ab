package com.ryuqq.testops.testkit.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.testops.core.codec.DocumentCodec;
import com.ryuqq.testops.core.model.FileNode;
import com.ryuqq.testops.core.model.LogEntry;
import com.ryuqq.testops.core.model.LogLevel;
import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.model.Run;
import com.ryuqq.testops.core.model.RunSource;
import com.ryuqq.testops.core.model.Schedule;
import com.ryuqq.testops.core.spi.DocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract contract test every {@link DocumentStore} adapter must pass.
 *
 * <p><strong>Covered Properties:</strong></p>
 * <ul>
 *   <li>Missing key reads as an empty document</li>
 *   <li>write followed by read returns a deeply equal document</li>
 *   <li>N concurrent transacts on one key behave as some sequential order of the N updaters</li>
 *   <li>An updater never observes another transaction's unpersisted state</li>
 *   <li>A throwing or failed updater leaves the stored document unchanged</li>
 *   <li>Different keys do not block each other</li>
 *   <li>delete removes the document</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractDocumentStoreContractTest {
 *     {@literal @}Override
 *     protected DocumentStore createStore() {
 *         return new MyStore(...);
 *     }
 * }
 * </pre>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public abstract class AbstractDocumentStoreContractTest {

    protected static final String KEY = "project-1";
    private static final int CONCURRENT_TRANSACTIONS = 40;

    protected DocumentStore store;
    protected final DocumentCodec codec = new DocumentCodec(false);
    private ExecutorService callers;

    /**
     * Creates a fresh, empty store for one test.
     */
    protected abstract DocumentStore createStore() throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
        callers = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDownStore() throws Exception {
        callers.shutdownNow();
        if (store instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }

    // ========== read / write ==========

    @Test
    void read_없는_키는_빈_문서() throws Exception {
        ProjectDocument document = await(store.read("unknown"));

        assertTrue(document.isEmpty(), "Missing key should read as an empty document");
    }

    @Test
    void write_후_read는_같은_문서를_반환() throws Exception {
        // given
        ProjectDocument document = sampleDocument();

        // when
        await(store.write(KEY, document));
        ProjectDocument read = await(store.read(KEY));

        // then
        assertEquals(tree(document), tree(read));
    }

    @Test
    void read_결과를_변경해도_저장된_문서는_그대로() throws Exception {
        await(store.write(KEY, sampleDocument()));

        ProjectDocument first = await(store.read(KEY));
        first.getFiles().clear();
        ProjectDocument second = await(store.read(KEY));

        assertEquals(1, second.getFiles().size());
    }

    @Test
    void write_인자_검증() {
        assertThrows(IllegalArgumentException.class, () -> store.write(KEY, null));
        assertThrows(IllegalArgumentException.class, () -> store.read(" "));
        assertThrows(IllegalArgumentException.class, () -> store.transact(KEY, null));
    }

    // ========== transact ==========

    @Test
    void 동시_transact는_순차_실행과_동일한_결과() throws Exception {
        // given: 각 updater는 현재 파일 수를 읽고 그 번호로 파일을 추가
        CompletableFuture<?>[] futures = new CompletableFuture<?>[CONCURRENT_TRANSACTIONS];

        // when
        for (int i = 0; i < CONCURRENT_TRANSACTIONS; i++) {
            futures[i] = CompletableFuture
                .supplyAsync(() -> store.transact(KEY, document -> {
                    int next = document.getFiles().size();
                    document.getFiles().add(FileNode.file("f" + next, "file-" + next + ".py", null, ""));
                }), callers)
                .thenCompose(future -> future);
        }
        CompletableFuture.allOf(futures).get(30, TimeUnit.SECONDS);

        // then: lost update나 중복 번호가 없어야 함
        ProjectDocument document = await(store.read(KEY));
        assertEquals(CONCURRENT_TRANSACTIONS, document.getFiles().size());
        Set<String> ids = new HashSet<>();
        document.getFiles().forEach(file -> ids.add(file.getId()));
        assertEquals(CONCURRENT_TRANSACTIONS, ids.size(), "Every updater must observe its predecessor's result");
    }

    @Test
    void 비동기_updater가_끝나기_전에는_다음_transact가_시작되지_않음() throws Exception {
        // given
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<String> slow = store.transactAsync(KEY, document -> gate.thenApply(ignored -> {
            document.getDailyData().add(marker("slow"));
            return "slow";
        }));
        CompletableFuture<Integer> observer = store.transactAndGet(KEY, document -> document.getDailyData().size());

        // when
        Thread.sleep(100);
        assertFalse(observer.isDone(), "Second transaction must wait for the first to persist");
        gate.complete(null);

        // then
        assertEquals("slow", await(slow));
        assertEquals(1, await(observer));
    }

    @Test
    void updater가_예외를_던지면_문서는_변경되지_않음() throws Exception {
        // given
        await(store.write(KEY, sampleDocument()));

        // when
        CompletableFuture<Void> failed = store.transact(KEY, document -> {
            document.getFiles().clear();
            throw new IllegalStateException("updater failure");
        });

        // then
        ExecutionException exception = assertThrows(ExecutionException.class, () -> await(failed));
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertEquals(tree(sampleDocument()), tree(await(store.read(KEY))));
    }

    @Test
    void 비동기_updater가_실패하면_문서는_변경되지_않음() throws Exception {
        await(store.write(KEY, sampleDocument()));

        CompletableFuture<Void> failed = store.transactAsync(KEY, document -> {
            document.getSchedules().clear();
            return CompletableFuture.failedFuture(new IllegalArgumentException("async failure"));
        });

        ExecutionException exception = assertThrows(ExecutionException.class, () -> await(failed));
        assertInstanceOf(IllegalArgumentException.class, exception.getCause());
        assertEquals(1, await(store.read(KEY)).getSchedules().size());
    }

    @Test
    void 실패한_transact_이후에도_같은_키의_작업은_계속_처리됨() throws Exception {
        CompletableFuture<Void> failed = store.transact(KEY, document -> {
            throw new IllegalStateException("first fails");
        });
        CompletableFuture<Void> next = store.transact(KEY, document -> document.getDailyData().add(marker("next")));

        assertThrows(ExecutionException.class, () -> await(failed));
        await(next);
        assertEquals(1, await(store.read(KEY)).getDailyData().size());
    }

    @Test
    void transactAndGet은_updater의_반환값을_전달() throws Exception {
        String id = await(store.transactAndGet(KEY, document -> {
            document.getFiles().add(FileNode.file("f1", "a.py", null, "x"));
            return "f1";
        }));

        assertEquals("f1", id);
        assertTrue(await(store.read(KEY)).findFile("f1").isPresent());
    }

    @Test
    void 다른_키의_작업은_서로_막지_않음() throws Exception {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Void> blocked = store.transactAsync(KEY, document -> gate);

        await(store.transact("project-2", document -> document.getDailyData().add(marker("other"))));

        assertFalse(blocked.isDone());
        gate.complete(null);
        await(blocked);
        assertEquals(1, await(store.read("project-2")).getDailyData().size());
    }

    // ========== delete ==========

    @Test
    void delete_후_read는_빈_문서() throws Exception {
        await(store.write(KEY, sampleDocument()));

        await(store.delete(KEY));

        assertTrue(await(store.read(KEY)).isEmpty());
        await(store.delete(KEY));
    }

    // ========== helpers ==========

    protected ProjectDocument sampleDocument() {
        ProjectDocument document = ProjectDocument.empty();
        document.getFiles().add(FileNode.file("f1", "login.py", null, "assert True"));
        Run run = Run.started("run-1", KEY, List.of("f1"), RunSource.MANUAL, "user-1");
        run.setStartTime(Instant.parse("2024-05-01T10:00:00Z"));
        run.setLogs(List.of(new LogEntry(Instant.parse("2024-05-01T10:00:01Z"), LogLevel.INFO, "started", null, 1)));
        document.getTestRuns().add(run);
        document.getSchedules().add(new Schedule("sc-1", KEY, "user-1", "Nightly", "0 2 * * *", "suite-1", true,
            Instant.parse("2024-05-01T00:00:00Z")));
        document.getScripts().add(marker("script"));
        return document;
    }

    protected ObjectNode marker(String value) {
        ObjectNode node = codec.mapper().createObjectNode();
        node.put("id", value);
        return node;
    }

    protected JsonNode tree(ProjectDocument document) throws IOException {
        return codec.mapper().readTree(codec.encode(document));
    }

    protected static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }
}

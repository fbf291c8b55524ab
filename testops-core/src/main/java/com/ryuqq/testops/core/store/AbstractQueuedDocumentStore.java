package com.ryuqq.testops.core.store;

import com.ryuqq.testops.core.concurrent.KeyedTaskQueue;
import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.spi.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * {@link DocumentStore} 공통 골격.
 *
 * <p>키 단위 직렬화와 read-modify-write 흐름을 담당하고, 실제 저장 매체 접근은
 * 하위 클래스의 동기 메서드 세 개({@link #load}, {@link #persist}, {@link #remove})에 위임합니다.
 * 하위 클래스의 메서드는 항상 해당 키의 배타 구간 안에서만 호출됩니다.</p>
 *
 * <p><strong>transact 흐름:</strong></p>
 * <pre>
 * [key 슬롯 획득] → load(key) → updater(doc) → (stage 완료) → persist(key, doc) → [슬롯 해제]
 * </pre>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public abstract class AbstractQueuedDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractQueuedDocumentStore.class);

    private final KeyedTaskQueue queue;

    protected AbstractQueuedDocumentStore(Executor ioExecutor) {
        this.queue = new KeyedTaskQueue(ioExecutor);
    }

    /**
     * 저장된 문서 로드. 없으면 빈 문서, 파싱 불가 시에도 빈 문서를 반환해야 합니다.
     *
     * @throws com.ryuqq.testops.core.spi.StorageException 읽기 I/O 실패
     */
    protected abstract ProjectDocument load(String key);

    /**
     * 문서를 원자적으로 교체 저장.
     *
     * @throws com.ryuqq.testops.core.spi.StorageException 쓰기 실패 (기존 문서는 보존되어야 함)
     */
    protected abstract void persist(String key, ProjectDocument document);

    protected abstract void remove(String key);

    @Override
    public CompletableFuture<ProjectDocument> read(String key) {
        validateKey(key);
        return queue.submit(key, () -> CompletableFuture.completedFuture(load(key)));
    }

    @Override
    public CompletableFuture<Void> write(String key, ProjectDocument document) {
        validateKey(key);
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        return queue.submit(key, () -> {
            persist(key, document);
            return CompletableFuture.<Void>completedFuture(null);
        });
    }

    @Override
    public CompletableFuture<Void> transact(String key, Consumer<ProjectDocument> updater) {
        if (updater == null) {
            throw new IllegalArgumentException("updater cannot be null");
        }
        return this.<Void>transactAsync(key, document -> {
            updater.accept(document);
            return CompletableFuture.completedFuture(null);
        });
    }

    @Override
    public <T> CompletableFuture<T> transactAndGet(String key, Function<ProjectDocument, T> updater) {
        if (updater == null) {
            throw new IllegalArgumentException("updater cannot be null");
        }
        return this.<T>transactAsync(key, document -> CompletableFuture.completedFuture(updater.apply(document)));
    }

    @Override
    public <T> CompletableFuture<T> transactAsync(String key,
                                                  Function<ProjectDocument, ? extends CompletionStage<T>> updater) {
        validateKey(key);
        if (updater == null) {
            throw new IllegalArgumentException("updater cannot be null");
        }
        return queue.submit(key, () -> {
            ProjectDocument document = load(key);
            CompletionStage<T> stage = updater.apply(document);
            if (stage == null) {
                stage = CompletableFuture.completedFuture(null);
            }
            return stage
                .whenComplete((value, error) -> {
                    if (error != null) {
                        log.debug("Transaction aborted without write: key={}, cause={}", key, error.toString());
                    }
                })
                .thenApply(value -> {
                    persist(key, document);
                    return value;
                });
        });
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        validateKey(key);
        return queue.submit(key, () -> {
            remove(key);
            return CompletableFuture.<Void>completedFuture(null);
        });
    }

    /**
     * 진행 중이거나 대기 중인 작업이 있는 키의 수.
     */
    public int pendingKeys() {
        return queue.activeKeys();
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }
}

package com.ryuqq.testops.core.concurrent;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * 키 단위 FIFO 비동기 작업 큐.
 *
 * <p>같은 키로 제출된 작업은 제출 순서대로 하나씩 실행되며, 다음 작업은 이전 작업이 반환한
 * stage가 완료된 뒤에야 시작됩니다. 서로 다른 키의 작업은 독립적으로 실행됩니다.</p>
 *
 * <p><strong>구현:</strong></p>
 * <ul>
 *   <li>키 → 마지막 작업의 "release" future 맵</li>
 *   <li>새 작업은 현재 tail 뒤에 연결되고, 자신의 release future로 tail을 교체</li>
 *   <li>작업이 끝났을 때 tail이 여전히 자신이면 맵에서 제거 (유휴 키는 메모리를 차지하지 않음)</li>
 * </ul>
 *
 * <p>이전 작업의 실패는 다음 작업에 전파되지 않습니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public final class KeyedTaskQueue {

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final Executor executor;

    /**
     * @param executor 작업 본문을 실행할 Executor
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public KeyedTaskQueue(Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    /**
     * 작업 제출.
     *
     * @param key 직렬화 키
     * @param task 작업 (반환한 stage가 완료될 때까지 키를 점유)
     * @param <T> 결과 타입
     * @return 작업 결과 future
     * @throws IllegalArgumentException key 또는 task가 null인 경우
     */
    public <T> CompletableFuture<T> submit(String key, Supplier<? extends CompletionStage<T>> task) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        CompletableFuture<Void> released = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, released);
        CompletableFuture<Void> start = previous != null ? previous : CompletableFuture.completedFuture(null);

        return start
            .thenComposeAsync(ignored -> invoke(task), executor)
            .whenComplete((value, error) -> {
                tails.remove(key, released);
                released.complete(null);
            });
    }

    /**
     * 대기 중이거나 실행 중인 작업이 있는 키의 수.
     */
    public int activeKeys() {
        return tails.size();
    }

    public boolean isIdle(String key) {
        return !tails.containsKey(key);
    }

    private static <T> CompletionStage<T> invoke(Supplier<? extends CompletionStage<T>> task) {
        try {
            CompletionStage<T> stage = task.get();
            return stage != null ? stage : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}

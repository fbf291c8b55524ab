package com.ryuqq.testops.core.concurrent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * CompletableFuture 동기 대기 유틸리티.
 *
 * <p>{@link CompletableFuture#join()}이 감싸는 {@link CompletionException}을 벗겨
 * 원래의 unchecked 예외를 그대로 호출자에게 전달합니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public final class Futures {

    private Futures() {
    }

    /**
     * 완료까지 대기 후 결과 반환.
     *
     * @param future 대기할 future
     * @param <T> 결과 타입
     * @return 결과
     * @throws RuntimeException future의 원인 예외 (unchecked면 그대로, checked면 {@link IllegalStateException}으로 감쌈)
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /**
     * CompletionException / ExecutionException의 원인을 unchecked 예외로 변환.
     */
    public static RuntimeException unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error fatal) {
            throw fatal;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }
}

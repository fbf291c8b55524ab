package com.ryuqq.testops.testkit.executor;

import com.ryuqq.testops.core.executor.CodeExecutor;
import com.ryuqq.testops.core.executor.ExecutionResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted CodeExecutor for tests.
 *
 * <p>Records every invocation and answers by language. Unscripted languages succeed with
 * exit code 0 and an empty output.</p>
 *
 * <pre>
 * RecordingCodeExecutor executor = new RecordingCodeExecutor()
 *     .respond("python", ExecutionResult.of(1, List.of("AssertionError")))
 *     .failOn("java", new IllegalStateException("javac not found"));
 * </pre>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class RecordingCodeExecutor implements CodeExecutor {

    /**
     * 한 번의 호출 기록.
     *
     * @param content 파일 내용
     * @param language 언어
     * @param thread 실행 스레드 이름
     */
    public record Invocation(String content, String language, String thread) {
    }

    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private final Map<String, ExecutionResult> responses = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private volatile long delayMs;

    public RecordingCodeExecutor respond(String language, ExecutionResult result) {
        responses.put(language, result);
        return this;
    }

    public RecordingCodeExecutor failOn(String language, RuntimeException failure) {
        failures.put(language, failure);
        return this;
    }

    public RecordingCodeExecutor withDelay(long delayMs) {
        this.delayMs = delayMs;
        return this;
    }

    @Override
    public ExecutionResult execute(String content, String language) {
        invocations.add(new Invocation(content, language, Thread.currentThread().getName()));
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while simulating execution", e);
            }
        }
        RuntimeException failure = failures.get(language);
        if (failure != null) {
            throw failure;
        }
        return responses.getOrDefault(language, ExecutionResult.of(0, List.of()));
    }

    public List<Invocation> invocations() {
        return new ArrayList<>(invocations);
    }

    public int invocationCount() {
        return invocations.size();
    }
}

package com.ryuqq.testops.adapter.runner;

import com.ryuqq.testops.core.executor.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 외부 프로세스 실행과 출력 수집.
 *
 * <p>stdout은 그대로, stderr는 {@code [Details] } 접두어를 붙여 하나의 출력 목록으로 모읍니다.
 * 제한 시간을 넘기면 프로세스와 그 자손 프로세스를 강제 종료하고 {@link ExecutionResult#timeout}을 반환합니다.</p>
 *
 * <p>출력 스트림은 이 객체가 소유한 전용 스레드 풀에서 읽습니다. 프로세스 하나당 두 스레드를
 * 사용하며, 공용 풀을 쓰지 않으므로 동시 실행 수와 무관하게 파이프가 막히지 않습니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
class ProcessRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    static final String STDERR_PREFIX = "[Details] ";

    private final ExecutorService streamReaders;

    ProcessRunner() {
        AtomicInteger threadIndex = new AtomicInteger();
        this.streamReaders = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "process-output-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 프로세스 실행.
     *
     * @param command 명령과 인자
     * @param workDir 작업 디렉터리
     * @param environment 추가 환경 변수
     * @param timeoutMs 제한 시간
     * @return 실행 결과
     * @throws IllegalStateException 프로세스를 시작할 수 없거나 대기 중 인터럽트된 경우
     */
    ExecutionResult run(List<String> command, Path workDir, Map<String, String> environment, long timeoutMs) {
        ProcessBuilder builder = new ProcessBuilder(command).directory(workDir.toFile());
        builder.environment().putAll(environment);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start process: " + command.get(0) + " (" + e.getMessage() + ")", e);
        }
        log.debug("Process started: pid={}, command={}", process.pid(), command);

        List<String> output = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> stdout = CompletableFuture.runAsync(
            () -> drain(process.getInputStream(), "", output), streamReaders);
        CompletableFuture<Void> stderr = CompletableFuture.runAsync(
            () -> drain(process.getErrorStream(), STDERR_PREFIX, output), streamReaders);

        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                destroyTree(process);
                awaitStreams(stdout, stderr);
                output.add("[System] Execution timed out (" + (timeoutMs / 1000) + "s limit).");
                log.warn("Process timed out: pid={}, timeoutMs={}", process.pid(), timeoutMs);
                return ExecutionResult.timeout(snapshot(output));
            }
            awaitStreams(stdout, stderr);
            return ExecutionResult.of(process.exitValue(), snapshot(output));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            throw new IllegalStateException("Interrupted while waiting for process: " + command.get(0), e);
        }
    }

    /**
     * 출력 수집 스레드 풀 종료. 실행 중인 프로세스의 수집은 끝까지 진행됩니다.
     */
    @Override
    public void close() {
        streamReaders.shutdown();
    }

    // npx 등이 띄운 자손이 파이프를 잡고 있으면 스트림이 닫히지 않으므로 자손부터 종료
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void drain(InputStream stream, String prefix, List<String> output) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.add(prefix + line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void awaitStreams(CompletableFuture<?>... streams) throws InterruptedException {
        try {
            CompletableFuture.allOf(streams).get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Process output not fully collected: {}", e.toString());
        }
    }

    private static List<String> snapshot(List<String> output) {
        synchronized (output) {
            return new ArrayList<>(output);
        }
    }
}

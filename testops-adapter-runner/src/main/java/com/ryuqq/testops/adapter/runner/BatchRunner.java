package com.ryuqq.testops.adapter.runner;

import com.ryuqq.testops.application.batch.BatchConfig;
import com.ryuqq.testops.application.batch.BatchHandle;
import com.ryuqq.testops.application.batch.BatchOrchestrator;
import com.ryuqq.testops.application.run.RunPatch;
import com.ryuqq.testops.application.run.RunTracker;
import com.ryuqq.testops.core.concurrent.Futures;
import com.ryuqq.testops.core.executor.BrowserSuiteRunner;
import com.ryuqq.testops.core.executor.CodeExecutor;
import com.ryuqq.testops.core.executor.ExecutionResult;
import com.ryuqq.testops.core.fs.VirtualFileTree;
import com.ryuqq.testops.core.model.FileNode;
import com.ryuqq.testops.core.model.LogLevel;
import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.model.Run;
import com.ryuqq.testops.core.model.TestResult;
import com.ryuqq.testops.core.spi.DocumentStore;
import com.ryuqq.testops.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BatchOrchestrator 구현체.
 *
 * <p>프로젝트의 가상 파일 트리를 {@code <scratchRoot>/<runId>/}에 물질화하고, 선택된 파일을
 * {@link FileKind} 버킷으로 나누어 실행한 뒤 결과를 Run에 기록합니다.</p>
 *
 * <p><strong>실행 순서:</strong></p>
 * <pre>
 * [JAVA 파일들] ─┐ (파일마다 병렬, 워커 풀)
 * [PYTHON 파일들]┴─→ 모두 끝나면 → [BROWSER 버킷 1회 실행] → update(COMPLETED, results)
 *                                                       예외 → update(FAILED)
 * </pre>
 *
 * <p><strong>실패 정책:</strong></p>
 * <ul>
 *   <li>파일 하나의 실패(예외 포함)는 그 파일의 FAILED 결과가 되며 다른 파일에 영향을 주지 않음</li>
 *   <li>브라우저 스위트 실행기의 예외도 브라우저 파일들의 FAILED 결과로 기록</li>
 *   <li>결과 기록 등 오케스트레이션 단계의 예외는 Run FAILED로 기록</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> 여러 배치를 동시에 실행할 수 있습니다. 워커 스레드는 블로킹
 * 대기 없이 CompletableFuture 조합으로만 연결됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class BatchRunner implements BatchOrchestrator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final DocumentStore store;
    private final RunTracker runTracker;
    private final CodeExecutor codeExecutor;
    private final BrowserSuiteRunner browserRunner;
    private final BatchRunnerConfig config;
    private final ExecutorService workers;

    /**
     * 생성자.
     *
     * @param store 프로젝트 문서 저장소
     * @param runTracker Run 추적기
     * @param codeExecutor Java/Python 실행기
     * @param browserRunner 브라우저 스위트 실행기
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BatchRunner(DocumentStore store, RunTracker runTracker, CodeExecutor codeExecutor,
                       BrowserSuiteRunner browserRunner, BatchRunnerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (runTracker == null) {
            throw new IllegalArgumentException("runTracker cannot be null");
        }
        if (codeExecutor == null) {
            throw new IllegalArgumentException("codeExecutor cannot be null");
        }
        if (browserRunner == null) {
            throw new IllegalArgumentException("browserRunner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.runTracker = runTracker;
        this.codeExecutor = codeExecutor;
        this.browserRunner = browserRunner;
        this.config = config;
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.concurrency(), runnable -> {
            Thread thread = new Thread(runnable, "batch-runner-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public BatchHandle executeBatch(String projectId, List<String> fileIds, BatchConfig batchConfig) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId cannot be null or blank");
        }
        BatchConfig effective = batchConfig == null ? new BatchConfig() : batchConfig;
        List<String> selected = fileIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(fileIds));

        // 1. Run 생성
        String runId = Futures.await(runTracker.create(
            projectId, selected, effective.source(), effective.triggeredBy(), effective.toJson()));
        Path scratch = config.scratchRoot().toAbsolutePath().resolve(runId);
        appendLog(runId, projectId, LogLevel.INFO,
            "[BatchRunner] Starting Run " + runId + " with config: " + effective.toJson());

        Map<FileKind, List<BatchFile>> buckets;
        try {
            // 2. 가상 파일 트리 물질화
            ProjectDocument document = Futures.await(store.read(projectId));
            VirtualFileTree tree = new VirtualFileTree(document.getFiles());
            if (tree.isEmpty()) {
                return failEarly(runId, projectId, scratch, "No files in project");
            }
            Map<String, Path> paths = tree.materialize(scratch);

            // 3. 버킷 분류
            buckets = classify(selected, tree, paths);
            if (buckets.values().stream().allMatch(List::isEmpty)) {
                return failEarly(runId, projectId, scratch, "No valid test files selected");
            }
        } catch (IOException | RuntimeException e) {
            log.error("Batch preparation failed: runId={}, projectId={}", runId, projectId, e);
            appendLog(runId, projectId, LogLevel.ERROR, "[BatchRunner] Error: " + e.getMessage());
            return failEarly(runId, projectId, scratch, String.valueOf(e.getMessage()));
        }

        appendLog(runId, projectId, LogLevel.INFO, String.format("[BatchRunner] Breakdown: %d Java, %d Python, %d Playwright",
            buckets.get(FileKind.JAVA).size(), buckets.get(FileKind.PYTHON).size(), buckets.get(FileKind.BROWSER).size()));

        // 4. 백그라운드 실행
        CompletableFuture<RunStatus> completion = runBuckets(runId, projectId, scratch, buckets, effective)
            .thenCompose(results -> runTracker.update(runId, projectId,
                RunPatch.status(RunStatus.COMPLETED).withResults(results)))
            .thenApply(Run::getStatus)
            .exceptionallyCompose(error -> markFailed(runId, projectId, error))
            .whenComplete((status, error) -> {
                if (error != null) {
                    log.error("Batch run could not be finalized: runId={}", runId, error);
                }
                cleanup(scratch);
            });

        log.info("Batch started: runId={}, projectId={}, files={}", runId, projectId, selected.size());
        return BatchHandle.started(runId, completion);
    }

    /**
     * 워커 풀 종료. 실행 중인 배치는 끝까지 진행됩니다.
     */
    @Override
    public void close() {
        workers.shutdown();
    }

    private CompletableFuture<List<TestResult>> runBuckets(String runId, String projectId, Path scratch,
                                                           Map<FileKind, List<BatchFile>> buckets,
                                                           BatchConfig batchConfig) {
        List<CompletableFuture<TestResult>> fileRuns = new ArrayList<>();
        for (FileKind kind : List.of(FileKind.JAVA, FileKind.PYTHON)) {
            List<BatchFile> files = buckets.get(kind);
            if (!files.isEmpty()) {
                appendLog(runId, projectId, LogLevel.INFO,
                    "[BatchRunner] Executing " + files.size() + " " + kind.label() + " files...");
            }
            for (BatchFile file : files) {
                fileRuns.add(CompletableFuture.supplyAsync(() -> executeFile(runId, projectId, kind, file), workers));
            }
        }

        return CompletableFuture.allOf(fileRuns.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                List<TestResult> results = new ArrayList<>();
                fileRuns.forEach(run -> results.add(run.join()));
                return results;
            })
            .thenComposeAsync(results -> {
                List<BatchFile> browserFiles = buckets.get(FileKind.BROWSER);
                if (!browserFiles.isEmpty()) {
                    results.addAll(executeBrowserSuite(runId, projectId, scratch, browserFiles, batchConfig));
                }
                return CompletableFuture.completedFuture(results);
            }, workers);
    }

    private TestResult executeFile(String runId, String projectId, FileKind kind, BatchFile file) {
        appendLog(runId, projectId, LogLevel.INFO, "Executing " + kind.label() + ": " + file.name());
        long startedAt = System.currentTimeMillis();
        try {
            ExecutionResult result = codeExecutor.execute(file.content(), kind.language());
            long duration = System.currentTimeMillis() - startedAt;
            appendLog(runId, projectId, LogLevel.INFO, "Finished " + kind.label() + ": " + file.name()
                + " (" + (result.isSuccess() ? "PASS" : "FAIL") + ")");
            return TestResult.fromExitCode(file.name(), result.exitCode(), duration, result.output());
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startedAt;
            log.warn("File execution failed: runId={}, file={}", runId, file.name(), e);
            appendLog(runId, projectId, LogLevel.ERROR,
                "Failed " + kind.label() + ": " + file.name() + " (" + e.getMessage() + ")");
            return TestResult.failure(file.name(), duration, String.valueOf(e.getMessage()));
        }
    }

    private List<TestResult> executeBrowserSuite(String runId, String projectId, Path scratch,
                                                 List<BatchFile> files, BatchConfig batchConfig) {
        appendLog(runId, projectId, LogLevel.INFO,
            "[BatchRunner] Triggering Playwright for " + files.size() + " files...");
        appendLog(runId, projectId, LogLevel.INFO, "[BatchRunner] Browser: " + batchConfig.browser()
            + ", headless: " + batchConfig.headless() + ", environment: " + batchConfig.environment());

        List<Path> paths = files.stream().map(BatchFile::path).toList();
        long startedAt = System.currentTimeMillis();
        List<TestResult> results = new ArrayList<>();
        try {
            ExecutionResult result = browserRunner.run(paths, batchConfig.browserOptions(), scratch);
            long duration = System.currentTimeMillis() - startedAt;
            appendLog(runId, projectId, result.isSuccess() ? LogLevel.INFO : LogLevel.WARN,
                "[BatchRunner] Playwright finished with code " + result.exitCode());
            for (BatchFile file : files) {
                results.add(TestResult.fromExitCode(file.name(), result.exitCode(), duration, result.output()));
            }
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startedAt;
            log.warn("Browser suite failed: runId={}", runId, e);
            appendLog(runId, projectId, LogLevel.ERROR, "[BatchRunner] Playwright failed: " + e.getMessage());
            for (BatchFile file : files) {
                results.add(TestResult.failure(file.name(), duration, String.valueOf(e.getMessage())));
            }
        }
        return results;
    }

    private CompletableFuture<RunStatus> markFailed(String runId, String projectId, Throwable error) {
        RuntimeException cause = Futures.unwrap(error);
        log.error("Batch run failed: runId={}, projectId={}", runId, projectId, cause);
        appendLog(runId, projectId, LogLevel.ERROR, "[BatchRunner] Critical Error: " + cause.getMessage());
        return runTracker.update(runId, projectId, RunPatch.status(RunStatus.FAILED)).thenApply(Run::getStatus);
    }

    private BatchHandle failEarly(String runId, String projectId, Path scratch, String message) {
        appendLog(runId, projectId, LogLevel.ERROR, "[BatchRunner] " + message);
        try {
            Futures.await(runTracker.update(runId, projectId, RunPatch.status(RunStatus.FAILED)));
        } catch (RuntimeException e) {
            log.error("Failed to mark run as failed: runId={}", runId, e);
        }
        cleanup(scratch);
        log.info("Batch rejected: runId={}, reason={}", runId, message);
        return BatchHandle.failed(runId, message);
    }

    private static Map<FileKind, List<BatchFile>> classify(List<String> fileIds, VirtualFileTree tree,
                                                           Map<String, Path> paths) {
        Map<FileKind, List<BatchFile>> buckets = new EnumMap<>(FileKind.class);
        for (FileKind kind : FileKind.values()) {
            buckets.put(kind, new ArrayList<>());
        }
        for (String fileId : fileIds) {
            Optional<FileNode> node = tree.find(fileId).filter(found -> !found.isFolder());
            if (node.isEmpty() || !paths.containsKey(fileId)) {
                continue;
            }
            FileNode file = node.get();
            FileKind.of(file.getName()).ifPresent(kind -> buckets.get(kind).add(new BatchFile(
                file.getName(), file.getContent() == null ? "" : file.getContent(), paths.get(fileId))));
        }
        return buckets;
    }

    private void appendLog(String runId, String projectId, LogLevel level, String message) {
        log.debug("[{}] {}", runId, message);
        runTracker.appendLog(runId, projectId, message, level);
    }

    private void cleanup(Path scratch) {
        if (config.cleanupScratch()) {
            ProcessCodeExecutor.deleteQuietly(scratch);
        }
    }

    /**
     * 실행 대상 파일 (이름, 내용, 물질화 경로).
     */
    private record BatchFile(String name, String content, Path path) {
    }
}

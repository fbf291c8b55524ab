package com.ryuqq.testops.adapter.runner;

import com.ryuqq.testops.application.batch.BatchConfig;
import com.ryuqq.testops.application.batch.BatchHandle;
import com.ryuqq.testops.application.batch.BatchStatus;
import com.ryuqq.testops.application.run.RunTracker;
import com.ryuqq.testops.application.run.RunTrackerConfig;
import com.ryuqq.testops.core.executor.BrowserOptions;
import com.ryuqq.testops.core.executor.BrowserSuiteRunner;
import com.ryuqq.testops.core.executor.CodeExecutor;
import com.ryuqq.testops.core.executor.ExecutionResult;
import com.ryuqq.testops.core.model.FileNode;
import com.ryuqq.testops.core.model.LogEntry;
import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.model.ResultStatus;
import com.ryuqq.testops.core.model.Run;
import com.ryuqq.testops.core.model.RunSource;
import com.ryuqq.testops.core.model.TestResult;
import com.ryuqq.testops.core.statemachine.RunStatus;
import com.ryuqq.testops.testkit.executor.RecordingCodeExecutor;
import com.ryuqq.testops.testkit.store.InMemoryDocumentStore;
import com.ryuqq.testops.testkit.store.InMemoryProjectRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * BatchRunner 테스트.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BatchRunnerTest {

    private static final String PROJECT = "p1";

    @TempDir
    Path scratchRoot;

    @Mock
    private BrowserSuiteRunner browserRunner;

    @Mock
    private CodeExecutor mockExecutor;

    private InMemoryDocumentStore store;
    private RunTracker tracker;
    private RecordingCodeExecutor codeExecutor;
    private BatchRunner runner;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        tracker = new RunTracker(store, new InMemoryProjectRegistry(), new RunTrackerConfig());
        codeExecutor = new RecordingCodeExecutor();
        runner = newRunner(codeExecutor);
    }

    @AfterEach
    void tearDown() {
        runner.close();
        store.close();
    }

    // ========== 정상 실행 ==========

    @Test
    void 두_파일_배치는_COMPLETED와_파일별_결과를_기록() throws Exception {
        // given
        saveFiles(
            FileNode.folder("dir", "tests", null),
            FileNode.file("a", "a.py", "dir", "print('ok')"),
            FileNode.file("b", "B.java", "dir", "public class B {}"));

        // when
        BatchHandle handle = runner.executeBatch(PROJECT, List.of("a", "b"), new BatchConfig());

        // then
        assertThat(handle.getStatus()).isEqualTo(BatchStatus.STARTED);
        assertThat(handle.getMessage()).isEqualTo("Batch execution started.");
        assertThat(handle.getCompletion().get(5, TimeUnit.SECONDS)).isEqualTo(RunStatus.COMPLETED);

        Run run = persistedRun(handle.getRunId());
        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getEndTime()).isNotNull();
        assertThat(run.getResults()).extracting(TestResult::file).containsExactly("B.java", "a.py");
        assertThat(run.getResults()).allMatch(TestResult::isPassed);
        assertThat(run.getLogs()).extracting(LogEntry::message)
            .contains("[BatchRunner] Breakdown: 1 Java, 1 Python, 0 Playwright",
                "Executing Python: a.py", "Finished Java: B.java (PASS)");
        assertThat(codeExecutor.invocations()).extracting(RecordingCodeExecutor.Invocation::language)
            .containsExactlyInAnyOrder("java", "python");
        verifyNoInteractions(browserRunner);
        assertThat(Files.exists(scratchRoot.resolve(handle.getRunId()))).isFalse();
    }

    @Test
    void 파일_실패와_예외는_해당_파일의_FAILED_결과가_됨() throws Exception {
        // given
        codeExecutor.respond("python", ExecutionResult.of(1, List.of("AssertionError")));
        codeExecutor.failOn("java", new IllegalStateException("javac not found"));
        saveFiles(
            FileNode.file("a", "a.py", null, "assert False"),
            FileNode.file("b", "B.java", null, "public class B {}"));

        // when
        BatchHandle handle = runner.executeBatch(PROJECT, List.of("a", "b"), null);

        // then
        assertThat(handle.getCompletion().get(5, TimeUnit.SECONDS)).isEqualTo(RunStatus.COMPLETED);
        Run run = persistedRun(handle.getRunId());
        assertThat(run.getResults()).hasSize(2).noneMatch(TestResult::isPassed);
        TestResult java = run.getResults().get(0);
        assertThat(java.error()).isEqualTo("javac not found");
        TestResult python = run.getResults().get(1);
        assertThat(python.status()).isEqualTo(ResultStatus.FAILED);
        assertThat(python.logs()).containsExactly("AssertionError");
    }

    @Test
    void 브라우저_버킷은_다른_버킷이_끝난_뒤_한_번만_실행됨() throws Exception {
        // given
        codeExecutor.withDelay(100);
        saveFiles(
            FileNode.folder("dir", "e2e", null),
            FileNode.file("j", "Smoke.java", null, "public class Smoke {}"),
            FileNode.file("t1", "login.spec.ts", "dir", "test('login')"),
            FileNode.file("t2", "cart.spec.js", "dir", "test('cart')"));
        AtomicInteger executedBeforeBrowser = new AtomicInteger(-1);
        when(browserRunner.run(anyList(), any(BrowserOptions.class), any(Path.class))).thenAnswer(invocation -> {
            executedBeforeBrowser.set(codeExecutor.invocationCount());
            List<Path> files = invocation.getArgument(0);
            assertThat(files).allMatch(Files::exists);
            return ExecutionResult.of(1, List.of("1 failed"));
        });
        BatchConfig config = new BatchConfig().withBrowser("firefox", false).withEnvironment("staging");

        // when
        BatchHandle handle = runner.executeBatch(PROJECT, List.of("t1", "j", "t2"), config);

        // then
        assertThat(handle.getCompletion().get(5, TimeUnit.SECONDS)).isEqualTo(RunStatus.COMPLETED);
        assertThat(executedBeforeBrowser.get()).isEqualTo(1);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Path>> files = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<Path> workDir = ArgumentCaptor.forClass(Path.class);
        verify(browserRunner).run(files.capture(), any(BrowserOptions.class), workDir.capture());
        assertThat(files.getValue()).hasSize(2);
        assertThat(files.getValue().get(0).endsWith(Path.of("e2e", "login.spec.ts"))).isTrue();
        assertThat(workDir.getValue().getFileName().toString()).isEqualTo(handle.getRunId());
        verify(browserRunner).run(anyList(), eq(new BrowserOptions("firefox", false, "staging")), any(Path.class));

        Run run = persistedRun(handle.getRunId());
        assertThat(run.getResults()).extracting(TestResult::file)
            .containsExactly("Smoke.java", "login.spec.ts", "cart.spec.js");
        assertThat(run.getResults().subList(1, 3)).allMatch(result -> result.status() == ResultStatus.FAILED);
        assertThat(run.getLogs()).extracting(LogEntry::message)
            .contains("[BatchRunner] Playwright finished with code 1");
    }

    @Test
    void 브라우저_실행기_예외는_브라우저_파일의_실패_결과가_됨() throws Exception {
        saveFiles(FileNode.file("t1", "login.spec.ts", null, "test('login')"));
        when(browserRunner.run(anyList(), any(BrowserOptions.class), any(Path.class)))
            .thenThrow(new IllegalStateException("npx not found"));

        BatchHandle handle = runner.executeBatch(PROJECT, List.of("t1"), new BatchConfig());

        assertThat(handle.getCompletion().get(5, TimeUnit.SECONDS)).isEqualTo(RunStatus.COMPLETED);
        Run run = persistedRun(handle.getRunId());
        assertThat(run.getResults()).singleElement()
            .satisfies(result -> assertThat(result.error()).isEqualTo("npx not found"));
    }

    @Test
    void Run에는_실행_설정과_발생_주체가_기록됨() throws Exception {
        saveFiles(FileNode.file("a", "a.py", null, "print(1)"));
        BatchConfig config = new BatchConfig()
            .withSource(RunSource.SCHEDULER)
            .withTriggeredBy("scheduler")
            .withScheduleId("sch-1");

        BatchHandle handle = runner.executeBatch(PROJECT, List.of("a"), config);
        handle.getCompletion().get(5, TimeUnit.SECONDS);

        Run run = persistedRun(handle.getRunId());
        assertThat(run.getSource()).isEqualTo(RunSource.SCHEDULER);
        assertThat(run.getTriggeredBy()).isEqualTo("scheduler");
        assertThat(run.getMeta().get("scheduleId").asText()).isEqualTo("sch-1");
        assertThat(run.getFiles()).containsExactly("a");
    }

    // ========== 동기 실패 ==========

    @Test
    void 파일이_없는_프로젝트는_실행기_호출_없이_즉시_실패() throws Exception {
        // given
        runner.close();
        runner = newRunner(mockExecutor);

        // when
        BatchHandle handle = runner.executeBatch(PROJECT, List.of("a"), new BatchConfig());

        // then
        assertThat(handle.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(handle.getMessage()).isEqualTo("No files in project");
        assertThat(persistedRun(handle.getRunId()).getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(persistedRun(handle.getRunId()).getEndTime()).isNotNull();
        verifyNoInteractions(mockExecutor, browserRunner);
    }

    @Test
    void 실행_가능한_파일이_없으면_즉시_실패() throws Exception {
        // given
        runner.close();
        runner = newRunner(mockExecutor);
        saveFiles(
            FileNode.folder("dir", "docs", null),
            FileNode.file("md", "README.md", "dir", "# readme"));

        // when
        BatchHandle handle = runner.executeBatch(PROJECT, List.of("dir", "md", "missing"), new BatchConfig());

        // then
        assertThat(handle.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(handle.getMessage()).isEqualTo("No valid test files selected");
        assertThat(handle.getCompletion().get(1, TimeUnit.SECONDS)).isEqualTo(RunStatus.FAILED);
        assertThat(persistedRun(handle.getRunId()).getStatus()).isEqualTo(RunStatus.FAILED);
        verifyNoInteractions(mockExecutor, browserRunner);
    }

    @Test
    void projectId가_비어있으면_예외() {
        assertThatThrownBy(() -> runner.executeBatch(" ", List.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private BatchRunner newRunner(CodeExecutor executor) {
        return new BatchRunner(store, tracker, executor, browserRunner,
            new BatchRunnerConfig().withScratchRoot(scratchRoot).withConcurrency(4));
    }

    private void saveFiles(FileNode... nodes) throws Exception {
        ProjectDocument document = ProjectDocument.empty();
        document.getFiles().addAll(List.of(nodes));
        store.write(PROJECT, document).get(5, TimeUnit.SECONDS);
    }

    private Run persistedRun(String runId) throws Exception {
        return store.read(PROJECT).get(5, TimeUnit.SECONDS).findRun(runId).orElseThrow();
    }
}

package com.ryuqq.testops.adapter.runner;

import com.ryuqq.testops.core.executor.BrowserOptions;
import com.ryuqq.testops.core.executor.ExecutionResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PlaywrightSuiteRunner 명령/환경 구성 테스트.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
class PlaywrightSuiteRunnerTest {

    private final Path workDir = Path.of("scratch", "run-1");
    private final List<Path> files = List.of(workDir.resolve("a.spec.ts"), workDir.resolve("b.spec.ts"));

    @Test
    void headless_기본_명령() {
        List<String> command = PlaywrightSuiteRunner.command(files, new BrowserOptions());

        assertThat(command).containsExactly("npx", "playwright", "test",
            files.get(0).toString(), files.get(1).toString(), "--browser=chromium", "--reporter=json");
    }

    @Test
    void headed_firefox_명령() {
        List<String> command = PlaywrightSuiteRunner.command(files, new BrowserOptions("firefox", false, "staging"));

        assertThat(command).contains("--headed", "--browser=firefox");
    }

    @Test
    void 브라우저_이름_매핑() {
        assertThat(PlaywrightSuiteRunner.browserProject("chrome")).isEqualTo("chromium");
        assertThat(PlaywrightSuiteRunner.browserProject("FIREFOX")).isEqualTo("firefox");
        assertThat(PlaywrightSuiteRunner.browserProject("edge")).isEqualTo("webkit");
        assertThat(PlaywrightSuiteRunner.browserProject("opera")).isEqualTo("chromium");
    }

    @Test
    void 환경_변수_구성() {
        Map<String, String> local = PlaywrightSuiteRunner.environment(new BrowserOptions(), workDir);
        Map<String, String> prod = PlaywrightSuiteRunner.environment(new BrowserOptions("chrome", true, "prod"), workDir);

        assertThat(local).containsEntry("CI", "true")
            .containsEntry("TEST_ENV", "local")
            .containsEntry("BASE_URL", "http://localhost:3000")
            .containsEntry("PLAYWRIGHT_JSON_OUTPUT_NAME", workDir.resolve("report.json").toString());
        assertThat(prod).containsEntry("BASE_URL", "https://production.com")
            .containsEntry("TEST_ENV", "prod");
    }

    @Test
    void run은_작업_디렉터리에서_프로세스를_실행() {
        ProcessRunner processRunner = mock(ProcessRunner.class);
        when(processRunner.run(anyList(), eq(workDir), anyMap(), anyLong()))
            .thenReturn(ExecutionResult.of(0, List.of("ok")));
        PlaywrightSuiteRunner runner = new PlaywrightSuiteRunner(1000, processRunner);

        ExecutionResult result = runner.run(files, null, workDir);

        assertThat(result.isSuccess()).isTrue();
        verify(processRunner).run(eq(PlaywrightSuiteRunner.command(files, new BrowserOptions())),
            eq(workDir), anyMap(), eq(1000L));
    }

    @Test
    void 파일이_없으면_예외() {
        PlaywrightSuiteRunner runner = new PlaywrightSuiteRunner();

        assertThatThrownBy(() -> runner.run(List.of(), new BrowserOptions(), workDir))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.ryuqq.testops.adapter.runner;

import com.ryuqq.testops.core.executor.ExecutionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ProcessCodeExecutor 테스트. 실제 프로세스 대신 ProcessRunner를 mock으로 대체합니다.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
class ProcessCodeExecutorTest {

    @TempDir
    Path workDir;

    private final ProcessRunner processRunner = mock(ProcessRunner.class);

    private ProcessCodeExecutor executor() {
        return new ProcessCodeExecutor(new CodeExecutorConfig().withWorkDir(workDir).withTimeoutMs(5000), processRunner);
    }

    @Test
    void python은_설정된_명령으로_실행하고_작업_파일을_삭제() throws Exception {
        when(processRunner.run(anyList(), any(Path.class), anyMap(), anyLong()))
            .thenReturn(ExecutionResult.of(0, List.of("hello")));

        ExecutionResult result = executor().execute("print('hello')", "Python");

        assertThat(result.output()).containsExactly("hello");
        verify(processRunner).run(argThat(command -> command.get(0).equals("python")
            && command.get(1).endsWith(".py")), any(Path.class), anyMap(), eq(5000L));
        try (Stream<Path> leftovers = Files.list(workDir)) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    void java_컴파일_실패시_실행하지_않음() {
        when(processRunner.run(argThat(command -> command.get(0).equals("javac")), any(Path.class), anyMap(), anyLong()))
            .thenReturn(ExecutionResult.of(1, List.of("[Details] error: ';' expected")));

        ExecutionResult result = executor().execute("public class Broken { int x }", "java");

        assertThat(result.exitCode()).isEqualTo(1);
        verify(processRunner, never()).run(argThat(command -> command.get(0).equals("java")),
            any(Path.class), anyMap(), anyLong());
    }

    @Test
    void Test_애너테이션이_있으면_TestNG로_실행() {
        when(processRunner.run(anyList(), any(Path.class), anyMap(), anyLong()))
            .thenReturn(ExecutionResult.of(0, List.of()));

        executor().execute("package a.b;\nimport org.testng.annotations.Test;\npublic class LoginTest { @Test public void t() {} }",
            "java");

        verify(processRunner).run(argThat(command -> command.get(0).equals("java")
            && command.contains("org.testng.TestNG") && command.get(command.size() - 1).equals("LoginTest")),
            any(Path.class), anyMap(), anyLong());
    }

    @Test
    void 지원하지_않는_언어는_예외() {
        assertThatThrownBy(() -> executor().execute("puts 1", "ruby"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported language");
    }

    @Test
    void 소스_전처리_규칙() {
        assertThat(ProcessCodeExecutor.javaClassName("public class Checkout {}")).isEqualTo("Checkout");
        assertThat(ProcessCodeExecutor.javaClassName("class Hidden {}")).startsWith("Main_");
        assertThat(ProcessCodeExecutor.stripPackage("package com.shop;\npublic class A {}"))
            .doesNotContain("package com.shop;")
            .contains("public class A {}");
        assertThat(ProcessCodeExecutor.isMochaSuite("describe('cart', () => {})")).isTrue();
        assertThat(ProcessCodeExecutor.isMochaSuite("console.log(1)")).isFalse();
    }
}

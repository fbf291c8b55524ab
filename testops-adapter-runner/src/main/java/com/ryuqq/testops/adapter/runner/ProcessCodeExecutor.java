package com.ryuqq.testops.adapter.runner;

import com.ryuqq.testops.core.executor.CodeExecutor;
import com.ryuqq.testops.core.executor.ExecutionResult;
import com.ryuqq.testops.core.model.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 로컬 프로세스로 코드를 실행하는 CodeExecutor.
 *
 * <p><strong>언어별 실행:</strong></p>
 * <ul>
 *   <li><strong>python:</strong> {@code <pythonCommand> <id>.py}</li>
 *   <li><strong>java:</strong> package 선언 제거 후 {@code javac}, 이어서 {@code java} 실행.
 *       소스에 {@code @Test}가 있으면 TestNG 러너로 실행</li>
 *   <li><strong>javascript / typescript:</strong> {@code describe(} 또는 {@code it(}가 있으면
 *       {@code npx mocha}, 아니면 {@code npx tsx}</li>
 * </ul>
 *
 * <p>호출마다 작업 디렉터리 아래에 전용 디렉터리를 만들고, 실행 후 삭제합니다.
 * 제한 시간을 넘긴 실행은 종료 코드 -1로 보고됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class ProcessCodeExecutor implements CodeExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessCodeExecutor.class);

    private static final Pattern PUBLIC_CLASS = Pattern.compile("public\\s+class\\s+(\\w+)");
    private static final Pattern PACKAGE_DECLARATION = Pattern.compile("^\\s*package\\s+[\\w.]+;", Pattern.MULTILINE);

    private final CodeExecutorConfig config;
    private final ProcessRunner processRunner;

    public ProcessCodeExecutor(CodeExecutorConfig config) {
        this(config, new ProcessRunner());
    }

    ProcessCodeExecutor(CodeExecutorConfig config, ProcessRunner processRunner) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.processRunner = processRunner;
    }

    @Override
    public ExecutionResult execute(String content, String language) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language cannot be null or blank");
        }
        String normalized = language.toLowerCase(Locale.ROOT);
        if (!isSupported(normalized)) {
            throw new IllegalArgumentException("Unsupported language: " + language);
        }

        Path invocationDir = config.workDir().toAbsolutePath().resolve(Ids.shortId());
        try {
            Files.createDirectories(invocationDir);
            log.debug("Executing {} code in {}", normalized, invocationDir);
            return switch (normalized) {
                case "python" -> runPython(content, invocationDir);
                case "java" -> runJava(content, invocationDir);
                default -> runScript(content, invocationDir);
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prepare " + normalized + " source", e);
        } finally {
            deleteQuietly(invocationDir);
        }
    }

    /**
     * 출력 수집 스레드 풀 종료.
     */
    @Override
    public void close() {
        processRunner.close();
    }

    static boolean isSupported(String language) {
        return "python".equals(language) || "java".equals(language)
            || "javascript".equals(language) || "typescript".equals(language);
    }

    /**
     * public class 이름 추출. 없으면 생성된 이름.
     */
    static String javaClassName(String content) {
        Matcher matcher = PUBLIC_CLASS.matcher(content);
        return matcher.find() ? matcher.group(1) : "Main_" + Ids.shortId();
    }

    static String stripPackage(String content) {
        return PACKAGE_DECLARATION.matcher(content).replaceFirst("// package stripped by runner");
    }

    static boolean isMochaSuite(String content) {
        return content.contains("describe(") || content.contains("it(");
    }

    private ExecutionResult runPython(String content, Path dir) throws IOException {
        Path file = write(dir, Ids.shortId() + ".py", content);
        return processRunner.run(List.of(config.pythonCommand(), file.toString()), dir, Map.of(), config.timeoutMs());
    }

    private ExecutionResult runJava(String content, Path dir) throws IOException {
        String className = javaClassName(content);
        Path source = write(dir, className + ".java", stripPackage(content));
        String classPath = config.javaLibDir().toAbsolutePath().resolve("*") + File.pathSeparator + "."
            + File.pathSeparator + dir;

        long deadline = System.currentTimeMillis() + config.timeoutMs();
        ExecutionResult compiled = processRunner.run(
            List.of("javac", "-cp", classPath, source.toString()), dir, Map.of(), config.timeoutMs());
        if (!compiled.isSuccess()) {
            return compiled;
        }

        List<String> command = new ArrayList<>(List.of("java", "-cp", classPath));
        if (content.contains("@Test")) {
            command.addAll(List.of("org.testng.TestNG", "-testclass", className));
        } else {
            command.add(className);
        }
        long remaining = Math.max(1, deadline - System.currentTimeMillis());
        ExecutionResult executed = processRunner.run(command, dir, Map.of(), remaining);

        List<String> output = new ArrayList<>(compiled.output());
        output.addAll(executed.output());
        return new ExecutionResult(executed.exitCode(), output, executed.timedOut());
    }

    private ExecutionResult runScript(String content, Path dir) throws IOException {
        Path file = write(dir, Ids.shortId() + ".ts", content);
        List<String> command = isMochaSuite(content)
            ? List.of("npx", "mocha", file.toString(), "--timeout", "60000", "--require", "tsx")
            : List.of("npx", "tsx", file.toString());
        return processRunner.run(command, dir, Map.of(), config.timeoutMs());
    }

    private static Path write(Path dir, String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
    }

    static void deleteQuietly(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to clean up directory: {}", dir, e);
        }
    }
}

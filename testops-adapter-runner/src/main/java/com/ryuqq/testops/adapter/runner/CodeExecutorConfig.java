package com.ryuqq.testops.adapter.runner;

import java.nio.file.Path;

/**
 * ProcessCodeExecutor 설정 (불변 record).
 *
 * @author TestOps Team
 * @since 1.0.0
 * @param workDir 실행 파일을 쓰는 작업 디렉터리 (기본: ./temp_execution)
 * @param timeoutMs 실행 제한 시간 (기본: 120000)
 * @param pythonCommand python 실행 명령 (기본: python)
 * @param javaLibDir Java 실행 시 classpath에 추가할 jar 디렉터리 (기본: ./lib/java)
 */
public record CodeExecutorConfig(
    Path workDir,
    long timeoutMs,
    String pythonCommand,
    Path javaLibDir
) {

    public CodeExecutorConfig() {
        this(Path.of("temp_execution"), 120_000, "python", Path.of("lib", "java"));
    }

    public CodeExecutorConfig {
        if (workDir == null) {
            throw new IllegalArgumentException("workDir cannot be null");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
        if (pythonCommand == null || pythonCommand.isBlank()) {
            throw new IllegalArgumentException("pythonCommand cannot be null or blank");
        }
        if (javaLibDir == null) {
            throw new IllegalArgumentException("javaLibDir cannot be null");
        }
    }

    public CodeExecutorConfig withWorkDir(Path workDir) {
        return new CodeExecutorConfig(workDir, timeoutMs, pythonCommand, javaLibDir);
    }

    public CodeExecutorConfig withTimeoutMs(long timeoutMs) {
        return new CodeExecutorConfig(workDir, timeoutMs, pythonCommand, javaLibDir);
    }

    public CodeExecutorConfig withPythonCommand(String pythonCommand) {
        return new CodeExecutorConfig(workDir, timeoutMs, pythonCommand, javaLibDir);
    }

    public CodeExecutorConfig withJavaLibDir(Path javaLibDir) {
        return new CodeExecutorConfig(workDir, timeoutMs, pythonCommand, javaLibDir);
    }
}

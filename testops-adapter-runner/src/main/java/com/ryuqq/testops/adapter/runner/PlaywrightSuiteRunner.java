package com.ryuqq.testops.adapter.runner;

import com.ryuqq.testops.core.executor.BrowserOptions;
import com.ryuqq.testops.core.executor.BrowserSuiteRunner;
import com.ryuqq.testops.core.executor.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code npx playwright test}로 브라우저 스위트를 실행하는 BrowserSuiteRunner.
 *
 * <p><strong>명령:</strong></p>
 * <pre>
 * npx playwright test &lt;files...&gt; [--headed] --browser=&lt;project&gt; --reporter=json
 * </pre>
 *
 * <p><strong>환경 변수:</strong> CI=true, PLAYWRIGHT_JSON_OUTPUT_NAME=&lt;workDir&gt;/report.json,
 * TEST_ENV=&lt;environment&gt;, BASE_URL (prod이면 https://production.com, 그 외 http://localhost:3000)</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class PlaywrightSuiteRunner implements BrowserSuiteRunner, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightSuiteRunner.class);

    public static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    static final String REPORT_FILE = "report.json";

    private final long timeoutMs;
    private final ProcessRunner processRunner;

    public PlaywrightSuiteRunner() {
        this(DEFAULT_TIMEOUT_MS);
    }

    public PlaywrightSuiteRunner(long timeoutMs) {
        this(timeoutMs, new ProcessRunner());
    }

    PlaywrightSuiteRunner(long timeoutMs, ProcessRunner processRunner) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        this.timeoutMs = timeoutMs;
        this.processRunner = processRunner;
    }

    @Override
    public ExecutionResult run(List<Path> files, BrowserOptions options, Path workDir) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("files cannot be null or empty");
        }
        if (workDir == null) {
            throw new IllegalArgumentException("workDir cannot be null");
        }
        BrowserOptions effective = options == null ? new BrowserOptions() : options;
        List<String> command = command(files, effective);
        log.info("Playwright command: {} | env={}", String.join(" ", command), effective.environment());
        ExecutionResult result = processRunner.run(command, workDir, environment(effective, workDir), timeoutMs);
        log.info("Playwright finished with code {}", result.exitCode());
        return result;
    }

    /**
     * 출력 수집 스레드 풀 종료.
     */
    @Override
    public void close() {
        processRunner.close();
    }

    static List<String> command(List<Path> files, BrowserOptions options) {
        List<String> command = new ArrayList<>(List.of("npx", "playwright", "test"));
        for (Path file : files) {
            command.add(file.toString());
        }
        if (!options.headless()) {
            command.add("--headed");
        }
        command.add("--browser=" + browserProject(options.browser()));
        command.add("--reporter=json");
        return command;
    }

    static Map<String, String> environment(BrowserOptions options, Path workDir) {
        Map<String, String> environment = new LinkedHashMap<>();
        environment.put("CI", "true");
        environment.put("PLAYWRIGHT_JSON_OUTPUT_NAME", workDir.resolve(REPORT_FILE).toString());
        environment.put("TEST_ENV", options.environment());
        environment.put("BASE_URL", "prod".equals(options.environment())
            ? "https://production.com"
            : "http://localhost:3000");
        return environment;
    }

    /**
     * 브라우저 이름을 Playwright 브라우저로 변환. 알 수 없는 이름은 chromium.
     */
    static String browserProject(String browser) {
        if (browser == null) {
            return "chromium";
        }
        return switch (browser.toLowerCase(Locale.ROOT)) {
            case "firefox" -> "firefox";
            case "edge" -> "webkit";
            default -> "chromium";
        };
    }
}

package com.ryuqq.testops.core.executor;

/**
 * 브라우저 스위트 실행 옵션.
 *
 * @param browser 브라우저 이름 ("chrome", "firefox", "edge" 등, null이면 기본값)
 * @param headless headless 모드 여부
 * @param environment 대상 환경 ("local", "staging", "prod" 등)
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public record BrowserOptions(
    String browser,
    boolean headless,
    String environment
) {

    public static final String DEFAULT_BROWSER = "chrome";
    public static final String DEFAULT_ENVIRONMENT = "local";

    public BrowserOptions {
        if (browser == null || browser.isBlank()) {
            browser = DEFAULT_BROWSER;
        }
        if (environment == null || environment.isBlank()) {
            environment = DEFAULT_ENVIRONMENT;
        }
    }

    /**
     * 기본 옵션: chrome, headless, local.
     */
    public BrowserOptions() {
        this(DEFAULT_BROWSER, true, DEFAULT_ENVIRONMENT);
    }
}

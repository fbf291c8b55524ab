package com.ryuqq.testops.application.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.testops.core.executor.BrowserOptions;
import com.ryuqq.testops.core.model.RunSource;

/**
 * 배치 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>browser / headless / environment: 브라우저 스위트 실행 옵션</li>
 *   <li>source: Run 발생 주체 (기본 BATCH)</li>
 *   <li>triggeredBy: 실행 요청자 (기본 "user")</li>
 *   <li>scheduleId: 스케줄에 의해 실행된 경우 스케줄 ID</li>
 *   <li>name: 표시용 이름 (스케줄 이름 등)</li>
 * </ul>
 *
 * <p>Suite의 기본 설정({@code config} JSON)에서 읽어 올 수 있고, Run의 {@code meta}로 기록됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 * @param browser 브라우저 이름 (null이면 chrome)
 * @param headless headless 여부
 * @param environment 대상 환경 (null이면 local)
 * @param source Run 발생 주체
 * @param triggeredBy 실행 요청자
 * @param scheduleId 스케줄 ID (null 허용)
 * @param name 표시용 이름 (null 허용)
 */
public record BatchConfig(
    String browser,
    boolean headless,
    String environment,
    RunSource source,
    String triggeredBy,
    String scheduleId,
    String name
) {

    public static final String DEFAULT_TRIGGERED_BY = "user";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: chrome, headless, local, BATCH, "user"</p>
     */
    public BatchConfig() {
        this(BrowserOptions.DEFAULT_BROWSER, true, BrowserOptions.DEFAULT_ENVIRONMENT,
            RunSource.BATCH, DEFAULT_TRIGGERED_BY, null, null);
    }

    /**
     * Compact constructor (기본값 보정).
     */
    public BatchConfig {
        if (browser == null || browser.isBlank()) {
            browser = BrowserOptions.DEFAULT_BROWSER;
        }
        if (environment == null || environment.isBlank()) {
            environment = BrowserOptions.DEFAULT_ENVIRONMENT;
        }
        if (source == null) {
            source = RunSource.BATCH;
        }
        if (triggeredBy == null || triggeredBy.isBlank()) {
            triggeredBy = DEFAULT_TRIGGERED_BY;
        }
    }

    /**
     * Suite 설정 JSON에서 생성. 없는 키는 기본값을 사용합니다.
     *
     * @param json Suite config (null 허용)
     * @return BatchConfig
     */
    public static BatchConfig fromJson(JsonNode json) {
        BatchConfig defaults = new BatchConfig();
        if (json == null || !json.isObject()) {
            return defaults;
        }
        return new BatchConfig(
            text(json, "browser", defaults.browser()),
            json.path("headless").asBoolean(defaults.headless()),
            text(json, "environment", defaults.environment()),
            defaults.source(),
            text(json, "triggeredBy", defaults.triggeredBy()),
            text(json, "scheduleId", null),
            text(json, "name", null)
        );
    }

    /**
     * Run meta로 기록할 JSON.
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("browser", browser);
        node.put("headless", headless);
        node.put("environment", environment);
        node.put("triggeredBy", triggeredBy);
        if (scheduleId != null) {
            node.put("scheduleId", scheduleId);
        }
        if (name != null) {
            node.put("name", name);
        }
        return node;
    }

    public BrowserOptions browserOptions() {
        return new BrowserOptions(browser, headless, environment);
    }

    public BatchConfig withSource(RunSource source) {
        return new BatchConfig(browser, headless, environment, source, triggeredBy, scheduleId, name);
    }

    public BatchConfig withTriggeredBy(String triggeredBy) {
        return new BatchConfig(browser, headless, environment, source, triggeredBy, scheduleId, name);
    }

    public BatchConfig withScheduleId(String scheduleId) {
        return new BatchConfig(browser, headless, environment, source, triggeredBy, scheduleId, name);
    }

    public BatchConfig withName(String name) {
        return new BatchConfig(browser, headless, environment, source, triggeredBy, scheduleId, name);
    }

    public BatchConfig withBrowser(String browser, boolean headless) {
        return new BatchConfig(browser, headless, environment, source, triggeredBy, scheduleId, name);
    }

    public BatchConfig withEnvironment(String environment) {
        return new BatchConfig(browser, headless, environment, source, triggeredBy, scheduleId, name);
    }

    private static String text(JsonNode json, String field, String fallback) {
        JsonNode value = json.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : fallback;
    }
}

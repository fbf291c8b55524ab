package com.ryuqq.testops.application.run;

/**
 * RunTracker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>retentionCap: 프로젝트당 보관할 최대 Run 수 (기본 100). 초과분은 가장 오래된 것부터 제거</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 * @param retentionCap 최대 보관 Run 수 (1 이상)
 */
public record RunTrackerConfig(int retentionCap) {

    public static final int DEFAULT_RETENTION_CAP = 100;

    /**
     * 기본 설정 생성자. retentionCap=100
     */
    public RunTrackerConfig() {
        this(DEFAULT_RETENTION_CAP);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException retentionCap이 1 미만인 경우
     */
    public RunTrackerConfig {
        if (retentionCap <= 0) {
            throw new IllegalArgumentException(
                "retentionCap must be positive (current: " + retentionCap + ")"
            );
        }
    }

    public RunTrackerConfig withRetentionCap(int retentionCap) {
        return new RunTrackerConfig(retentionCap);
    }
}

package com.ryuqq.testops.adapter.runner;

import java.time.ZoneId;

/**
 * CronJobScheduler 설정 (불변 record).
 *
 * @author TestOps Team
 * @since 1.0.0
 * @param poolSize tick 실행 스레드 수 (기본: 2)
 * @param zoneId cron 해석 시간대 (기본: 시스템 시간대)
 */
public record SchedulerConfig(
    int poolSize,
    ZoneId zoneId
) {

    public SchedulerConfig() {
        this(2, ZoneId.systemDefault());
    }

    public SchedulerConfig {
        if (poolSize <= 0) {
            throw new IllegalArgumentException(
                "poolSize must be positive (current: " + poolSize + ")"
            );
        }
        if (zoneId == null) {
            throw new IllegalArgumentException("zoneId cannot be null");
        }
    }

    public SchedulerConfig withPoolSize(int poolSize) {
        return new SchedulerConfig(poolSize, zoneId);
    }

    public SchedulerConfig withZoneId(ZoneId zoneId) {
        return new SchedulerConfig(poolSize, zoneId);
    }
}

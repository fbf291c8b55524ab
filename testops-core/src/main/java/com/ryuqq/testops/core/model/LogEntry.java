package com.ryuqq.testops.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Run 로그 한 줄.
 *
 * <p>Append-only 입니다. {@code sequence}는 Run 안에서 append 순서대로 1부터 증가하며,
 * 영속 로그와 메모리 버퍼 로그를 병합할 때 중복 제거 기준으로 사용됩니다.</p>
 *
 * @param timestamp 기록 시각
 * @param level 심각도
 * @param message 메시지
 * @param metadata 구조화된 부가 정보 (null 허용)
 * @param sequence Run 내 append 순번 (구버전 문서는 0)
 *
 * @author TestOps Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntry(
    Instant timestamp,
    LogLevel level,
    String message,
    JsonNode metadata,
    long sequence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null인 경우
     */
    public LogEntry {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (level == null) {
            level = LogLevel.INFO;
        }
    }

    /**
     * 현재 시각으로 LogEntry 생성.
     *
     * @param level 심각도
     * @param message 메시지
     * @param sequence 순번
     * @return LogEntry 인스턴스
     */
    public static LogEntry now(LogLevel level, String message, long sequence) {
        return new LogEntry(Instant.now(), level, message, null, sequence);
    }
}

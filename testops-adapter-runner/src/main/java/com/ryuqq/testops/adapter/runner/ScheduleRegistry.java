package com.ryuqq.testops.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 살아 있는 스케줄 타이머 핸들 저장소.
 *
 * <p>스케줄 ID당 최대 하나의 핸들을 유지합니다. 이미 핸들이 있는 ID를 다시 등록하면 이전 핸들을
 * 먼저 취소합니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class ScheduleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScheduleRegistry.class);

    private final Map<String, ScheduledFuture<?>> handles = new ConcurrentHashMap<>();

    public void register(String scheduleId, ScheduledFuture<?> handle) {
        if (scheduleId == null || scheduleId.isBlank()) {
            throw new IllegalArgumentException("scheduleId cannot be null or blank");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        ScheduledFuture<?> previous = handles.put(scheduleId, handle);
        if (previous != null && previous != handle) {
            previous.cancel(false);
            log.debug("Replaced schedule handle: scheduleId={}", scheduleId);
        }
    }

    /**
     * 핸들 취소 및 제거.
     *
     * @return 핸들이 있었으면 true
     */
    public boolean unregister(String scheduleId) {
        if (scheduleId == null) {
            return false;
        }
        ScheduledFuture<?> handle = handles.remove(scheduleId);
        if (handle == null) {
            return false;
        }
        handle.cancel(false);
        return true;
    }

    public boolean contains(String scheduleId) {
        return scheduleId != null && handles.containsKey(scheduleId);
    }

    /**
     * 등록된 스케줄 ID 목록 (정렬됨).
     */
    public Set<String> list() {
        return new TreeSet<>(handles.keySet());
    }

    public int size() {
        return handles.size();
    }

    /**
     * 모든 핸들 취소.
     *
     * @return 취소한 핸들 수
     */
    public int cancelAll() {
        int cancelled = 0;
        for (String scheduleId : list()) {
            if (unregister(scheduleId)) {
                cancelled++;
            }
        }
        return cancelled;
    }
}

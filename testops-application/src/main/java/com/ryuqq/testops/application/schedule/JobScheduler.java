package com.ryuqq.testops.application.schedule;

import com.ryuqq.testops.core.model.Schedule;

import java.util.List;

/**
 * Cron 기반 스케줄 관리 계약.
 *
 * <p>스케줄은 프로젝트 문서의 {@code schedules} 컬렉션에 영속화되고, 활성 스케줄마다 살아 있는
 * 타이머 핸들이 하나씩 등록됩니다. 각 tick은 대상(Suite 또는 단일 파일)을 해석해 배치를 실행합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>유효하지 않은 cron 표현식은 저장도 등록도 되지 않음</li>
 *   <li>하나의 스케줄 ID에는 최대 하나의 핸들</li>
 *   <li>tick 실패는 로그로만 남고 타이머를 멈추지 않음</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public interface JobScheduler {

    /**
     * 모든 프로젝트의 활성 스케줄을 등록합니다.
     *
     * <p>cron이 잘못된 영속 스케줄은 로그를 남기고 건너뜁니다.</p>
     *
     * @return 등록된 스케줄 수
     */
    int init();

    /**
     * 스케줄 생성.
     *
     * @param projectId 프로젝트 ID
     * @param userId 생성자
     * @param targetId Suite ID 또는 파일 ID
     * @param cronExpression 5필드 또는 6필드 cron
     * @param name 이름 (null 허용)
     * @return 저장된 스케줄
     * @throws IllegalArgumentException 인자가 비었거나 cron이 유효하지 않은 경우
     */
    Schedule create(String projectId, String userId, String targetId, String cronExpression, String name);

    /**
     * 스케줄 삭제. 핸들을 먼저 취소한 뒤 영속 레코드를 제거합니다.
     *
     * @param scheduleId 스케줄 ID
     * @return 영속 레코드가 삭제되었으면 true (없는 ID면 false)
     */
    boolean delete(String scheduleId);

    /**
     * 프로젝트의 스케줄 목록.
     *
     * @param projectId 프로젝트 ID
     * @param userId 요청자
     * @return 스케줄 목록 (저장 순서)
     */
    List<Schedule> list(String projectId, String userId);

    /**
     * 스케줄 활성/비활성 전환.
     *
     * @param scheduleId 스케줄 ID
     * @param active 활성 여부
     * @return 갱신된 스케줄
     * @throws IllegalStateException 스케줄이 없는 경우
     */
    Schedule setActive(String scheduleId, boolean active);

    /**
     * 살아 있는 모든 핸들을 취소합니다.
     */
    void shutdown();
}

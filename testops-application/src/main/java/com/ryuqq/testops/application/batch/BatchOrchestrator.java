package com.ryuqq.testops.application.batch;

import java.util.List;

/**
 * 배치 실행 오케스트레이터.
 *
 * <p>여러 파일을 실행기 종류별 버킷으로 나누어 실행하고 결과를 하나의 Run으로 집계합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. RunTracker.create → runId
 * 2. 프로젝트 가상 파일 트리 전체를 scratch 디렉터리에 물질화
 * 3. 선택된 파일을 확장자별 버킷으로 분류
 *    → 파일 없음 / 유효한 파일 없음이면 Run FAILED 후 FAILED 핸들 반환 (실행기 호출 없음)
 * 4. STARTED 핸들 반환, 이후 백그라운드:
 *    a. 비브라우저 버킷 병렬 실행 (파일별 결과, 실패는 결과로 기록)
 *    b. 브라우저 버킷은 그 뒤에 외부 프로세스 한 번으로 실행
 *    c. RunTracker.update(COMPLETED, results), 오케스트레이션 예외 시 FAILED
 * </pre>
 *
 * <p><strong>예외 정책:</strong> 백그라운드 실행 중의 예외는 호출자에게 전파되지 않고 Run 상태(FAILED)로
 * 표현됩니다. Run이 RUNNING으로 남는 일은 없습니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public interface BatchOrchestrator {

    /**
     * 배치 실행.
     *
     * <p>Run 생성과 입력 검증까지는 동기적으로 수행하고, 실행 자체는 백그라운드로 넘깁니다.</p>
     *
     * @param projectId 프로젝트 ID
     * @param fileIds 실행할 파일 ID 목록
     * @param config 실행 설정 (null이면 기본값)
     * @return 실행 핸들
     * @throws IllegalArgumentException projectId가 null/blank인 경우
     * @throws com.ryuqq.testops.core.spi.StorageException Run 생성 자체가 실패한 경우
     */
    BatchHandle executeBatch(String projectId, List<String> fileIds, BatchConfig config);
}

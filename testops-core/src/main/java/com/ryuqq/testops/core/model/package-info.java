/**
 * 도메인 모델 패키지.
 *
 * <p>프로젝트 문서({@link com.ryuqq.testops.core.model.ProjectDocument})와
 * 그 안에 저장되는 하위 엔티티들을 정의합니다.</p>
 *
 * <h2>주요 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.testops.core.model.Project} - 프로젝트 메타데이터 (불변 record)</li>
 *   <li>{@link com.ryuqq.testops.core.model.Run} - 테스트 실행 기록</li>
 *   <li>{@link com.ryuqq.testops.core.model.LogEntry} - Run 로그 (append-only)</li>
 *   <li>{@link com.ryuqq.testops.core.model.TestResult} - 파일 단위 결과</li>
 *   <li>{@link com.ryuqq.testops.core.model.Schedule} - Cron 스케줄</li>
 *   <li>{@link com.ryuqq.testops.core.model.Suite} - 파일 묶음 + 기본 설정</li>
 *   <li>{@link com.ryuqq.testops.core.model.FileNode} - 가상 파일 트리 노드</li>
 * </ul>
 *
 * <p>JSON 직렬화는 Jackson 어노테이션으로 정의되며, 기존 데이터 파일과의
 * 호환을 위해 일부 필드는 snake_case 이름을 사용합니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.core.model;

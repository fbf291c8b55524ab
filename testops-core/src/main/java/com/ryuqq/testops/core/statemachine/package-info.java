/**
 * Run 상태 머신.
 *
 * <p>{@link com.ryuqq.testops.core.statemachine.RunStatus}는 Run의 세 가지 상태를,
 * {@link com.ryuqq.testops.core.statemachine.StateTransition}은 전이 규칙을 정의합니다.</p>
 *
 * <pre>
 * RUNNING ──► COMPLETED
 *    │
 *    └─────► FAILED
 * </pre>
 *
 * <p>종료 상태(COMPLETED, FAILED)의 Run은 불변입니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.core.statemachine;

/**
 * 배치 실행 계약.
 *
 * <p>구현체는 testops-adapter-runner 모듈의 BatchRunner입니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.application.batch;

/**
 * Run 생명주기 추적.
 *
 * <ul>
 *   <li>{@link com.ryuqq.testops.application.run.RunTracker} - Run 생성/로그/업데이트/조회</li>
 *   <li>{@link com.ryuqq.testops.application.run.RunPatch} - 필드 단위 병합 업데이트</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.application.run;

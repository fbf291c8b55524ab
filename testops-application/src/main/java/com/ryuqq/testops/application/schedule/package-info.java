/**
 * 스케줄 계약과 대상 해석.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.application.schedule;

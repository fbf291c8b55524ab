/**
 * 동시성 유틸리티.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.core.concurrent;

/**
 * 가상 파일 트리.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.core.fs;

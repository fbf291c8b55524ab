/**
 * 프로젝트 메타데이터 관리.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.application.project;

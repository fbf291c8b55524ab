/**
 * 파일 시스템 저장소 어댑터.
 *
 * <p>DocumentStore와 ProjectRegistry를 JSON 파일로 구현합니다. 모든 쓰기는 임시 파일 + rename으로
 * 원자적으로 수행됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.adapter.filesystem;

/**
 * DocumentStore 구현 골격.
 *
 * <p>어댑터는 {@link com.ryuqq.testops.core.store.AbstractQueuedDocumentStore}를 상속해
 * 저장 매체 접근만 구현합니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.core.store;

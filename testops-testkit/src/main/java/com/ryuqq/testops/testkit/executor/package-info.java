/**
 * Executor test doubles.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.testkit.executor;

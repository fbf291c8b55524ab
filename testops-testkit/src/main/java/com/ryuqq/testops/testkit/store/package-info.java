/**
 * In-memory storage SPI implementations for tests.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.testkit.store;

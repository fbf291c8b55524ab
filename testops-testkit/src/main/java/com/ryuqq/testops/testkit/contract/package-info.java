/**
 * Contract tests shared by DocumentStore adapters.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.testkit.contract;

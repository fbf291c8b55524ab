/**
 * Suite 관리.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.application.suite;

/**
 * Service Provider Interfaces for storage.
 *
 * <p>Adapters implement these interfaces; the application layer depends only on them.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.testops.core.spi.DocumentStore} - per-project document, serialized per key</li>
 *   <li>{@link com.ryuqq.testops.core.spi.ProjectRegistry} - project metadata index</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.core.spi;

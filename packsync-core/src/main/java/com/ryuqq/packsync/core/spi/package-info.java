/**
 * Service Provider Interfaces of the reconciler core.
 *
 * <h2>Ports</h2>
 * <ul>
 *   <li>{@link com.ryuqq.packsync.core.spi.RegistryGateway} - upstream registry access
 *       (implemented by {@code packsync-adapter-registry})</li>
 *   <li>{@link com.ryuqq.packsync.core.spi.StateStore} - idempotency state
 *       (implemented by {@code packsync-adapter-filestore}, and in-memory in the testkit)</li>
 * </ul>
 *
 * <p>The pack generator port lives in {@link com.ryuqq.packsync.core.generator}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.packsync.core.spi;

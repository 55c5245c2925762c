/**
 * In-memory InitializerRegistry adapter.
 *
 * <p>Explicit identity → factory registry supplied by the host application at startup.
 * Replaces class-name based reflective construction.</p>
 *
 * @see com.ryuqq.startup.core.spi.InitializerRegistry
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.startup.adapter.inmemory.registry;

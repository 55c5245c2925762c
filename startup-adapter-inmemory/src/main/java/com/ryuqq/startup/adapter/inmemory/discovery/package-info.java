/**
 * Static ComponentDiscovery adapter.
 *
 * <p>Provides the ordered (identity, kind) batch consumed by bulk initialization,
 * built from explicit registration calls.</p>
 *
 * @see com.ryuqq.startup.core.spi.ComponentDiscovery
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.startup.adapter.inmemory.discovery;

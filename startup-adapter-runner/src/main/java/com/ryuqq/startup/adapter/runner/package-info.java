/**
 * Runner Adapter Layer - StartupOrchestrator / JobEngine 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.startup.adapter.runner.DependencyResolvingOrchestrator} - 메모이제이션 + 순환 감지 해석기</li>
 *   <li>{@link com.ryuqq.startup.adapter.runner.ExecutorJobEngine} - ExecutorService 기반 작업 엔진</li>
 *   <li>{@link com.ryuqq.startup.adapter.runner.ResolutionGate} - 동기/비동기 공용 FIFO 게이트</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DependencyResolvingOrchestrator, ExecutorJobEngine)
 *   ↓ implements
 * application (StartupOrchestrator, JobEngine interface)
 *   ↓ depends on
 * core (ComponentId, Initializer, StartupException)
 *   ↓ depends on
 * core/spi (InitializerRegistry, ComponentDiscovery interface)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.startup.adapter.runner;

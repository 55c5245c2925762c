/**
 * Service Provider Interface (SPI) 패키지.
 *
 * <p>오케스트레이터가 소비하는 외부 협력자 계약입니다.</p>
 *
 * <h2>포함된 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.startup.core.spi.InitializerRegistry} - 식별자 → Initializer 조회</li>
 *   <li>{@link com.ryuqq.startup.core.spi.ComponentDiscovery} - 일괄 초기화 대상 탐색</li>
 * </ul>
 *
 * <h2>구현 가이드</h2>
 * <p>in-memory 구현체는 startup-adapter-inmemory 모듈에서 제공됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.startup.core.spi;

/**
 * 초기화기 계약.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.startup.core.initializer.Initializer} - sealed 상위 타입</li>
 *   <li>{@link com.ryuqq.startup.core.initializer.SyncInitializer} - 동기 변형</li>
 *   <li>{@link com.ryuqq.startup.core.initializer.AsyncInitializer} - 비동기 변형</li>
 *   <li>{@link com.ryuqq.startup.core.initializer.InitializationContext} - create 호출 컨텍스트</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.startup.core.initializer;

/**
 * Startup Application Layer - 컴포넌트 초기화 조정 API.
 *
 * <p>이 패키지는 호스트 애플리케이션이 사용하는 소비자 API를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.startup.application.orchestrator.StartupOrchestrator} - 컴포넌트 초기화 조정자</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>명시적 생성:</strong> 전역 싱글톤 없이 생성자 주입으로 전달</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.startup.application.orchestrator;

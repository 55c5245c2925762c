package com.ryuqq.startup.core.initializer;

import com.ryuqq.startup.core.model.ComponentId;

/**
 * {@code create} 호출 시 전달되는 초기화 컨텍스트.
 *
 * <p><strong>제공 정보:</strong></p>
 * <ul>
 *   <li>생성 중인 컴포넌트 식별자</li>
 *   <li>호스트 애플리케이션이 오케스트레이터 생성 시 전달한 호스트 컨텍스트 (불투명 객체)</li>
 *   <li>이미 해석된 의존성 값 조회</li>
 * </ul>
 *
 * <p>{@code create} 안에서 오케스트레이터를 다시 호출하는 대신
 * {@link #dependency(ComponentId, Class)}로 선언한 의존성 값을 조회하십시오.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface InitializationContext {

    /**
     * 생성 중인 컴포넌트 식별자.
     *
     * @return ComponentId
     */
    ComponentId componentId();

    /**
     * 호스트 컨텍스트 조회.
     *
     * @return 호스트 컨텍스트 또는 null (설정되지 않은 경우)
     */
    Object hostContext();

    /**
     * 해석 완료된 의존성 값 조회.
     *
     * @param id 의존성 식별자
     * @param type 기대 타입
     * @param <T> 값 타입
     * @return 캐시된 의존성 값
     * @throws IllegalArgumentException id 또는 type이 null인 경우
     * @throws IllegalStateException 아직 해석되지 않은 경우
     * @throws ClassCastException 값이 type과 호환되지 않는 경우
     */
    <T> T dependency(ComponentId id, Class<T> type);
}

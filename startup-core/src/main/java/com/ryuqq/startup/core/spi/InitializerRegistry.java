package com.ryuqq.startup.core.spi;

import com.ryuqq.startup.core.initializer.Initializer;
import com.ryuqq.startup.core.model.ComponentId;

/**
 * Initializer Registry SPI.
 *
 * <p>식별자를 생성 가능한 {@link Initializer} 인스턴스로 변환합니다.
 * 호스트 애플리케이션이 시작 시점에 식별자별 팩토리를 등록하는 방식으로 구현합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>thread-safe: 동기/비동기 해석 경로에서 동시에 호출될 수 있음</li>
 *   <li>호출마다 새 인스턴스를 반환해도 무방 (오케스트레이터는 값만 캐시)</li>
 *   <li>실패 시 예외를 던지면 오케스트레이터가 InitializationFailedException으로 래핑</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface InitializerRegistry {

    /**
     * 식별자에 해당하는 Initializer 조회.
     *
     * @param id 컴포넌트 식별자
     * @return Initializer (non-null)
     * @throws com.ryuqq.startup.core.exception.UnknownComponentException 등록되지 않은 식별자인 경우
     * @throws RuntimeException 팩토리 실행 실패 시
     */
    Initializer<?> lookup(ComponentId id);
}

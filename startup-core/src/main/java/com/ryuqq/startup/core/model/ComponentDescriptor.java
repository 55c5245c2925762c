package com.ryuqq.startup.core.model;

/**
 * 탐색(discovery) 결과 한 건.
 *
 * <p>외부 탐색 메커니즘이 반환하는 (식별자, 실행 방식) 쌍이며,
 * 일괄 초기화(bulk initialize)의 입력 단위입니다.</p>
 *
 * @param id 컴포넌트 식별자
 * @param kind 실행 방식 (SYNC, ASYNC)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ComponentDescriptor(
    ComponentId id,
    InitializerKind kind
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 kind가 null인 경우
     */
    public ComponentDescriptor {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    /**
     * 동기 초기화 대상 Descriptor 생성.
     *
     * @param id 컴포넌트 식별자
     * @return ComponentDescriptor (kind=SYNC)
     */
    public static ComponentDescriptor sync(ComponentId id) {
        return new ComponentDescriptor(id, InitializerKind.SYNC);
    }

    /**
     * 비동기 초기화 대상 Descriptor 생성.
     *
     * @param id 컴포넌트 식별자
     * @return ComponentDescriptor (kind=ASYNC)
     */
    public static ComponentDescriptor async(ComponentId id) {
        return new ComponentDescriptor(id, InitializerKind.ASYNC);
    }
}
